package org.caureq.fleethub.api.dto;

import org.caureq.fleethub.domain.User;

import java.time.Instant;

public record UserDTO(Long id, String username, boolean superAdmin, Instant createdAt) {
    public static UserDTO of(User u) {
        return new UserDTO(u.getId(), u.getUsername(), u.isSuperAdmin(), u.getCreatedAt());
    }
}
