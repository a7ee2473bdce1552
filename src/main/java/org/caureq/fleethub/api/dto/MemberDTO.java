package org.caureq.fleethub.api.dto;

public record MemberDTO(Long userId, String username) {}
