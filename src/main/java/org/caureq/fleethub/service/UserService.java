package org.caureq.fleethub.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fleethub.api.dto.CreateUserRequest;
import org.caureq.fleethub.api.dto.UserDTO;
import org.caureq.fleethub.domain.User;
import org.caureq.fleethub.error.ConflictException;
import org.caureq.fleethub.error.NotFoundException;
import org.caureq.fleethub.error.ValidationException;
import org.caureq.fleethub.permission.VisibilityCache;
import org.caureq.fleethub.repo.UserRepo;
import org.caureq.fleethub.security.AuthenticatedUser;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/** Superadmin-only user management. Deletion is a tombstone. */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {
    private final UserRepo users;
    private final PasswordEncoder passwordEncoder;
    private final VisibilityCache visibility;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<UserDTO> list() {
        return users.findByDeletedAtIsNullOrderByUsernameAsc().stream().map(UserDTO::of).toList();
    }

    @Transactional
    public UserDTO create(CreateUserRequest req) {
        var name = req.username().trim();
        if (users.findLive(name).isPresent()) throw new ConflictException("username already taken: " + name);
        var u = users.save(User.builder()
                .username(name)
                .passwordHash(passwordEncoder.encode(req.password()))
                .superAdmin(req.superAdmin())
                .build());
        log.info("user created id={} name={} superAdmin={}", u.getId(), name, u.isSuperAdmin());
        return UserDTO.of(u);
    }

    @Transactional
    public void delete(AuthenticatedUser caller, long userId) {
        if (caller.userId() == userId) throw new ValidationException("cannot delete yourself");
        var u = users.findLiveById(userId).orElseThrow(() -> new NotFoundException("user not found: " + userId));
        u.setDeletedAt(clock.instant());
        users.save(u);
        visibility.invalidateAll();
        log.info("user deleted id={} name={} by {}", userId, u.getUsername(), caller.username());
    }
}
