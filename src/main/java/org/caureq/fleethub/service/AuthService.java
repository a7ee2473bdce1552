package org.caureq.fleethub.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fleethub.api.dto.TokenResponse;
import org.caureq.fleethub.config.AppProps;
import org.caureq.fleethub.domain.User;
import org.caureq.fleethub.error.AuthenticationException;
import org.caureq.fleethub.repo.UserRepo;
import org.caureq.fleethub.security.AuthenticatedUser;
import org.caureq.fleethub.security.TokenService;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {
    private static final String BAD_CREDENTIALS = "invalid username or password";

    private final UserRepo users;
    private final PasswordEncoder passwordEncoder;
    private final TokenService tokens;
    private final AppProps props;
    private final Clock clock;

    @Transactional(readOnly = true)
    public TokenResponse login(String username, String password) {
        var user = users.findLive(username.trim())
                .filter(u -> passwordEncoder.matches(password, u.getPasswordHash()))
                .orElseThrow(() -> {
                    log.warn("login failed for '{}'", username);
                    return new AuthenticationException(BAD_CREDENTIALS);
                });
        var token = tokens.issueAccess(user.getId(), user.getUsername());
        log.info("user {} logged in", user.getUsername());
        return new TokenResponse(token, "Bearer", clock.instant().plus(tokens.accessTtl()),
                user.getId(), user.getUsername(), user.isSuperAdmin());
    }

    /** Re-checks the password and issues a short-lived elevated credential for the same user. */
    @Transactional(readOnly = true)
    public TokenResponse elevate(AuthenticatedUser caller, String password) {
        var user = users.findLiveById(caller.userId())
                .filter(u -> passwordEncoder.matches(password, u.getPasswordHash()))
                .orElseThrow(() -> new AuthenticationException("password check failed"));
        var token = tokens.issueElevated(user.getId(), user.getUsername());
        log.info("user {} elevated for {}", user.getUsername(), tokens.elevatedTtl());
        return new TokenResponse(token, "Elevated", clock.instant().plus(tokens.elevatedTtl()),
                user.getId(), user.getUsername(), user.isSuperAdmin());
    }

    /** Creates the configured superadmin if no live user carries that name. */
    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    public void bootstrapSuperAdmin() {
        var auth = props.auth();
        if (auth.superadminUsername() == null || auth.superadminUsername().isBlank()) return;
        if (users.findLive(auth.superadminUsername()).isPresent()) return;
        if (auth.superadminPassword() == null || auth.superadminPassword().isBlank()) {
            log.warn("superadmin '{}' not created: fleethub.auth.superadmin-password is empty", auth.superadminUsername());
            return;
        }
        users.save(User.builder()
                .username(auth.superadminUsername().trim())
                .passwordHash(passwordEncoder.encode(auth.superadminPassword()))
                .superAdmin(true)
                .build());
        log.info("bootstrapped superadmin '{}'", auth.superadminUsername());
    }
}
