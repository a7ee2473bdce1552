package org.caureq.fleethub.api;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.caureq.fleethub.api.dto.ElevateRequest;
import org.caureq.fleethub.api.dto.LoginRequest;
import org.caureq.fleethub.api.dto.TokenResponse;
import org.caureq.fleethub.security.AuthenticatedUser;
import org.caureq.fleethub.service.AuthService;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {
    private final AuthService auth;

    @PostMapping("/login")
    public TokenResponse login(@Valid @RequestBody LoginRequest body) {
        return auth.login(body.username(), body.password());
    }

    /**
     * Exchanges a password re-entry for a short-lived elevated credential, to be sent as
     * {@code X-Elevated-Token} with SYSTEM_ADMIN commands.
     */
    @PostMapping("/elevate")
    public TokenResponse elevate(@RequestAttribute(AuthenticatedUser.REQUEST_ATTRIBUTE) AuthenticatedUser user,
                                 @Valid @RequestBody ElevateRequest body) {
        return auth.elevate(user, body.password());
    }
}
