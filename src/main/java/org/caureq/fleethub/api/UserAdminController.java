package org.caureq.fleethub.api;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.caureq.fleethub.api.dto.CreateUserRequest;
import org.caureq.fleethub.api.dto.EffectivePermissionDTO;
import org.caureq.fleethub.api.dto.PermissionRequest;
import org.caureq.fleethub.api.dto.UserDTO;
import org.caureq.fleethub.security.AuthenticatedUser;
import org.caureq.fleethub.service.AccessControlService;
import org.caureq.fleethub.service.UserService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/** Users and their per-agent overrides (superadmin only). */
@RestController
@RequestMapping("/api/admin/users")
@RequiredArgsConstructor
public class UserAdminController {
    private final UserService users;
    private final AccessControlService access;

    @GetMapping
    public List<UserDTO> list() {
        return users.list();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public UserDTO create(@Valid @RequestBody CreateUserRequest body) {
        return users.create(body);
    }

    @DeleteMapping("/{userId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@RequestAttribute(AuthenticatedUser.REQUEST_ATTRIBUTE) AuthenticatedUser admin,
                       @PathVariable long userId) {
        users.delete(admin, userId);
    }

    @GetMapping("/{userId}/permissions")
    public List<EffectivePermissionDTO> permissions(@PathVariable long userId) {
        return access.effective(userId);
    }

    /** Sets the override; it replaces whatever the user's groups would give, up or down. */
    @PutMapping("/{userId}/agents/{agentId}/permission")
    public EffectivePermissionDTO grant(@RequestAttribute(AuthenticatedUser.REQUEST_ATTRIBUTE) AuthenticatedUser admin,
                                        @PathVariable long userId, @PathVariable String agentId,
                                        @Valid @RequestBody PermissionRequest body) {
        return access.grant(admin, userId, agentId, body.level());
    }

    @DeleteMapping("/{userId}/agents/{agentId}/permission")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void revoke(@PathVariable long userId, @PathVariable String agentId) {
        access.revoke(userId, agentId);
    }
}
