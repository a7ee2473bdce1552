package org.caureq.fleethub.permission;

import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Read-only view of the authorization graph the resolver works from. Deleted users, groups,
 * memberships, bindings and overrides are never returned.
 */
public interface PermissionGraph {

    record Subject(long userId, String username, boolean superAdmin) {}

    Optional<Subject> subject(long userId);

    /** Max ceiling across live groups containing the user and bound to the agent. */
    OptionalInt groupCeiling(long userId, String agentId);

    OptionalInt override(long userId, String agentId);

    Map<String, Integer> groupCeilings(long userId);

    Map<String, Integer> overrides(long userId);
}
