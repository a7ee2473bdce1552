package org.caureq.fleethub.permission;

/**
 * Outcome of a resolution: either the agent is invisible to the user, or it is visible
 * with exactly one level. Invisible is not the same as {@link PermissionLevel#READ_ONLY}.
 */
public record AccessDecision(boolean visible, PermissionLevel level, Source source) {

    public enum Source { SUPERADMIN, OVERRIDE, GROUP, NONE }

    private static final AccessDecision INVISIBLE = new AccessDecision(false, null, Source.NONE);

    public static AccessDecision invisible() { return INVISIBLE; }

    public static AccessDecision granted(PermissionLevel level, Source source) {
        return new AccessDecision(true, level, source);
    }

    public boolean allows(PermissionLevel required) {
        return visible && level.atLeast(required);
    }
}
