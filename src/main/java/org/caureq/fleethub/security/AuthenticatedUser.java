package org.caureq.fleethub.security;

/** The caller behind a verified bearer token. */
public record AuthenticatedUser(long userId, String username) {
    /** Request attribute under which {@link BearerTokenFilter} stores the caller. */
    public static final String REQUEST_ATTRIBUTE = "fleethub.user";
}
