package org.caureq.fleethub.api.dto;

import java.time.Instant;

public record TokenResponse(String token, String tokenType, Instant expiresAt, long userId, String username,
                            boolean superAdmin) {}
