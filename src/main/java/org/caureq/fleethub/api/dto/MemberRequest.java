package org.caureq.fleethub.api.dto;

import jakarta.validation.constraints.NotNull;

public record MemberRequest(@NotNull Long userId) {}
