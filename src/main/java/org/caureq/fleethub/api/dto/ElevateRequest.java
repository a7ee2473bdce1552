package org.caureq.fleethub.api.dto;

import jakarta.validation.constraints.NotBlank;

public record ElevateRequest(@NotBlank String password) {}
