package org.caureq.fleethub.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

public record BindingRequest(@NotBlank String agentId, @Min(0) @Max(3) int level) {}
