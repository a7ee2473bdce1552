package org.caureq.fleethub.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

public record PermissionRequest(@Min(0) @Max(3) int level) {}
