package org.caureq.fleethub.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record GroupRequest(@NotBlank @Size(max = 100) String name, @Size(max = 500) String description) {}
