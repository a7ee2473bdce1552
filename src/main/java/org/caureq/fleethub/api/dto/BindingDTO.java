package org.caureq.fleethub.api.dto;

import org.caureq.fleethub.permission.PermissionLevel;

public record BindingDTO(String agentId, PermissionLevel level) {}
