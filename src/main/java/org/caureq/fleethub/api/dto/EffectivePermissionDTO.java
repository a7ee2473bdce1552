package org.caureq.fleethub.api.dto;

import org.caureq.fleethub.permission.AccessDecision;
import org.caureq.fleethub.permission.PermissionLevel;

public record EffectivePermissionDTO(String agentId, PermissionLevel level, int value, AccessDecision.Source source,
                                     boolean online) {}
