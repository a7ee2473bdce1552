package org.caureq.fleethub.api.dto;

import org.caureq.fleethub.model.Agent;
import org.caureq.fleethub.model.TransportKind;
import org.caureq.fleethub.permission.AccessDecision;
import org.caureq.fleethub.permission.PermissionLevel;

import java.time.Instant;

/** A connected agent together with the caller's level on it. */
public record AgentDTO(String id,
                       String hostname,
                       String os,
                       String arch,
                       String version,
                       Instant connectedAt,
                       Instant lastHeartbeat,
                       TransportKind transport,
                       PermissionLevel permission,
                       AccessDecision.Source permissionSource) {

    public static AgentDTO of(Agent a, AccessDecision d) {
        return new AgentDTO(a.id(), a.hostname(), a.os(), a.arch(), a.version(), a.connectedAt(),
                a.lastHeartbeat(), a.transport(), d.level(), d.source());
    }
}
