package org.caureq.fleethub.api.dto;

import org.caureq.fleethub.domain.AuditLog;
import org.caureq.fleethub.domain.AuditStatus;

import java.time.Instant;

public record AuditEntryDTO(Long id, Long userId, String username, String clientIp, String agentId,
                            String agentHostname, String commandType, String commandId, String target,
                            String parameters, AuditStatus status, String error, Long durationMs, Instant ts) {

    public static AuditEntryDTO of(AuditLog a) {
        return new AuditEntryDTO(a.getId(), a.getUserId(), a.getUsername(), a.getClientIp(), a.getAgentId(),
                a.getAgentHostname(), a.getCommandType(), a.getCommandId(), a.getTarget(), a.getParameters(),
                a.getStatus(), a.getError(), a.getDurationMs(), a.getTs());
    }
}
