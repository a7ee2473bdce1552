package org.caureq.fleethub.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fleethub.api.dto.AuditEntryDTO;
import org.caureq.fleethub.api.dto.AuditStatsDTO;
import org.caureq.fleethub.api.dto.PageDTO;
import org.caureq.fleethub.command.CommandRequest;
import org.caureq.fleethub.command.CommandType;
import org.caureq.fleethub.config.AppProps;
import org.caureq.fleethub.domain.AuditLog;
import org.caureq.fleethub.domain.AuditStatus;
import org.caureq.fleethub.error.ValidationException;
import org.caureq.fleethub.repo.AuditLogRepo;
import org.caureq.fleethub.security.AuthenticatedUser;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Command audit trail. A row is inserted as PENDING before the command leaves the hub and
 * moved to a terminal status once; retention is the only other writer.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditService {
    private static final int MAX_ERROR = 2000;
    private static final int MAX_PARAMS = 4000;

    private final AuditLogRepo repo;
    private final ObjectMapper objectMapper;
    private final AppProps props;
    private final Clock clock;

    @Transactional
    public long begin(AuthenticatedUser actor, String clientIp, String agentId, String agentHostname,
                      CommandType type, String commandId, CommandRequest request) {
        String params;
        try {
            params = objectMapper.writeValueAsString(request.params());
        } catch (JsonProcessingException e) {
            params = String.valueOf(request.params());
        }
        var row = repo.save(AuditLog.builder()
                .userId(actor.userId()).username(actor.username()).clientIp(clientIp)
                .agentId(agentId).agentHostname(agentHostname)
                .commandType(type.name()).commandId(commandId)
                .target(request.target()).parameters(truncate(params, MAX_PARAMS))
                .status(AuditStatus.PENDING)
                .ts(clock.instant())
                .build());
        return row.getId();
    }

    /** Returns false when the row was already terminal; it is never rewritten. */
    @Transactional
    public boolean complete(long auditId, AuditStatus status, String error, long durationMs) {
        if (!status.isTerminal()) throw new IllegalArgumentException("not a terminal status: " + status);
        int n = repo.complete(auditId, status, truncate(error, MAX_ERROR), durationMs);
        if (n == 0) log.warn("audit row {} already finalized, ignoring {}", auditId, status);
        return n == 1;
    }

    @Transactional(readOnly = true)
    public PageDTO<AuditEntryDTO> search(Long userId, String agentId, String commandType, String status,
                                         Integer page, Integer size) {
        int p = (page == null || page < 0) ? 0 : page;
        int s = (size == null || size <= 0 || size > 500) ? 50 : size;
        var type = blankToNull(commandType) == null ? null : CommandType.parse(commandType).name();
        var res = repo.search(userId, blankToNull(agentId), type, parseStatus(status), PageRequest.of(p, s));
        return new PageDTO<>(res.map(AuditEntryDTO::of).getContent(), p, s, res.getTotalElements());
    }

    @Transactional(readOnly = true)
    public AuditStatsDTO stats(Instant since) {
        var from = since == null ? clock.instant().minus(Duration.ofDays(1)) : since;
        Map<String, Long> byType = new TreeMap<>();
        for (Object[] row : repo.countByType(from)) {
            byType.put((String) row[0], ((Number) row[1]).longValue());
        }
        return new AuditStatsDTO(from,
                repo.countByTsAfter(from),
                repo.countByTsAfterAndStatus(from, AuditStatus.SUCCEEDED),
                repo.countByTsAfterAndStatus(from, AuditStatus.FAILED),
                repo.countByTsAfterAndStatus(from, AuditStatus.TIMED_OUT),
                byType);
    }

    @Scheduled(cron = "0 30 3 * * *", zone = "UTC")
    @Transactional
    public int prune() {
        var cutoff = clock.instant().minus(Duration.ofDays(props.audit().retentionDays()));
        int n = repo.deleteOlderThan(cutoff);
        if (n > 0) log.info("[audit] pruned {} rows older than {}", n, cutoff);
        return n;
    }

    private static AuditStatus parseStatus(String raw) {
        if (blankToNull(raw) == null) return null;
        try {
            return AuditStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("unknown audit status: " + raw);
        }
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }

    private static String truncate(String s, int max) {
        return s == null || s.length() <= max ? s : s.substring(0, max);
    }
}
