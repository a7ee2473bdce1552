package org.caureq.fleethub.api.dto;

import java.time.Instant;
import java.util.Map;

public record AuditStatsDTO(Instant since, long total, long succeeded, long failed, long timedOut,
                            Map<String, Long> byType) {}
