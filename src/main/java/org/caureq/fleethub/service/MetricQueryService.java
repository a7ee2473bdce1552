package org.caureq.fleethub.service;

import lombok.RequiredArgsConstructor;
import org.caureq.fleethub.error.NotFoundException;
import org.caureq.fleethub.error.ValidationException;
import org.caureq.fleethub.model.FleetSummary;
import org.caureq.fleethub.model.MetricSnapshot;
import org.caureq.fleethub.permission.PermissionLevel;
import org.caureq.fleethub.permission.PermissionResolver;
import org.caureq.fleethub.registry.AgentRegistry;
import org.caureq.fleethub.security.AuthenticatedUser;
import org.caureq.fleethub.storage.TimeSeriesStore;
import org.caureq.fleethub.storage.archive.HistoryPoint;
import org.caureq.fleethub.storage.archive.MetricsArchive;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Metric reads behind the permission check: latest values from the registry, history from the
 * time-series store, bucketed history from the monthly archive.
 */
@Service
@RequiredArgsConstructor
public class MetricQueryService {
    static final Duration DEFAULT_RANGE = Duration.ofHours(1);

    private final AgentRegistry registry;
    private final PermissionResolver resolver;
    private final AgentQueryService agents;
    private final TimeSeriesStore store;
    private final MetricsArchive archive;
    private final Clock clock;

    public Map<String, MetricSnapshot> latestAll(AuthenticatedUser user) {
        var visible = agents.visibleIds(user);
        Map<String, MetricSnapshot> out = new LinkedHashMap<>();
        registry.allLatest().forEach((id, s) -> {
            if (visible.contains(id)) out.put(id, s);
        });
        return out;
    }

    public MetricSnapshot latest(AuthenticatedUser user, String agentId) {
        resolver.require(user.userId(), agentId, PermissionLevel.READ_ONLY);
        return registry.latest(agentId)
                .orElseThrow(() -> new NotFoundException("no metrics yet for agent: " + agentId));
    }

    public List<MetricSnapshot> history(AuthenticatedUser user, String agentId, Instant from, Instant to, Integer limit) {
        resolver.require(user.userId(), agentId, PermissionLevel.READ_ONLY);
        var end = to == null ? clock.instant() : to;
        var start = from == null ? end.minus(DEFAULT_RANGE) : from;
        checkRange(start, end);
        return store.query(agentId, start, end, limit == null ? 0 : limit);
    }

    /**
     * Bucketed history. Served from the archive when it is enabled, otherwise computed from
     * the time-series store over the same range.
     */
    public List<HistoryPoint> aggregated(AuthenticatedUser user, String agentId, Instant from, Instant to, String interval) {
        resolver.require(user.userId(), agentId, PermissionLevel.READ_ONLY);
        var end = to == null ? clock.instant() : to;
        var start = from == null ? end.minus(DEFAULT_RANGE) : from;
        checkRange(start, end);
        if (archive.enabled()) {
            return archive.queryAggregated(agentId, start, end, interval);
        }
        var raw = store.query(agentId, start, end, 0).stream().map(HistoryPoint::of).toList();
        return MetricsArchive.aggregate(agentId, raw, MetricsArchive.bucketWidth(interval, Duration.between(start, end)));
    }

    public FleetSummary summary(AuthenticatedUser user) {
        if (resolver.isSuperAdmin(user.userId())) return registry.summary();
        return registry.summarize(agents.visibleIds(user));
    }

    private static void checkRange(Instant start, Instant end) {
        if (start.isAfter(end)) throw new ValidationException("from must not be after to");
    }
}
