package org.caureq.fleethub.api;

import lombok.RequiredArgsConstructor;
import org.caureq.fleethub.model.FleetSummary;
import org.caureq.fleethub.model.MetricSnapshot;
import org.caureq.fleethub.security.AuthenticatedUser;
import org.caureq.fleethub.service.MetricQueryService;
import org.caureq.fleethub.storage.archive.HistoryPoint;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Metric read APIs.
 *
 * Latest values come from the in-memory registry; history from the configured time-series
 * backend; aggregated history from the monthly archive.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class MetricController {
    private final MetricQueryService service;

    @GetMapping("/metrics/latest")
    public Map<String, MetricSnapshot> latestAll(
            @RequestAttribute(AuthenticatedUser.REQUEST_ATTRIBUTE) AuthenticatedUser user) {
        return service.latestAll(user);
    }

    @GetMapping("/agents/{id}/metrics/latest")
    public MetricSnapshot latest(@RequestAttribute(AuthenticatedUser.REQUEST_ATTRIBUTE) AuthenticatedUser user,
                                 @PathVariable String id) {
        return service.latest(user, id);
    }

    /**
     * Raw history, chronological.
     *
     * @param from inclusive lower bound, ISO-8601 (default: one hour before {@code to})
     * @param to inclusive upper bound (default: now)
     * @param limit keep only the most recent points (0 or absent: backend maximum)
     */
    @GetMapping("/agents/{id}/metrics")
    public List<MetricSnapshot> history(
            @RequestAttribute(AuthenticatedUser.REQUEST_ATTRIBUTE) AuthenticatedUser user,
            @PathVariable String id,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(value = "limit", required = false) Integer limit) {
        return service.history(user, id, from, to, limit);
    }

    /** Bucketed averages; {@code interval} is 1m, 5m, 15m, 1h or 1d, or absent for automatic. */
    @GetMapping("/agents/{id}/metrics/aggregated")
    public List<HistoryPoint> aggregated(
            @RequestAttribute(AuthenticatedUser.REQUEST_ATTRIBUTE) AuthenticatedUser user,
            @PathVariable String id,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(value = "interval", required = false) String interval) {
        return service.aggregated(user, id, from, to, interval);
    }

    @GetMapping("/metrics/summary")
    public FleetSummary summary(@RequestAttribute(AuthenticatedUser.REQUEST_ATTRIBUTE) AuthenticatedUser user) {
        return service.summary(user);
    }
}
