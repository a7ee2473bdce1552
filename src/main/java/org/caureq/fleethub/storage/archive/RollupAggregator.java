package org.caureq.fleethub.storage.archive;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Produces hourly and daily rollups from raw partitions. Rollups are append-only: a bucket that
 * already has a row for an agent is skipped, never rewritten, including when another run
 * inserted it between the existence check and the insert.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RollupAggregator {
    private final MetricsArchive archive;

    public record Reconciliation(String agentId, Granularity granularity, Instant bucketStart,
                                 int rollupPoints, int rawPoints) {
        public boolean consistent() { return rollupPoints == rawPoints; }
    }

    @Scheduled(cron = "${fleethub.archive.hourly-cron:0 5 * * * *}", zone = "UTC")
    public void runHourly() {
        if (!archive.enabled()) return;
        var bucket = Granularity.HOURLY.truncate(archive.clock().instant()).minus(Granularity.HOURLY.width());
        run(Granularity.HOURLY, bucket);
    }

    @Scheduled(cron = "${fleethub.archive.daily-cron:0 15 0 * * *}", zone = "UTC")
    public void runDaily() {
        if (!archive.enabled()) return;
        var bucket = Granularity.DAILY.truncate(archive.clock().instant()).minus(Granularity.DAILY.width());
        run(Granularity.DAILY, bucket);
    }

    private void run(Granularity g, Instant bucketStart) {
        try {
            int n = aggregate(g, bucketStart);
            log.info("[rollup] {} bucket {} -> {} agents", g, bucketStart, n);
        } catch (DataAccessException e) {
            log.warn("[rollup] {} bucket {} failed: {}", g, bucketStart, e.getMessage());
        }
    }

    /** Aggregates one bucket for every agent with raw data in it. Returns the number of rows written. */
    public int aggregate(Granularity g, Instant bucketStart) {
        var start = g.truncate(bucketStart);
        var end = start.plus(g.width());
        int written = 0;
        for (var agentId : archive.agentsWithData(start, end)) {
            if (archive.rollupExists(g, agentId, start)) continue;
            var raw = archive.rawBucket(agentId, start, end);
            if (raw.isEmpty()) continue;
            try {
                archive.insertRollup(g, summarize(agentId, start, raw));
                written++;
            } catch (DuplicateKeyException e) {
                log.debug("[rollup] {} bucket {} for {} written concurrently", g, start, agentId);
            }
        }
        return written;
    }

    static RollupRow summarize(String agentId, Instant bucketStart, List<HistoryPoint> raw) {
        double cpuSum = 0, memSum = 0, cpuMax = 0, memMax = 0;
        long rx = 0, tx = 0;
        for (var p : raw) {
            cpuSum += p.cpuPercent();
            memSum += p.memPercent();
            cpuMax = Math.max(cpuMax, p.cpuPercent());
            memMax = Math.max(memMax, p.memPercent());
            rx += p.netRxPs();
            tx += p.netTxPs();
        }
        int n = raw.size();
        return new RollupRow(agentId, bucketStart, cpuSum / n, cpuMax, memSum / n, memMax, rx, tx, n);
    }

    /** Compares a rollup's point count with the raw rows still present for its bucket. */
    public Reconciliation reconcile(Granularity g, String agentId, Instant bucketStart) {
        var start = g.truncate(bucketStart);
        var rows = archive.rollups(g, agentId, start, start);
        int rollupPoints = rows.isEmpty() ? 0 : rows.get(0).dataPoints();
        int rawPoints = archive.rawBucket(agentId, start, start.plus(g.width())).size();
        return new Reconciliation(agentId, g, start, rollupPoints, rawPoints);
    }
}
