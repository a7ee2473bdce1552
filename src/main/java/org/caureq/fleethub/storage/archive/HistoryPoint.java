package org.caureq.fleethub.storage.archive;

import org.caureq.fleethub.model.MetricSnapshot;

import java.time.Instant;

/** One raw archived row; network and disk figures are summed across devices, in bytes per second. */
public record HistoryPoint(String agentId,
                           Instant timestamp,
                           double cpuPercent,
                           double memPercent,
                           long diskReadPs,
                           long diskWritePs,
                           long netRxPs,
                           long netTxPs,
                           double gpuPercent,
                           double loadAvg1) {

    public static HistoryPoint of(MetricSnapshot s) {
        return new HistoryPoint(s.agentId(), s.timestamp(),
                s.cpu().usagePercent(), s.memory().usedPercent(),
                s.totalDiskReadPerSec(), s.totalDiskWritePerSec(),
                s.totalRxBytesPerSec(), s.totalTxBytesPerSec(),
                s.gpuPercent(), s.loadAvg1());
    }
}
