package org.caureq.fleethub.storage.archive;

import java.time.Instant;

public record RollupRow(String agentId,
                        Instant bucketStart,
                        double cpuAvg,
                        double cpuMax,
                        double memAvg,
                        double memMax,
                        long netRxTotal,
                        long netTxTotal,
                        int dataPoints) {
}
