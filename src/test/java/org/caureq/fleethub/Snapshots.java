package org.caureq.fleethub;

import org.caureq.fleethub.model.CpuStats;
import org.caureq.fleethub.model.DiskStats;
import org.caureq.fleethub.model.MemoryStats;
import org.caureq.fleethub.model.MetricSnapshot;
import org.caureq.fleethub.model.NetworkStats;

import java.time.Instant;
import java.util.List;

/** Snapshot fixtures shared by the tests. */
public final class Snapshots {
    public static final Instant T0 = Instant.parse("2026-01-15T10:00:00Z");

    private Snapshots() {}

    public static MetricSnapshot of(String agentId, Instant at, double cpu, long memUsed, long memTotal) {
        return MetricSnapshot.builder()
                .agentId(agentId)
                .timestamp(at)
                .cpu(CpuStats.builder().usagePercent(cpu).coreCount(4).build())
                .memory(MemoryStats.builder().used(memUsed).total(memTotal).available(memTotal - memUsed).build())
                .build();
    }

    public static MetricSnapshot web01() {
        return of("web-01", T0, 42.5, 4_000_000_000L, 8_000_000_000L);
    }

    public static MetricSnapshot detailed(String agentId, Instant at, double cpu) {
        return of(agentId, at, cpu, 1_000, 4_000).toBuilder()
                .disks(List.of(DiskStats.builder().mountPoint("/").device("sda1").total(100).used(40)
                        .readBytesPerSec(1_000).writeBytesPerSec(2_000).build()))
                .networks(List.of(NetworkStats.builder().iface("eth0").rxBytesPerSec(300).txBytesPerSec(400).up(true).build()))
                .build();
    }
}
