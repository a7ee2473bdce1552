package org.caureq.fleethub.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.With;

import java.time.Instant;
import java.util.List;

/**
 * Immutable point-in-time payload of one agent. Collections are never null.
 */
@With
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record MetricSnapshot(String agentId,
                             Instant timestamp,
                             CpuStats cpu,
                             MemoryStats memory,
                             List<DiskStats> disks,
                             List<NetworkStats> networks,
                             List<GpuStats> gpus,
                             List<NpuStats> npus,
                             List<UserSession> userSessions,
                             SystemInfo systemInfo,
                             List<Double> loadAverage) {
    public MetricSnapshot {
        cpu = cpu == null ? CpuStats.empty() : cpu;
        memory = memory == null ? MemoryStats.empty() : memory;
        disks = disks == null ? List.of() : List.copyOf(disks);
        networks = networks == null ? List.of() : List.copyOf(networks);
        gpus = gpus == null ? List.of() : List.copyOf(gpus);
        npus = npus == null ? List.of() : List.copyOf(npus);
        userSessions = userSessions == null ? List.of() : List.copyOf(userSessions);
        loadAverage = loadAverage == null ? List.of() : List.copyOf(loadAverage);
    }

    public static MetricSnapshot empty(String agentId, Instant timestamp) {
        return MetricSnapshot.builder().agentId(agentId).timestamp(timestamp).build();
    }

    public long totalRxBytesPerSec() {
        return networks.stream().mapToLong(NetworkStats::rxBytesPerSec).sum();
    }

    public long totalTxBytesPerSec() {
        return networks.stream().mapToLong(NetworkStats::txBytesPerSec).sum();
    }

    public long totalDiskReadPerSec() {
        return disks.stream().mapToLong(DiskStats::readBytesPerSec).sum();
    }

    public long totalDiskWritePerSec() {
        return disks.stream().mapToLong(DiskStats::writeBytesPerSec).sum();
    }

    public double gpuPercent() {
        return gpus.stream().mapToDouble(GpuStats::usagePercent).average().orElse(0.0);
    }

    public double loadAvg1() {
        return loadAverage.isEmpty() ? 0.0 : loadAverage.get(0);
    }
}
