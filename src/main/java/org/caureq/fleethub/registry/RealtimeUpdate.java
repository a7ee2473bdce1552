package org.caureq.fleethub.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import org.caureq.fleethub.model.DiskStats;
import org.caureq.fleethub.model.GpuStats;
import org.caureq.fleethub.model.NetworkStats;
import org.caureq.fleethub.model.NpuStats;

import java.util.List;

/** High-frequency cpu/memory/io deltas, merged into the latest snapshot in place. */
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public record RealtimeUpdate(double cpuUsage,
                             List<Double> cpuPerCore,
                             double cpuTemp,
                             long cpuFrequency,
                             long memoryUsed,
                             long memoryCached,
                             long swapUsed,
                             List<DiskStats> diskIo,
                             List<NetworkStats> networkIo,
                             List<Double> loadAverage,
                             List<GpuStats> gpus,
                             List<NpuStats> npus) {
    public RealtimeUpdate {
        cpuPerCore = cpuPerCore == null ? List.of() : cpuPerCore;
        diskIo = diskIo == null ? List.of() : diskIo;
        networkIo = networkIo == null ? List.of() : networkIo;
        loadAverage = loadAverage == null ? List.of() : loadAverage;
        gpus = gpus == null ? List.of() : gpus;
        npus = npus == null ? List.of() : npus;
    }
}
