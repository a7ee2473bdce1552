package org.caureq.fleethub.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import org.caureq.fleethub.model.CpuStats;
import org.caureq.fleethub.model.DiskStats;
import org.caureq.fleethub.model.GpuStats;
import org.caureq.fleethub.model.MemoryStats;
import org.caureq.fleethub.model.NetworkStats;
import org.caureq.fleethub.model.NpuStats;
import org.caureq.fleethub.model.SystemInfo;

import java.util.List;

/** Hardware inventory, sent once after authentication. */
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public record StaticUpdate(CpuStats cpu,
                           MemoryStats memory,
                           List<DiskStats> disks,
                           List<NetworkStats> networks,
                           List<GpuStats> gpus,
                           List<NpuStats> npus,
                           SystemInfo systemInfo) {
    public StaticUpdate {
        disks = disks == null ? List.of() : disks;
        networks = networks == null ? List.of() : networks;
        gpus = gpus == null ? List.of() : gpus;
        npus = npus == null ? List.of() : npus;
    }
}
