package org.caureq.fleethub.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.With;

import java.util.List;

@With
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record CpuStats(double usagePercent,
                       List<Double> perCoreUsage,
                       String model,
                       String vendor,
                       int coreCount,
                       int logicalCores,
                       String architecture,
                       long frequencyMhz,
                       long frequencyMaxMhz,
                       double temperature) {
    public CpuStats {
        perCoreUsage = perCoreUsage == null ? List.of() : List.copyOf(perCoreUsage);
    }

    public static CpuStats empty() {
        return CpuStats.builder().build();
    }
}
