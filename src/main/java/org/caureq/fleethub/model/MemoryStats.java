package org.caureq.fleethub.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.With;

@With
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record MemoryStats(long total,
                          long used,
                          long available,
                          long swapTotal,
                          long swapUsed,
                          long cached,
                          String memoryType) {

    public static MemoryStats empty() {
        return MemoryStats.builder().build();
    }

    public double usedPercent() {
        return total > 0 ? (double) used / total * 100.0 : 0.0;
    }
}
