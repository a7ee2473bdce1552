package org.caureq.fleethub.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.With;

@With
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record NpuStats(int index,
                       String name,
                       String vendor,
                       double usagePercent,
                       long memoryTotal,
                       long memoryUsed,
                       double temperature) {
}
