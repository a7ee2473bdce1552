package org.caureq.fleethub.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.With;

@With
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record DiskStats(String mountPoint,
                        String device,
                        String fsType,
                        long total,
                        long used,
                        long available,
                        double usagePercent,
                        long readBytesPerSec,
                        long writeBytesPerSec,
                        String model,
                        String diskType) {

    public boolean sameDisk(DiskStats other) {
        return (device != null && device.equals(other.device))
                || (mountPoint != null && mountPoint.equals(other.mountPoint));
    }
}
