package org.caureq.fleethub.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.With;

import java.util.List;

@With
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record NetworkStats(@JsonProperty("interface") String iface,
                           long rxBytesPerSec,
                           long txBytesPerSec,
                           boolean up,
                           String macAddress,
                           List<String> ipAddresses,
                           long speedMbps) {
    public NetworkStats {
        ipAddresses = ipAddresses == null ? List.of() : List.copyOf(ipAddresses);
    }
}
