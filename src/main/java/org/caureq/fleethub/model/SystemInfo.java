package org.caureq.fleethub.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SystemInfo(String osName,
                         String osVersion,
                         String kernelVersion,
                         String hostname,
                         long bootTime,
                         long uptimeSeconds) {
}
