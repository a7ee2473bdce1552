package org.caureq.fleethub.api.dto;

import java.time.Instant;

public record HealthDTO(String status, Instant time, int connectedAgents, int subscribers, String storageBackend,
                        boolean storageDegraded, long storageFailures, String lastStorageError) {}
