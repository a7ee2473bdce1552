package org.caureq.fleethub.model;

import lombok.Builder;
import lombok.With;

import java.time.Instant;

/**
 * A connected agent as seen by the registry. Only the gateway creates, touches or removes these.
 */
@Builder(toBuilder = true)
public record Agent(String id,
                    String hostname,
                    String os,
                    String arch,
                    String version,
                    Instant connectedAt,
                    @With Instant lastHeartbeat,
                    TransportKind transport,
                    String connectionId) {
}
