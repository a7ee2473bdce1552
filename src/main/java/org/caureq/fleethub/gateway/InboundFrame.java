package org.caureq.fleethub.gateway;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.caureq.fleethub.model.MetricSnapshot;
import org.caureq.fleethub.registry.PeriodicUpdate;
import org.caureq.fleethub.registry.RealtimeUpdate;
import org.caureq.fleethub.registry.StaticUpdate;

import java.time.Instant;

/** Decoded agent-to-hub frames. */
public interface InboundFrame {

    String type();

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Auth(String token, String agentId, String hostname, String os, String arch, String version)
            implements InboundFrame {
        public String type() { return "auth"; }

        /** Agent id, falling back to the hostname. */
        public String effectiveId() {
            if (agentId != null && !agentId.isBlank()) return agentId.trim();
            return hostname == null ? null : hostname.trim();
        }
    }

    record StaticInfo(StaticUpdate update) implements InboundFrame {
        public String type() { return "static_info"; }
    }

    record Periodic(PeriodicUpdate update) implements InboundFrame {
        public String type() { return "periodic"; }
    }

    record Snapshot(MetricSnapshot snapshot) implements InboundFrame {
        public String type() { return "metrics"; }
    }

    record Realtime(RealtimeUpdate update) implements InboundFrame {
        public String type() { return "realtime"; }
    }

    record Heartbeat(Instant sentAt) implements InboundFrame {
        public String type() { return "heartbeat"; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CommandResult(String commandId, boolean success, String output, String error, Integer exitCode)
            implements InboundFrame {
        public String type() { return "command_result"; }
    }

    record Goodbye(String reason) implements InboundFrame {
        public String type() { return "goodbye"; }
    }
}
