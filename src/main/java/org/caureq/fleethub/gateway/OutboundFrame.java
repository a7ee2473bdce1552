package org.caureq.fleethub.gateway;

import java.util.Map;

/** Hub-to-agent envelope: {@code {"type": ..., "payload": ...}}. */
public record OutboundFrame(String type, Object payload) {

    public static OutboundFrame authOk(String agentId, String connectionId) {
        return new OutboundFrame("auth_ok", Map.of("agentId", agentId, "connectionId", connectionId));
    }

    public static OutboundFrame error(String message) {
        return new OutboundFrame("error", Map.of("message", message));
    }

    public static OutboundFrame heartbeatAck(long serverTimeMs) {
        return new OutboundFrame("heartbeat_ack", Map.of("serverTime", serverTimeMs));
    }

    public static OutboundFrame command(Object command) {
        return new OutboundFrame("command", command);
    }
}
