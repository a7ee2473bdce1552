package org.caureq.fleethub.model;

import java.time.Instant;

public record AgentEvent(Type type, String agentId, Instant timestamp, Object payload) {

    public enum Type { STATE, AGENT_ONLINE, AGENT_OFFLINE, METRICS }

    public static AgentEvent online(Agent agent, Instant at) {
        return new AgentEvent(Type.AGENT_ONLINE, agent.id(), at, agent);
    }

    public static AgentEvent offline(String agentId, Instant at, String cause) {
        return new AgentEvent(Type.AGENT_OFFLINE, agentId, at, cause);
    }

    public static AgentEvent metrics(MetricSnapshot snapshot) {
        return new AgentEvent(Type.METRICS, snapshot.agentId(), snapshot.timestamp(), snapshot);
    }
}
