package org.caureq.fleethub.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fleethub.command.PendingCommands;
import org.caureq.fleethub.config.AppProps;
import org.caureq.fleethub.error.ConflictException;
import org.caureq.fleethub.error.ValidationException;
import org.caureq.fleethub.model.Agent;
import org.caureq.fleethub.model.AgentEvent;
import org.caureq.fleethub.model.MetricSnapshot;
import org.caureq.fleethub.registry.AgentRegistry;
import org.caureq.fleethub.security.AgentTokenValidator;
import org.caureq.fleethub.service.IngestService;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Transport-neutral agent session handling. The WebSocket and gRPC adapters hand every
 * inbound frame and every close to this class; all of an agent's state changes go through here.
 *
 * <p>Every way an agent can go away ends in {@link #agentGone}, which runs its teardown once per
 * connection and publishes exactly one {@code AGENT_OFFLINE}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AgentGateway {
    private final AgentRegistry registry;
    private final EventBus bus;
    private final FrameDecoder decoder;
    private final AgentTokenValidator agentTokens;
    private final IngestService ingest;
    private final PendingCommands pending;
    private final AppProps props;
    private final Clock clock;

    private final Map<String, AgentConnection> connections = new ConcurrentHashMap<>();
    private final Map<String, AgentConnection> byAgent = new ConcurrentHashMap<>();

    public void accept(AgentConnection conn) {
        connections.put(conn.id(), conn);
        log.debug("conn={} opened from {} over {}", conn.id(), conn.remoteAddress(), conn.transport());
    }

    /** Entry point for text transports. Never throws. */
    public void onMessage(AgentConnection conn, String raw) {
        JsonNode node;
        try {
            node = decoder.parse(raw);
        } catch (ValidationException e) {
            invalidFrame(conn, e);
            return;
        }
        onMessage(conn, node);
    }

    /** Entry point for already parsed JSON frames. Never throws. */
    public void onMessage(AgentConnection conn, JsonNode raw) {
        InboundFrame frame;
        try {
            frame = decoder.decode(raw);
        } catch (ValidationException e) {
            invalidFrame(conn, e);
            return;
        }
        onFrame(conn, frame);
    }

    private void invalidFrame(AgentConnection conn, ValidationException e) {
        if (conn.state() == ConnectionState.CONNECTING) {
            reject(conn, "malformed auth frame: " + e.getMessage());
        } else {
            log.warn("conn={} agent={} rejected frame: {}", conn.id(), conn.agentId(), e.getMessage());
            conn.send(OutboundFrame.error(e.getMessage()));
        }
    }

    public void onFrame(AgentConnection conn, InboundFrame frame) {
        var state = conn.state();
        if (state == ConnectionState.CONNECTING) {
            if (frame instanceof InboundFrame.Auth auth) {
                authenticate(conn, auth);
            } else {
                reject(conn, "first frame must be auth, got " + frame.type());
            }
            return;
        }
        if (state != ConnectionState.STREAMING) {
            log.debug("conn={} dropping {} in state {}", conn.id(), frame.type(), state);
            return;
        }

        var agentId = conn.agentId();
        var now = clock.instant();
        registry.touch(agentId, now);

        if (frame instanceof InboundFrame.Auth) {
            conn.send(OutboundFrame.error("already authenticated"));
        } else if (frame instanceof InboundFrame.Heartbeat) {
            conn.send(OutboundFrame.heartbeatAck(now.toEpochMilli()));
        } else if (frame instanceof InboundFrame.StaticInfo s) {
            registry.mergeStatic(agentId, s.update(), now);
            registry.latest(agentId).ifPresent(this::publish);
        } else if (frame instanceof InboundFrame.Periodic p) {
            registry.mergePeriodic(agentId, p.update(), now);
            registry.latest(agentId).ifPresent(this::publish);
        } else if (frame instanceof InboundFrame.Realtime r) {
            var merged = registry.mergeRealtime(agentId, r.update(), now);
            ingest.persist(merged);
            publish(merged);
        } else if (frame instanceof InboundFrame.Snapshot s) {
            var snapshot = s.snapshot().toBuilder()
                    .agentId(agentId)
                    .timestamp(s.snapshot().timestamp() == null ? now : s.snapshot().timestamp())
                    .build();
            var stored = registry.updateSnapshot(snapshot);
            ingest.persist(stored);
            publish(stored);
        } else if (frame instanceof InboundFrame.CommandResult r) {
            pending.complete(agentId, r);
        } else if (frame instanceof InboundFrame.Goodbye g) {
            log.info("agent {} said goodbye: {}", agentId, g.reason());
            agentGone(conn, DisconnectCause.GOODBYE);
        }
    }

    /** The transport's own credential wins over the one inside the auth frame. */
    void authenticate(AgentConnection conn, InboundFrame.Auth auth) {
        var token = conn.transportToken() != null ? conn.transportToken() : auth.token();
        var tokenName = agentTokens.validate(token);
        if (tokenName.isEmpty()) {
            log.warn("conn={} from {} rejected: invalid agent token", conn.id(), conn.remoteAddress());
            reject(conn, "invalid agent token");
            return;
        }
        var agentId = auth.effectiveId();
        if (agentId == null || agentId.isEmpty()) {
            reject(conn, "auth frame needs agentId or hostname");
            return;
        }

        var now = clock.instant();
        var agent = Agent.builder()
                .id(agentId)
                .hostname(auth.hostname())
                .os(auth.os())
                .arch(auth.arch())
                .version(auth.version())
                .connectedAt(now)
                .lastHeartbeat(now)
                .transport(conn.transport())
                .connectionId(conn.id())
                .build();
        try {
            registry.registerAgent(agent);
        } catch (ConflictException e) {
            log.warn("conn={} rejected: {}", conn.id(), e.getMessage());
            reject(conn, e.getMessage());
            return;
        }
        conn.bindAgent(agentId);
        if (!conn.tryTransition(ConnectionState.AUTHENTICATED)) {
            // transport closed while we were registering
            registry.unregisterAgent(agentId, conn.id());
            return;
        }
        byAgent.put(agentId, conn);
        conn.send(OutboundFrame.authOk(agentId, conn.id()));
        if (!conn.tryTransition(ConnectionState.STREAMING)) return;
        bus.publish(AgentEvent.online(agent, now));
        log.info("agent {} authenticated (token={}, transport={})", agentId, tokenName.get(), conn.transport());
    }

    /** Transport reports the connection is gone (closed by peer, I/O error, stream completed). */
    public void onTransportClosed(AgentConnection conn, DisconnectCause cause) {
        if (conn.agentId() == null) {
            if (conn.claimTeardown()) {
                connections.remove(conn.id());
                conn.tryTransition(ConnectionState.CLOSED);
            }
            return;
        }
        agentGone(conn, cause);
    }

    /**
     * Single teardown path: unregister, fail pending commands, close the transport and publish
     * one AGENT_OFFLINE. Later calls for the same connection are no-ops.
     */
    public void agentGone(AgentConnection conn, DisconnectCause cause) {
        if (!conn.claimTeardown()) return;
        connections.remove(conn.id());
        conn.tryTransition(cause.graceful() ? ConnectionState.DRAINING : ConnectionState.LOST);

        var agentId = conn.agentId();
        Optional<Agent> removed = Optional.empty();
        if (agentId != null) {
            byAgent.remove(agentId, conn);
            removed = registry.unregisterAgent(agentId, conn.id());
            pending.failAll(agentId, cause.label());
        }
        conn.tryTransition(ConnectionState.CLOSED);
        conn.close(cause.label());

        if (removed.isPresent()) {
            bus.publish(AgentEvent.offline(agentId, clock.instant(), cause.label()));
            log.info("agent {} gone: {}", agentId, cause.label());
        }
    }

    /** Closes a connection that never made it past authentication. No registry side effects. */
    private void reject(AgentConnection conn, String reason) {
        if (!conn.claimTeardown()) return;
        connections.remove(conn.id());
        conn.send(OutboundFrame.error(reason));
        conn.tryTransition(ConnectionState.CLOSED);
        conn.close(reason);
    }

    @Scheduled(fixedDelayString = "${fleethub.gateway.sweep-interval:PT5S}")
    public void sweep() {
        var now = clock.instant();
        var gw = props.gateway();

        for (var stale : registry.findStale(now.minus(gw.heartbeatTimeout()))) {
            var conn = byAgent.get(stale.id());
            if (conn != null && conn.id().equals(stale.connectionId())) {
                log.warn("agent {} missed heartbeats since {}", stale.id(), stale.lastHeartbeat());
                agentGone(conn, DisconnectCause.HEARTBEAT_TIMEOUT);
            } else if (registry.unregisterAgent(stale.id(), stale.connectionId()).isPresent()) {
                // registry entry without a live connection
                pending.failAll(stale.id(), DisconnectCause.HEARTBEAT_TIMEOUT.label());
                bus.publish(AgentEvent.offline(stale.id(), now, DisconnectCause.HEARTBEAT_TIMEOUT.label()));
            }
        }

        var handshakeCutoff = now.minus(gw.handshakeTimeout());
        for (var conn : connections.values()) {
            if (conn.state() == ConnectionState.CONNECTING && conn.openedAt().isBefore(handshakeCutoff)) {
                log.warn("conn={} from {} did not authenticate in {}", conn.id(), conn.remoteAddress(), gw.handshakeTimeout());
                reject(conn, "handshake timeout");
            }
        }
    }

    /** The live connection of an agent, if any. */
    public Optional<AgentConnection> connection(String agentId) {
        return Optional.ofNullable(byAgent.get(agentId));
    }

    public int openConnections() {
        return connections.size();
    }

    @PreDestroy
    public void shutdown() {
        var all = new ArrayList<>(connections.values());
        if (!all.isEmpty()) log.info("draining {} agent connection(s)", all.size());
        for (var conn : all) {
            if (conn.agentId() != null) agentGone(conn, DisconnectCause.SHUTDOWN);
            else reject(conn, "server shutting down");
        }
    }

    private void publish(MetricSnapshot snapshot) {
        bus.publish(AgentEvent.metrics(snapshot));
    }
}
