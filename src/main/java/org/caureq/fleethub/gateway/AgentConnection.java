package org.caureq.fleethub.gateway;

import lombok.extern.slf4j.Slf4j;
import org.caureq.fleethub.model.TransportKind;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Transport-neutral side of an agent connection. Subclasses only know how to put a frame on
 * the wire and how to close it; the state machine lives here.
 */
@Slf4j
public abstract class AgentConnection {
    private final String id = UUID.randomUUID().toString();
    private final TransportKind transport;
    private final Instant openedAt;
    private final String remoteAddress;
    private final String transportToken;
    private final AtomicBoolean gone = new AtomicBoolean(false);

    private ConnectionState state = ConnectionState.CONNECTING;
    private String agentId;

    /**
     * @param transportToken agent credential carried by the transport (query string or call
     *                       metadata); null when the agent sends it in its auth frame
     */
    protected AgentConnection(TransportKind transport, Instant openedAt, String remoteAddress, String transportToken) {
        this.transport = transport;
        this.openedAt = openedAt;
        this.remoteAddress = remoteAddress;
        this.transportToken = transportToken;
    }

    /** Writes one frame. Implementations must be safe to call from several threads. */
    public abstract void send(OutboundFrame frame);

    /** Closes the underlying transport. Must tolerate being called on an already closed transport. */
    protected abstract void closeTransport(String reason);

    public synchronized ConnectionState state() { return state; }

    public synchronized void transition(ConnectionState target) {
        if (!state.canMoveTo(target)) {
            throw new IllegalStateException("connection " + id + ": " + state + " -> " + target + " not allowed");
        }
        log.debug("conn={} agent={} {} -> {}", id, agentId, state, target);
        state = target;
    }

    /** Moves to {@code target} if legal, returns whether it did. */
    public synchronized boolean tryTransition(ConnectionState target) {
        if (!state.canMoveTo(target)) return false;
        state = target;
        return true;
    }

    /** True exactly once: for the caller that owns the teardown of this connection. */
    boolean claimTeardown() {
        return gone.compareAndSet(false, true);
    }

    public synchronized void bindAgent(String agentId) { this.agentId = agentId; }

    public synchronized String agentId() { return agentId; }

    public String id() { return id; }
    public TransportKind transport() { return transport; }
    public Instant openedAt() { return openedAt; }
    public String remoteAddress() { return remoteAddress; }
    public String transportToken() { return transportToken; }

    void close(String reason) {
        try {
            closeTransport(reason);
        } catch (RuntimeException e) {
            log.debug("conn={} close failed: {}", id, e.getMessage());
        }
    }
}
