package org.caureq.fleethub.gateway;

import org.caureq.fleethub.model.TransportKind;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** In-memory transport that records what the gateway writes to it. */
class FakeConnection extends AgentConnection {
    final List<OutboundFrame> sent = new CopyOnWriteArrayList<>();
    volatile String closedWith;
    volatile int closeCalls;

    FakeConnection(Instant openedAt, String transportToken) {
        super(TransportKind.WEBSOCKET, openedAt, "10.0.0.7", transportToken);
    }

    @Override
    public void send(OutboundFrame frame) {
        sent.add(frame);
    }

    @Override
    protected void closeTransport(String reason) {
        closeCalls++;
        closedWith = reason;
    }

    List<String> sentTypes() {
        return sent.stream().map(OutboundFrame::type).toList();
    }
}
