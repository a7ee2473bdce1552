package org.caureq.fleethub.gateway.grpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.ServerCallStreamObserver;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fleethub.gateway.AgentConnection;
import org.caureq.fleethub.gateway.OutboundFrame;
import org.caureq.fleethub.model.TransportKind;

import java.time.Instant;

/** Agent connection over one bidi gRPC call. StreamObserver is not thread-safe, hence the lock. */
@Slf4j
class GrpcAgentConnection extends AgentConnection {
    private final ServerCallStreamObserver<JsonNode> responses;
    private final ObjectMapper mapper;
    private final Object sendLock = new Object();
    private boolean completed;

    GrpcAgentConnection(ServerCallStreamObserver<JsonNode> responses, ObjectMapper mapper, Instant openedAt,
                        String remoteAddress, String token) {
        super(TransportKind.GRPC, openedAt, remoteAddress, token);
        this.responses = responses;
        this.mapper = mapper;
    }

    @Override
    public void send(OutboundFrame frame) {
        JsonNode node = mapper.valueToTree(frame);
        synchronized (sendLock) {
            if (completed || responses.isCancelled()) return;
            try {
                responses.onNext(node);
            } catch (StatusRuntimeException | IllegalStateException e) {
                log.warn("conn={} agent={} send {} failed: {}", id(), agentId(), frame.type(), e.getMessage());
            }
        }
    }

    @Override
    protected void closeTransport(String reason) {
        synchronized (sendLock) {
            if (completed) return;
            completed = true;
            if (responses.isCancelled()) return;
            try {
                responses.onCompleted();
            } catch (IllegalStateException e) {
                log.debug("conn={} already closed: {}", id(), e.getMessage());
            }
        }
    }

    /** Called when the client side ends the call; no more writes are allowed. */
    void markCompleted() {
        synchronized (sendLock) {
            completed = true;
        }
    }
}
