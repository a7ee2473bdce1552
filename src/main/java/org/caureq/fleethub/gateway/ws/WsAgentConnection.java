package org.caureq.fleethub.gateway.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fleethub.gateway.AgentConnection;
import org.caureq.fleethub.gateway.OutboundFrame;
import org.caureq.fleethub.model.TransportKind;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.time.Instant;

/** Agent connection over a WebSocket session; sends are serialized by the session decorator. */
@Slf4j
class WsAgentConnection extends AgentConnection {
    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;
    private static final int MAX_REASON_LENGTH = 120;

    private final WebSocketSession session;
    private final ObjectMapper mapper;

    WsAgentConnection(WebSocketSession session, ObjectMapper mapper, Instant openedAt,
                      String remoteAddress, String token) {
        super(TransportKind.WEBSOCKET, openedAt, remoteAddress, token);
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        this.mapper = mapper;
    }

    @Override
    public void send(OutboundFrame frame) {
        if (!session.isOpen()) return;
        try {
            session.sendMessage(new TextMessage(mapper.writeValueAsString(frame)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot encode " + frame.type() + " frame", e);
        } catch (IOException e) {
            // the transport reports the close separately
            log.warn("conn={} agent={} send {} failed: {}", id(), agentId(), frame.type(), e.getMessage());
        }
    }

    @Override
    protected void closeTransport(String reason) {
        if (!session.isOpen()) return;
        var status = reason == null ? CloseStatus.NORMAL
                : CloseStatus.NORMAL.withReason(reason.length() > MAX_REASON_LENGTH
                ? reason.substring(0, MAX_REASON_LENGTH) : reason);
        try {
            session.close(status);
        } catch (IOException e) {
            log.debug("conn={} close failed: {}", id(), e.getMessage());
        }
    }
}
