package org.caureq.fleethub.gateway.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fleethub.gateway.AgentConnection;
import org.caureq.fleethub.gateway.AgentGateway;
import org.caureq.fleethub.gateway.DisconnectCause;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.time.Clock;

/** {@code /ws/agent}: adapts WebSocket sessions to {@link AgentGateway}. */
@Slf4j
@Component
@RequiredArgsConstructor
public class AgentWebSocketHandler extends TextWebSocketHandler {
    static final String CONNECTION_ATTR = "fleethub.agentConnection";

    private final AgentGateway gateway;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) {
        var attrs = session.getAttributes();
        var conn = new WsAgentConnection(session, objectMapper, clock.instant(),
                (String) attrs.get(TokenHandshakeInterceptor.REMOTE_ATTR),
                (String) attrs.get(TokenHandshakeInterceptor.TOKEN_ATTR));
        attrs.put(CONNECTION_ATTR, conn);
        gateway.accept(conn);
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        var conn = connection(session);
        if (conn != null) gateway.onMessage(conn, message.getPayload());
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        var conn = connection(session);
        log.warn("ws agent session {} transport error: {}", session.getId(), exception.getMessage());
        if (conn != null) gateway.onTransportClosed(conn, DisconnectCause.TRANSPORT_ERROR);
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        var conn = connection(session);
        log.debug("ws agent session {} closed: {}", session.getId(), status);
        if (conn != null) gateway.onTransportClosed(conn, DisconnectCause.TRANSPORT_CLOSED);
    }

    private static AgentConnection connection(WebSocketSession session) {
        return (AgentConnection) session.getAttributes().get(CONNECTION_ATTR);
    }
}
