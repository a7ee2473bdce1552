package org.caureq.fleethub.gateway.grpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.grpc.MethodDescriptor;
import io.grpc.ServerServiceDefinition;
import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.ServerCalls;
import io.grpc.stub.StreamObserver;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fleethub.gateway.AgentGateway;
import org.caureq.fleethub.gateway.DisconnectCause;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * {@code fleethub.AgentGateway/Stream}: one bidirectional call per agent, JSON envelopes both ways.
 * The service is declared by hand, so no generated stubs are involved.
 */
@Slf4j
@Component
public class AgentStreamService {
    public static final String SERVICE_NAME = "fleethub.AgentGateway";

    private final AgentGateway gateway;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final MethodDescriptor<JsonNode, JsonNode> streamMethod;

    public AgentStreamService(AgentGateway gateway, ObjectMapper objectMapper, Clock clock) {
        this.gateway = gateway;
        this.objectMapper = objectMapper;
        this.clock = clock;
        var marshaller = new JsonMarshaller(objectMapper);
        this.streamMethod = MethodDescriptor.<JsonNode, JsonNode>newBuilder()
                .setType(MethodDescriptor.MethodType.BIDI_STREAMING)
                .setFullMethodName(MethodDescriptor.generateFullMethodName(SERVICE_NAME, "Stream"))
                .setRequestMarshaller(marshaller)
                .setResponseMarshaller(marshaller)
                .build();
    }

    public MethodDescriptor<JsonNode, JsonNode> streamMethod() {
        return streamMethod;
    }

    public ServerServiceDefinition definition() {
        return ServerServiceDefinition.builder(SERVICE_NAME)
                .addMethod(streamMethod, ServerCalls.asyncBidiStreamingCall(this::open))
                .build();
    }

    StreamObserver<JsonNode> open(StreamObserver<JsonNode> responseObserver) {
        var responses = (ServerCallStreamObserver<JsonNode>) responseObserver;
        var conn = new GrpcAgentConnection(responses, objectMapper, clock.instant(),
                AgentTokenInterceptor.REMOTE.get(), AgentTokenInterceptor.TOKEN.get());
        responses.setOnCancelHandler(() -> {
            conn.markCompleted();
            gateway.onTransportClosed(conn, DisconnectCause.TRANSPORT_CLOSED);
        });
        gateway.accept(conn);

        return new StreamObserver<>() {
            @Override
            public void onNext(JsonNode value) {
                gateway.onMessage(conn, value);
            }

            @Override
            public void onError(Throwable t) {
                log.debug("grpc stream conn={} error: {}", conn.id(), t.getMessage());
                conn.markCompleted();
                gateway.onTransportClosed(conn, DisconnectCause.TRANSPORT_ERROR);
            }

            @Override
            public void onCompleted() {
                gateway.onTransportClosed(conn, DisconnectCause.TRANSPORT_CLOSED);
            }
        };
    }
}
