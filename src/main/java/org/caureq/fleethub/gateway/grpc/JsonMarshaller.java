package org.caureq.fleethub.gateway.grpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.grpc.MethodDescriptor;
import io.grpc.Status;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Carries the same JSON envelope as the WebSocket transport inside gRPC messages.
 *
 * <p>The payload is JSON, not protobuf: the method name matches the agent service, but agents
 * that send protobuf-encoded frames cannot use this transport and must connect over WebSocket.
 */
class JsonMarshaller implements MethodDescriptor.Marshaller<JsonNode> {
    private final ObjectMapper mapper;

    JsonMarshaller(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public InputStream stream(JsonNode value) {
        try {
            return new ByteArrayInputStream(mapper.writeValueAsBytes(value));
        } catch (JsonProcessingException e) {
            throw Status.INTERNAL.withDescription("cannot encode message").withCause(e).asRuntimeException();
        }
    }

    @Override
    public JsonNode parse(InputStream stream) {
        try {
            return mapper.readTree(stream);
        } catch (IOException e) {
            throw Status.INVALID_ARGUMENT.withDescription("message is not JSON: " + e.getMessage())
                    .withCause(e).asRuntimeException();
        }
    }
}
