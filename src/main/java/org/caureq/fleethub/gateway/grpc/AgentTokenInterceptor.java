package org.caureq.fleethub.gateway.grpc;

import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.Grpc;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fleethub.security.AgentTokenValidator;
import org.springframework.stereotype.Component;

import java.net.InetSocketAddress;

/**
 * Reads the agent token from the {@code authorization} metadata ({@code Bearer <token>} or the
 * bare token). A present but invalid token fails the call before any frame is read; an absent
 * one leaves the decision to the auth frame.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AgentTokenInterceptor implements ServerInterceptor {
    static final Metadata.Key<String> AUTHORIZATION =
            Metadata.Key.of("authorization", Metadata.ASCII_STRING_MARSHALLER);
    static final Context.Key<String> TOKEN = Context.key("fleethub.agentToken");
    static final Context.Key<String> REMOTE = Context.key("fleethub.remoteAddr");

    private final AgentTokenValidator validator;

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(ServerCall<ReqT, RespT> call, Metadata headers,
                                                                 ServerCallHandler<ReqT, RespT> next) {
        var remote = remoteAddress(call);
        var token = bearer(headers.get(AUTHORIZATION));
        if (token != null && validator.validate(token).isEmpty()) {
            log.warn("grpc call from {} rejected: invalid agent token", remote);
            call.close(Status.UNAUTHENTICATED.withDescription("invalid agent token"), new Metadata());
            return new ServerCall.Listener<>() {};
        }
        var ctx = Context.current().withValue(TOKEN, token).withValue(REMOTE, remote);
        return Contexts.interceptCall(ctx, call, headers, next);
    }

    static String bearer(String header) {
        if (header == null || header.isBlank()) return null;
        var v = header.trim();
        if (v.regionMatches(true, 0, "Bearer ", 0, 7)) v = v.substring(7).trim();
        return v.isEmpty() ? null : v;
    }

    private static String remoteAddress(ServerCall<?, ?> call) {
        var addr = call.getAttributes().get(Grpc.TRANSPORT_ATTR_REMOTE_ADDR);
        if (addr instanceof InetSocketAddress inet && inet.getAddress() != null) {
            return inet.getAddress().getHostAddress();
        }
        return addr == null ? null : addr.toString();
    }
}
