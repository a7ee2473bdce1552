package org.caureq.fleethub.config;

import io.grpc.Server;
import io.grpc.ServerInterceptors;
import io.grpc.netty.shaded.io.grpc.netty.NettyServerBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fleethub.gateway.grpc.AgentStreamService;
import org.caureq.fleethub.gateway.grpc.AgentTokenInterceptor;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.TimeUnit;

/** Runs the agent gRPC endpoint next to the servlet container when {@code fleethub.gateway.grpc-enabled}. */
@Slf4j
@Component
@RequiredArgsConstructor
public class GrpcServerConfig implements SmartLifecycle {
    private final AppProps props;
    private final AgentStreamService streamService;
    private final AgentTokenInterceptor tokenInterceptor;

    private volatile Server server;

    @Override
    public void start() {
        var gw = props.gateway();
        if (!gw.grpcEnabled()) {
            log.info("gRPC agent endpoint disabled");
            return;
        }
        try {
            server = NettyServerBuilder.forPort(gw.grpcPort())
                    .addService(ServerInterceptors.intercept(streamService.definition(), tokenInterceptor))
                    .keepAliveTime(30, TimeUnit.SECONDS)
                    .keepAliveTimeout(10, TimeUnit.SECONDS)
                    .permitKeepAliveTime(10, TimeUnit.SECONDS)
                    .permitKeepAliveWithoutCalls(true)
                    .maxInboundMessageSize(16 * 1024 * 1024)
                    .build()
                    .start();
        } catch (IOException e) {
            throw new UncheckedIOException("cannot start gRPC server on port " + gw.grpcPort(), e);
        }
        log.info("gRPC agent endpoint listening on {}", gw.grpcPort());
    }

    @Override
    public void stop() {
        var s = server;
        if (s == null) return;
        s.shutdown();
        try {
            if (!s.awaitTermination(5, TimeUnit.SECONDS)) s.shutdownNow();
        } catch (InterruptedException e) {
            s.shutdownNow();
            Thread.currentThread().interrupt();
        }
        server = null;
        log.info("gRPC agent endpoint stopped");
    }

    @Override
    public boolean isRunning() {
        return server != null;
    }

    public int port() {
        var s = server;
        return s == null ? -1 : s.getPort();
    }
}
