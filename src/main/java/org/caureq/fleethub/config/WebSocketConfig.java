package org.caureq.fleethub.config;

import lombok.RequiredArgsConstructor;
import org.caureq.fleethub.gateway.ws.AgentWebSocketHandler;
import org.caureq.fleethub.gateway.ws.SubscriberWebSocketHandler;
import org.caureq.fleethub.gateway.ws.TokenHandshakeInterceptor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/** Agent stream on /ws/agent, dashboard push stream on /ws/subscribe. */
@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {
    private final AgentWebSocketHandler agentHandler;
    private final SubscriberWebSocketHandler subscriberHandler;
    private final TokenHandshakeInterceptor tokenInterceptor;

    @Override
    public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
        registry.addHandler(agentHandler, "/ws/agent")
                .addInterceptors(tokenInterceptor)
                .setAllowedOriginPatterns("*");
        registry.addHandler(subscriberHandler, "/ws/subscribe")
                .addInterceptors(tokenInterceptor)
                .setAllowedOriginPatterns("*");
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        var container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(1024 * 1024); // full snapshots with many disks/interfaces
        container.setMaxBinaryMessageBufferSize(64 * 1024);
        container.setMaxSessionIdleTimeout(300_000L);
        return container;
    }
}
