package org.caureq.fleethub.gateway.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fleethub.config.AppProps;
import org.caureq.fleethub.error.AuthenticationException;
import org.caureq.fleethub.gateway.EventBus;
import org.caureq.fleethub.gateway.Subscription;
import org.caureq.fleethub.model.AgentEvent;
import org.caureq.fleethub.model.MetricSnapshot;
import org.caureq.fleethub.permission.VisibilityCache;
import org.caureq.fleethub.registry.AgentRegistry;
import org.caureq.fleethub.security.AuthenticatedUser;
import org.caureq.fleethub.security.TokenService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@code /ws/subscribe?token=<jwt>}: pushes one STATE event, then the live agent events the
 * user is allowed to see. Each session consumes its own {@link Subscription} on a worker of a
 * bounded scheduler, so a slow client only delays itself.
 */
@Slf4j
@Component
public class SubscriberWebSocketHandler extends TextWebSocketHandler {
    static final CloseStatus OVERFLOW = new CloseStatus(4008, "subscriber queue overflow");

    private final EventBus bus;
    private final AgentRegistry registry;
    private final TokenService tokens;
    private final VisibilityCache visibility;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Scheduler scheduler;
    private final int maxSubscribers;
    private final Map<String, Stream> streams = new ConcurrentHashMap<>();

    private record Stream(Subscription subscription, Disposable.Swap pump) {}

    @Autowired
    public SubscriberWebSocketHandler(EventBus bus, AgentRegistry registry, TokenService tokens,
                                      VisibilityCache visibility, ObjectMapper objectMapper,
                                      Clock clock, AppProps props) {
        this(bus, registry, tokens, visibility, objectMapper, clock, props.gateway().maxSubscribers(),
                Schedulers.newBoundedElastic(props.gateway().maxSubscribers(),
                        Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE, "subscriber-pump"));
    }

    SubscriberWebSocketHandler(EventBus bus, AgentRegistry registry, TokenService tokens,
                               VisibilityCache visibility, ObjectMapper objectMapper,
                               Clock clock, int maxSubscribers, Scheduler scheduler) {
        this.bus = bus;
        this.registry = registry;
        this.tokens = tokens;
        this.visibility = visibility;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.maxSubscribers = maxSubscribers;
        this.scheduler = scheduler;
    }

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) throws IOException {
        AuthenticatedUser user;
        try {
            user = tokens.verifyAccess((String) session.getAttributes().get(TokenHandshakeInterceptor.TOKEN_ATTR));
        } catch (AuthenticationException e) {
            log.warn("subscriber {} rejected: {}", session.getId(), e.getMessage());
            session.close(CloseStatus.POLICY_VIOLATION.withReason("invalid token"));
            return;
        }
        if (streams.size() >= maxSubscribers) {
            log.warn("subscriber {} rejected: {} subscribers connected", session.getId(), streams.size());
            session.close(CloseStatus.SERVICE_OVERLOAD);
            return;
        }

        var sub = bus.subscribe(() -> stateFor(user));
        var pump = Disposables.swap();
        streams.put(session.getId(), new Stream(sub, pump));
        var out = new ConcurrentWebSocketSessionDecorator(session, 10_000, 1024 * 1024);
        pump.update(sub.events()
                .publishOn(scheduler, 1)
                .filter(e -> e.type() == AgentEvent.Type.STATE || visibility.canSee(user.userId(), e.agentId()))
                .doFinally(signal -> closeQuietly(out, sub.overflowed() ? OVERFLOW : CloseStatus.NORMAL))
                .subscribe(e -> send(out, sub, e),
                        err -> log.debug("subscriber {} stream ended: {}", session.getId(), err.toString())));
        log.info("subscriber opened session={} user={}", session.getId(), user.username());
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        // clients only listen
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        var stream = streams.remove(session.getId());
        if (stream != null) {
            stream.subscription().close();
            stream.pump().dispose();
            log.info("subscriber closed session={} status={} dropped={}", session.getId(), status,
                    stream.subscription().dropped());
        }
    }

    AgentEvent stateFor(AuthenticatedUser user) {
        var agents = registry.agents().stream()
                .filter(a -> visibility.canSee(user.userId(), a.id()))
                .toList();
        var latest = new LinkedHashMap<String, MetricSnapshot>();
        var all = registry.allLatest();
        for (var a : agents) {
            var s = all.get(a.id());
            if (s != null) latest.put(a.id(), s);
        }
        return new AgentEvent(AgentEvent.Type.STATE, null, clock.instant(), new FleetState(agents, latest));
    }

    private void send(WebSocketSession session, Subscription sub, AgentEvent event) {
        if (!session.isOpen()) {
            sub.close();
            return;
        }
        try {
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(event)));
        } catch (JsonProcessingException e) {
            log.error("subscriber {} event encoding failed", session.getId(), e);
        } catch (IOException e) {
            log.debug("subscriber {} send failed: {}", session.getId(), e.getMessage());
            sub.close();
        }
    }

    private static void closeQuietly(WebSocketSession session, CloseStatus status) {
        if (!session.isOpen()) return;
        try {
            session.close(status);
        } catch (IOException e) {
            log.debug("subscriber {} close failed: {}", session.getId(), e.getMessage());
        }
    }

    public int activeSubscribers() {
        return streams.size();
    }

    @PreDestroy
    public void shutdown() {
        streams.values().forEach(s -> {
            s.subscription().close();
            s.pump().dispose();
        });
        scheduler.dispose();
    }
}
