package org.caureq.fleethub.gateway;

import lombok.extern.slf4j.Slf4j;
import org.caureq.fleethub.config.AppProps;
import org.caureq.fleethub.model.AgentEvent;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Fan-out of agent events to subscribers. Each subscriber owns a sink and a bounded buffer, so
 * a slow consumer can only hurt itself; {@link #publish} never waits on a consumer.
 */
@Slf4j
@Component
public class EventBus {
    private final Set<Subscription> subscriptions = ConcurrentHashMap.newKeySet();
    private final int capacity;
    private final OverflowPolicy policy;

    @Autowired
    public EventBus(AppProps props) {
        this(props.gateway().subscriberQueueSize(), OverflowPolicy.from(props.gateway().overflowPolicy()));
    }

    public EventBus(int capacity, OverflowPolicy policy) {
        this.capacity = capacity;
        this.policy = policy;
    }

    public Subscription subscribe() {
        return subscribe(null);
    }

    /**
     * Registers a subscriber, then builds {@code initial}, which is delivered ahead of anything
     * published since. Building the state after registration means no event can fall between the two.
     */
    public Subscription subscribe(Supplier<AgentEvent> initial) {
        var sub = new Subscription(capacity, policy, subscriptions::remove);
        subscriptions.add(sub);
        if (initial != null) sub.setInitial(initial.get());
        log.debug("subscriber {} added, total={}", sub.id(), subscriptions.size());
        return sub;
    }

    public void publish(AgentEvent event) {
        for (var sub : subscriptions) {
            sub.offer(event);
        }
    }

    public int subscriberCount() {
        return subscriptions.size();
    }
}
