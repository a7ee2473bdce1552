package org.caureq.fleethub.gateway;

import lombok.extern.slf4j.Slf4j;
import org.caureq.fleethub.model.AgentEvent;
import reactor.core.publisher.BufferOverflowStrategy;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * One subscriber's view of the bus. Events land in a private sink from the moment the
 * subscription is registered and reach the consumer through a bounded buffer; when the
 * consumer falls {@code capacity} events behind, the {@link OverflowPolicy} decides whether
 * the oldest event is dropped or the subscription is closed.
 *
 * <p>{@link #events()} may be subscribed to once.
 */
@Slf4j
public class Subscription implements AutoCloseable {
    private static final Sinks.EmitFailureHandler RETRY_CONTENDED = Sinks.EmitFailureHandler.busyLooping(Duration.ofMillis(50));

    private final String id = UUID.randomUUID().toString();
    private final int capacity;
    private final OverflowPolicy policy;
    private final Consumer<Subscription> onClose;
    private final Sinks.Many<AgentEvent> sink = Sinks.many().unicast().onBackpressureBuffer();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile boolean overflowed;
    private volatile AgentEvent initial;

    Subscription(int capacity, OverflowPolicy policy, Consumer<Subscription> onClose) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        this.capacity = capacity;
        this.policy = policy;
        this.onClose = onClose;
    }

    void setInitial(AgentEvent event) {
        this.initial = event;
    }

    /** The initial state event, if any, followed by every event published since registration. */
    public Flux<AgentEvent> events() {
        Flux<AgentEvent> live = policy == OverflowPolicy.DISCONNECT
                ? sink.asFlux().onBackpressureBuffer(capacity, this::overflow, BufferOverflowStrategy.ERROR)
                : sink.asFlux().onBackpressureBuffer(capacity, e -> dropped.incrementAndGet(), BufferOverflowStrategy.DROP_OLDEST);
        return Flux.concat(Mono.justOrEmpty(initial), live);
    }

    /** Returns false once the subscription is closed. */
    boolean offer(AgentEvent event) {
        if (closed.get()) return false;
        sink.emitNext(event, RETRY_CONTENDED);
        return true;
    }

    private void overflow(AgentEvent rejected) {
        log.warn("subscription {} overflowed ({} events), disconnecting", id, capacity);
        overflowed = true;
        close();
    }

    /** Stops delivery; events already buffered are still handed to the consumer. */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        sink.emitComplete(RETRY_CONTENDED);
        onClose.accept(this);
    }

    public boolean isClosed() { return closed.get(); }
    public boolean overflowed() { return overflowed; }
    public long dropped() { return dropped.get(); }
    public String id() { return id; }
    public OverflowPolicy policy() { return policy; }
}
