package org.caureq.fleethub.service;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Write-path health of the time-series backends. Degraded while the most recent write failed;
 * a successful write clears it.
 */
@Component
public class StorageHealth {
    private final Clock clock;
    private final AtomicLong writes = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong consecutiveFailures = new AtomicLong();
    private final AtomicReference<Failure> lastFailure = new AtomicReference<>();

    public record Failure(String backend, String message, Instant at) {}

    public StorageHealth(Clock clock) {
        this.clock = clock;
    }

    public void recordSuccess() {
        writes.incrementAndGet();
        consecutiveFailures.set(0);
    }

    public void recordFailure(String backend, Throwable error) {
        writes.incrementAndGet();
        failures.incrementAndGet();
        consecutiveFailures.incrementAndGet();
        lastFailure.set(new Failure(backend, error.getMessage(), clock.instant()));
    }

    public boolean degraded() {
        return consecutiveFailures.get() > 0;
    }

    public long writes() { return writes.get(); }
    public long failures() { return failures.get(); }
    public Failure lastFailure() { return lastFailure.get(); }
}
