package org.caureq.fleethub.storage.archive;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

public enum Granularity {
    HOURLY("metrics_hourly", Duration.ofHours(1), ChronoUnit.HOURS),
    DAILY("metrics_daily", Duration.ofDays(1), ChronoUnit.DAYS);

    private final String table;
    private final Duration width;
    private final ChronoUnit unit;

    Granularity(String table, Duration width, ChronoUnit unit) {
        this.table = table;
        this.width = width;
        this.unit = unit;
    }

    public String table() { return table; }
    public Duration width() { return width; }

    /** Bucket start containing {@code t} (UTC). */
    public Instant truncate(Instant t) { return t.truncatedTo(unit); }
}
