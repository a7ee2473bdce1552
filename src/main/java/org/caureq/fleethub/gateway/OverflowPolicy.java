package org.caureq.fleethub.gateway;

import java.util.Locale;

/** What a full subscriber queue does with the next event. */
public enum OverflowPolicy {
    /** Evict the oldest queued event and count it as dropped. */
    DROP_OLDEST,
    /** Close the subscription; the client reconnects and gets a fresh state. */
    DISCONNECT;

    public static OverflowPolicy from(String raw) {
        if (raw == null || raw.isBlank()) return DROP_OLDEST;
        return valueOf(raw.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
