package org.caureq.fleethub.gateway;

import java.util.Locale;

/** Why an agent left. Graceful causes drain; the rest mark the connection lost. */
public enum DisconnectCause {
    HEARTBEAT_TIMEOUT(false),
    TRANSPORT_CLOSED(false),
    TRANSPORT_ERROR(false),
    GOODBYE(true),
    SHUTDOWN(true);

    private final boolean graceful;

    DisconnectCause(boolean graceful) {
        this.graceful = graceful;
    }

    public boolean graceful() { return graceful; }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
