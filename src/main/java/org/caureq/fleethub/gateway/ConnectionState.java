package org.caureq.fleethub.gateway;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one agent connection. Metric frames are only accepted in STREAMING;
 * CLOSED is terminal.
 */
public enum ConnectionState {
    CONNECTING, AUTHENTICATED, STREAMING, DRAINING, LOST, CLOSED;

    private Set<ConnectionState> next() {
        return switch (this) {
            case CONNECTING -> EnumSet.of(AUTHENTICATED, CLOSED);
            case AUTHENTICATED -> EnumSet.of(STREAMING, DRAINING, LOST, CLOSED);
            case STREAMING -> EnumSet.of(DRAINING, LOST);
            case DRAINING, LOST -> EnumSet.of(CLOSED);
            case CLOSED -> EnumSet.noneOf(ConnectionState.class);
        };
    }

    public boolean canMoveTo(ConnectionState target) {
        return next().contains(target);
    }
}
