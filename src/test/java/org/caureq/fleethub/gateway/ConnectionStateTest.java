package org.caureq.fleethub.gateway;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.caureq.fleethub.gateway.ConnectionState.*;

class ConnectionStateTest {

    @Test
    void happyPathAndTeardown() {
        assertThat(CONNECTING.canMoveTo(AUTHENTICATED)).isTrue();
        assertThat(AUTHENTICATED.canMoveTo(STREAMING)).isTrue();
        assertThat(STREAMING.canMoveTo(DRAINING)).isTrue();
        assertThat(STREAMING.canMoveTo(LOST)).isTrue();
        assertThat(DRAINING.canMoveTo(CLOSED)).isTrue();
        assertThat(LOST.canMoveTo(CLOSED)).isTrue();
    }

    @Test
    void cannotSkipAuthenticationOrLeaveClosed() {
        assertThat(CONNECTING.canMoveTo(STREAMING)).isFalse();
        assertThat(STREAMING.canMoveTo(CLOSED)).isFalse();
        for (var s : values()) {
            assertThat(CLOSED.canMoveTo(s)).isFalse();
        }
    }

    @Test
    void connectionEnforcesTransitions() {
        var conn = new FakeConnection(Instant.EPOCH, null);
        assertThat(conn.state()).isEqualTo(CONNECTING);

        assertThatThrownBy(() -> conn.transition(STREAMING)).isInstanceOf(IllegalStateException.class);
        assertThat(conn.tryTransition(STREAMING)).isFalse();
        conn.transition(AUTHENTICATED);
        assertThat(conn.tryTransition(STREAMING)).isTrue();
        assertThat(conn.state()).isEqualTo(STREAMING);
    }

    @Test
    void teardownIsClaimedOnce() {
        var conn = new FakeConnection(Instant.EPOCH, null);
        assertThat(conn.claimTeardown()).isTrue();
        assertThat(conn.claimTeardown()).isFalse();
    }
}
