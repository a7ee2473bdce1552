package org.caureq.fleethub.security;

import org.caureq.fleethub.MutableClock;
import org.caureq.fleethub.Snapshots;
import org.caureq.fleethub.error.AuthenticationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenServiceTest {

    private MutableClock clock;
    private TokenService tokens;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Snapshots.T0);
        tokens = new TokenService("short-secret", Duration.ofHours(1), Duration.ofMinutes(5), clock);
    }

    @Test
    void accessTokenRoundTrip() {
        var token = tokens.issueAccess(42, "alice");

        var user = tokens.verifyAccess(token);
        assertThat(user).isEqualTo(new AuthenticatedUser(42, "alice"));
    }

    @Test
    void expiredAccessTokenIsRejected() {
        var token = tokens.issueAccess(42, "alice");
        clock.advance(Duration.ofHours(2));

        assertThatThrownBy(() -> tokens.verifyAccess(token)).isInstanceOf(AuthenticationException.class);
    }

    @Test
    void elevatedTokenIsNotAnAccessToken() {
        var elevated = tokens.issueElevated(42, "alice");

        assertThatThrownBy(() -> tokens.verifyAccess(elevated))
                .isInstanceOf(AuthenticationException.class)
                .hasMessage("not an access token");
    }

    @Test
    void elevationIsBoundToUserAndShortLived() {
        var elevated = tokens.issueElevated(42, "alice");

        assertThat(tokens.isElevatedFor(elevated, 42)).isTrue();
        assertThat(tokens.isElevatedFor(elevated, 43)).isFalse();
        assertThat(tokens.isElevatedFor(tokens.issueAccess(42, "alice"), 42)).isFalse();
        assertThat(tokens.isElevatedFor(null, 42)).isFalse();

        clock.advance(Duration.ofMinutes(6));
        assertThat(tokens.isElevatedFor(elevated, 42)).isFalse();
    }

    @Test
    void tokensFromAnotherKeyAreRejected() {
        var other = new TokenService("another-secret", Duration.ofHours(1), Duration.ofMinutes(5), clock);

        assertThatThrownBy(() -> tokens.verifyAccess(other.issueAccess(1, "x")))
                .isInstanceOf(AuthenticationException.class);
        assertThatThrownBy(() -> tokens.verifyAccess("garbage")).isInstanceOf(AuthenticationException.class);
    }
}
