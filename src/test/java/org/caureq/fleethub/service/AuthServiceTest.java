package org.caureq.fleethub.service;

import org.caureq.fleethub.MutableClock;
import org.caureq.fleethub.config.AppProps;
import org.caureq.fleethub.domain.User;
import org.caureq.fleethub.error.AuthenticationException;
import org.caureq.fleethub.repo.UserRepo;
import org.caureq.fleethub.security.AuthenticatedUser;
import org.caureq.fleethub.security.TokenService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.caureq.fleethub.Snapshots.T0;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {
    private static final String SECRET = "0123456789abcdef0123456789abcdef0123456789abcdef";

    @Mock UserRepo users;

    private final BCryptPasswordEncoder encoder = new BCryptPasswordEncoder(4);
    private final MutableClock clock = new MutableClock(T0);
    private final TokenService tokens = new TokenService(SECRET, Duration.ofHours(12), Duration.ofMinutes(5), clock);
    private User alice;

    @BeforeEach
    void setUp() {
        alice = User.builder().id(2L).username("alice").passwordHash(encoder.encode("s3cret")).build();
    }

    private AuthService service(AppProps props) {
        return new AuthService(users, encoder, tokens, props, clock);
    }

    private AuthService service() {
        return service(new AppProps(null, null, null, null, null, null));
    }

    @Test
    void loginIssuesAVerifiableToken() {
        when(users.findLive("alice")).thenReturn(Optional.of(alice));

        var res = service().login(" alice ", "s3cret");

        assertThat(res.tokenType()).isEqualTo("Bearer");
        assertThat(res.expiresAt()).isEqualTo(T0.plus(Duration.ofHours(12)));
        assertThat(tokens.verifyAccess(res.token())).isEqualTo(new AuthenticatedUser(2, "alice"));
    }

    @Test
    void wrongPasswordAndUnknownUserFailTheSameWay() {
        when(users.findLive("alice")).thenReturn(Optional.of(alice));
        when(users.findLive("mallory")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service().login("alice", "nope"))
                .isInstanceOf(AuthenticationException.class)
                .hasMessage("invalid username or password");
        assertThatThrownBy(() -> service().login("mallory", "s3cret"))
                .isInstanceOf(AuthenticationException.class)
                .hasMessage("invalid username or password");
    }

    @Test
    void elevateRechecksThePassword() {
        when(users.findLiveById(2L)).thenReturn(Optional.of(alice));
        var caller = new AuthenticatedUser(2, "alice");

        var res = service().elevate(caller, "s3cret");
        assertThat(res.tokenType()).isEqualTo("Elevated");
        assertThat(tokens.isElevatedFor(res.token(), 2)).isTrue();
        assertThat(tokens.isElevatedFor(res.token(), 3)).isFalse();

        assertThatThrownBy(() -> service().elevate(caller, "wrong"))
                .isInstanceOf(AuthenticationException.class);
    }

    @Test
    void bootstrapCreatesTheSuperAdminOnce() {
        var props = new AppProps(new AppProps.AuthProps(SECRET, null, null, "admin", "changeme"),
                null, null, null, null, null);
        when(users.findLive("admin")).thenReturn(Optional.empty());

        service(props).bootstrapSuperAdmin();

        var saved = ArgumentCaptor.forClass(User.class);
        verify(users).save(saved.capture());
        assertThat(saved.getValue().getUsername()).isEqualTo("admin");
        assertThat(saved.getValue().isSuperAdmin()).isTrue();
        assertThat(encoder.matches("changeme", saved.getValue().getPasswordHash())).isTrue();
    }

    @Test
    void bootstrapSkipsWhenTheUserExists() {
        var props = new AppProps(new AppProps.AuthProps(SECRET, null, null, "admin", "changeme"),
                null, null, null, null, null);
        when(users.findLive("admin")).thenReturn(Optional.of(alice));

        service(props).bootstrapSuperAdmin();

        verify(users, never()).save(any());
    }
}
