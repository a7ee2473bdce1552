package org.caureq.fleethub.security;

import org.caureq.fleethub.config.AppProps;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AgentTokenValidatorTest {

    private static AgentTokenValidator validator(boolean enabled) {
        var props = new AppProps(null, new AppProps.AgentAuthProps(enabled, List.of(
                new AppProps.AgentToken("rack-a", "tok-a"),
                new AppProps.AgentToken(null, "tok-b"))), null, null, null, null);
        return new AgentTokenValidator(props);
    }

    @Test
    void matchesConfiguredTokensByName() {
        var v = validator(true);
        assertThat(v.validate("tok-a")).contains("rack-a");
        assertThat(v.validate(" tok-b ")).contains("agent");
        assertThat(v.validate("tok-c")).isEmpty();
        assertThat(v.validate(null)).isEmpty();
    }

    @Test
    void disabledAuthAcceptsAnything() {
        assertThat(validator(false).validate(null)).contains("anonymous");
    }
}
