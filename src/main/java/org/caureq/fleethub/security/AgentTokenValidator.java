package org.caureq.fleethub.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fleethub.config.AppProps;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;

/** Checks agent credentials against the static token list. */
@Slf4j
@Component
@RequiredArgsConstructor
public class AgentTokenValidator {
    private final AppProps props;

    /**
     * Name of the matching token, {@code "anonymous"} when agent auth is disabled,
     * empty when the token is rejected.
     */
    public Optional<String> validate(String token) {
        var auth = props.agentAuth();
        if (!auth.enabled()) return Optional.of("anonymous");
        if (token == null || token.isBlank()) return Optional.empty();
        byte[] given = token.trim().getBytes(StandardCharsets.UTF_8);
        for (var t : auth.tokens()) {
            if (t.token() == null) continue;
            if (MessageDigest.isEqual(given, t.token().getBytes(StandardCharsets.UTF_8))) {
                return Optional.of(t.name() == null ? "agent" : t.name());
            }
        }
        return Optional.empty();
    }
}
