package org.caureq.fleethub.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fleethub.config.AppProps;
import org.caureq.fleethub.error.AuthenticationException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.util.Date;

/**
 * HS256 tokens. Access tokens identify a user; elevated tokens ({@code typ=elevated}) are
 * short-lived and only unlock SYSTEM_ADMIN commands for the same user.
 */
@Slf4j
@Service
public class TokenService {
    static final String CLAIM_TYPE = "typ";
    static final String CLAIM_USERNAME = "usr";
    static final String TYPE_ACCESS = "access";
    static final String TYPE_ELEVATED = "elevated";

    private final SecretKey key;
    private final Duration accessTtl;
    private final Duration elevatedTtl;
    private final Clock clock;

    @Autowired
    public TokenService(AppProps props, Clock clock) {
        this(props.auth().jwtSecret(), props.auth().accessTtl(), props.auth().elevatedTtl(), clock);
    }

    public TokenService(String secret, Duration accessTtl, Duration elevatedTtl, Clock clock) {
        this.key = signingKey(secret);
        this.accessTtl = accessTtl;
        this.elevatedTtl = elevatedTtl;
        this.clock = clock;
    }

    public String issueAccess(long userId, String username) {
        return issue(userId, username, TYPE_ACCESS, accessTtl);
    }

    public String issueElevated(long userId, String username) {
        return issue(userId, username, TYPE_ELEVATED, elevatedTtl);
    }

    public Duration accessTtl() { return accessTtl; }
    public Duration elevatedTtl() { return elevatedTtl; }

    /** Verifies an access token. Elevated tokens are not accepted here. */
    public AuthenticatedUser verifyAccess(String token) {
        var claims = parse(token);
        if (!TYPE_ACCESS.equals(claims.get(CLAIM_TYPE, String.class))) {
            throw new AuthenticationException("not an access token");
        }
        return new AuthenticatedUser(Long.parseLong(claims.getSubject()), claims.get(CLAIM_USERNAME, String.class));
    }

    /** True when {@code token} is a valid, unexpired elevated credential issued to {@code userId}. */
    public boolean isElevatedFor(String token, long userId) {
        if (token == null || token.isBlank()) return false;
        try {
            var claims = parse(token);
            return TYPE_ELEVATED.equals(claims.get(CLAIM_TYPE, String.class))
                    && String.valueOf(userId).equals(claims.getSubject());
        } catch (AuthenticationException e) {
            log.debug("elevated token rejected for user {}: {}", userId, e.getMessage());
            return false;
        }
    }

    private String issue(long userId, String username, String type, Duration ttl) {
        var now = clock.instant();
        return Jwts.builder()
                .setSubject(String.valueOf(userId))
                .claim(CLAIM_USERNAME, username)
                .claim(CLAIM_TYPE, type)
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plus(ttl)))
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    private Claims parse(String token) {
        if (token == null || token.isBlank()) throw new AuthenticationException("missing token");
        try {
            return Jwts.parserBuilder()
                    .setSigningKey(key)
                    .setClock(() -> Date.from(clock.instant()))
                    .build()
                    .parseClaimsJws(token)
                    .getBody();
        } catch (JwtException | IllegalArgumentException e) {
            throw new AuthenticationException("invalid token: " + e.getMessage(), e);
        }
    }

    // HS256 wants 256 bits; shorter configured secrets are stretched through SHA-256.
    private static SecretKey signingKey(String secret) {
        if (secret == null || secret.isBlank()) {
            log.warn("fleethub.auth.jwt-secret is not set, using a random key (tokens will not survive a restart)");
            return Keys.secretKeyFor(SignatureAlgorithm.HS256);
        }
        byte[] raw = secret.getBytes(StandardCharsets.UTF_8);
        if (raw.length < 32) {
            try {
                raw = MessageDigest.getInstance("SHA-256").digest(raw);
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalStateException(e);
            }
        }
        return Keys.hmacShaKeyFor(raw);
    }
}
