package org.caureq.fleethub.permission;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Short-lived memo of "can this user see this agent" for the push stream, where the same
 * question is asked for every event. Grants and revocations show up after at most {@code ttl}.
 */
@Component
public class VisibilityCache {
    private record Key(long userId, String agentId) {}

    private final PermissionResolver resolver;
    private final Cache<Key, Boolean> cache;

    @Autowired
    public VisibilityCache(PermissionResolver resolver) {
        this(resolver, Duration.ofSeconds(30));
    }

    public VisibilityCache(PermissionResolver resolver, Duration ttl) {
        this.resolver = resolver;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(50_000)
                .build();
    }

    public boolean canSee(long userId, String agentId) {
        if (agentId == null) return false;
        return cache.get(new Key(userId, agentId), k -> resolver.resolve(k.userId(), k.agentId()).visible());
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }
}
