package org.caureq.fleethub.permission;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class VisibilityCacheTest {

    private final InMemoryPermissionGraph graph = new InMemoryPermissionGraph().user(2, "alice");
    private final PermissionResolver resolver = spy(new PermissionResolver(graph));
    private final VisibilityCache cache = new VisibilityCache(resolver, Duration.ofMinutes(1));

    @Test
    void answersAreMemoizedUntilInvalidated() {
        graph.group(2, "web-01", 0);

        assertThat(cache.canSee(2, "web-01")).isTrue();
        assertThat(cache.canSee(2, "web-01")).isTrue();
        verify(resolver, times(1)).resolve(2, "web-01");

        graph.override(2, "web-01", 0);
        cache.invalidateAll();
        cache.canSee(2, "web-01");
        verify(resolver, times(2)).resolve(2, "web-01");
    }

    @Test
    void invisibleAgentsAndNullIdsAreHidden() {
        assertThat(cache.canSee(2, "db-01")).isFalse();
        assertThat(cache.canSee(2, null)).isFalse();
    }
}
