package org.caureq.fleethub.permission;

import org.caureq.fleethub.error.AuthorizationException;
import org.caureq.fleethub.error.ErrorCode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PermissionResolverTest {

    private final InMemoryPermissionGraph graph = new InMemoryPermissionGraph()
            .superAdmin(1, "root")
            .user(2, "alice")
            .user(3, "bob");
    private final PermissionResolver resolver = new PermissionResolver(graph);

    @Test
    void superAdminAlwaysGetsSystemAdmin() {
        var d = resolver.resolve(1, "anything");
        assertThat(d.visible()).isTrue();
        assertThat(d.level()).isEqualTo(PermissionLevel.SYSTEM_ADMIN);
        assertThat(d.source()).isEqualTo(AccessDecision.Source.SUPERADMIN);
    }

    @Test
    void superAdminIgnoresOverrides() {
        graph.override(1, "web-01", 0);
        assertThat(resolver.resolve(1, "web-01").level()).isEqualTo(PermissionLevel.SYSTEM_ADMIN);
    }

    @Test
    void groupCeilingIsMaxAcrossGroups() {
        graph.group(2, "web-01", 1).group(2, "web-01", 2);
        var d = resolver.resolve(2, "web-01");
        assertThat(d.level()).isEqualTo(PermissionLevel.SERVICE_CONTROL);
        assertThat(d.source()).isEqualTo(AccessDecision.Source.GROUP);
    }

    @Test
    void overrideWinsEvenWhenLower() {
        graph.group(2, "web-01", 3).override(2, "web-01", 0);
        var d = resolver.resolve(2, "web-01");
        assertThat(d.visible()).isTrue();
        assertThat(d.level()).isEqualTo(PermissionLevel.READ_ONLY);
        assertThat(d.source()).isEqualTo(AccessDecision.Source.OVERRIDE);
    }

    @Test
    void overrideGrantsAccessWithoutAnyGroup() {
        graph.override(3, "db-01", 2);
        assertThat(resolver.resolve(3, "db-01").level()).isEqualTo(PermissionLevel.SERVICE_CONTROL);
    }

    @Test
    void noGroupNoOverrideIsInvisibleNotReadOnly() {
        var d = resolver.resolve(3, "web-01");
        assertThat(d.visible()).isFalse();
        assertThat(d.allows(PermissionLevel.READ_ONLY)).isFalse();
    }

    @Test
    void unknownUserSeesNothing() {
        assertThat(resolver.resolve(99, "web-01").visible()).isFalse();
        assertThat(resolver.isSuperAdmin(99)).isFalse();
    }

    @Test
    void requireReportsInvisibleAsNotFound() {
        assertThatThrownBy(() -> resolver.require(3, "web-01", PermissionLevel.READ_ONLY))
                .isInstanceOfSatisfying(AuthorizationException.class, e -> {
                    assertThat(e.reason()).isEqualTo(AuthorizationException.Reason.INVISIBLE);
                    assertThat(e.code()).isEqualTo(ErrorCode.NOT_FOUND);
                    assertThat(e.getMessage()).isEqualTo("agent not found: web-01");
                    assertThat(e.details()).isEmpty();
                });
    }

    @Test
    void requireRejectsInsufficientLevel() {
        graph.group(2, "web-01", 1);
        assertThatThrownBy(() -> resolver.require(2, "web-01", PermissionLevel.SERVICE_CONTROL))
                .isInstanceOfSatisfying(AuthorizationException.class, e -> {
                    assertThat(e.reason()).isEqualTo(AuthorizationException.Reason.INSUFFICIENT_LEVEL);
                    assertThat(e.code()).isEqualTo(ErrorCode.PERMISSION_DENIED);
                });
    }

    @Test
    void requirePassesAtExactLevel() {
        graph.group(2, "web-01", 2);
        assertThat(resolver.require(2, "web-01", PermissionLevel.SERVICE_CONTROL).level())
                .isEqualTo(PermissionLevel.SERVICE_CONTROL);
    }

    @Test
    void effectiveMergesGroupsAndOverrides() {
        graph.group(2, "web-01", 1).group(2, "web-02", 2).override(2, "web-02", 0).override(2, "db-01", 3);
        var all = resolver.effective(2, List.of("ignored"));
        assertThat(all).containsOnlyKeys("db-01", "web-01", "web-02");
        assertThat(all.get("web-01").level()).isEqualTo(PermissionLevel.BASIC_WRITE);
        assertThat(all.get("web-02").level()).isEqualTo(PermissionLevel.READ_ONLY);
        assertThat(all.get("db-01").source()).isEqualTo(AccessDecision.Source.OVERRIDE);
    }

    @Test
    void effectiveForSuperAdminCoversKnownAgents() {
        var all = resolver.effective(1, List.of("b", "a"));
        assertThat(all.keySet()).containsExactly("a", "b");
        assertThat(all.values()).allMatch(d -> d.level() == PermissionLevel.SYSTEM_ADMIN);
    }
}
