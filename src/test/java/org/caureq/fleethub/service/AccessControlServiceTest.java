package org.caureq.fleethub.service;

import org.caureq.fleethub.MutableClock;
import org.caureq.fleethub.api.dto.GroupRequest;
import org.caureq.fleethub.domain.AccessGroup;
import org.caureq.fleethub.domain.AgentGroupBinding;
import org.caureq.fleethub.domain.GroupMembership;
import org.caureq.fleethub.domain.User;
import org.caureq.fleethub.domain.UserAgentPermission;
import org.caureq.fleethub.error.ConflictException;
import org.caureq.fleethub.error.NotFoundException;
import org.caureq.fleethub.error.ValidationException;
import org.caureq.fleethub.permission.AccessDecision;
import org.caureq.fleethub.permission.PermissionLevel;
import org.caureq.fleethub.permission.PermissionResolver;
import org.caureq.fleethub.permission.VisibilityCache;
import org.caureq.fleethub.registry.AgentRegistry;
import org.caureq.fleethub.repo.AccessGroupRepo;
import org.caureq.fleethub.repo.AgentGroupBindingRepo;
import org.caureq.fleethub.repo.GroupMembershipRepo;
import org.caureq.fleethub.repo.UserAgentPermissionRepo;
import org.caureq.fleethub.repo.UserRepo;
import org.caureq.fleethub.security.AuthenticatedUser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.caureq.fleethub.Snapshots.T0;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AccessControlServiceTest {

    @Mock AccessGroupRepo groups;
    @Mock GroupMembershipRepo memberships;
    @Mock AgentGroupBindingRepo bindings;
    @Mock UserAgentPermissionRepo overrides;
    @Mock UserRepo users;
    @Mock PermissionResolver resolver;
    @Mock VisibilityCache visibility;

    private AccessControlService service;
    private AccessGroup ops;
    private User alice;

    @BeforeEach
    void setUp() {
        service = new AccessControlService(groups, memberships, bindings, overrides, users, resolver, visibility,
                new AgentRegistry(), new MutableClock(T0));
        ops = AccessGroup.builder().id(1L).name("ops").build();
        alice = User.builder().id(2L).username("alice").build();
    }

    @Test
    void createGroupRejectsADuplicateName() {
        when(groups.findLiveByName("ops")).thenReturn(Optional.of(ops));

        assertThatThrownBy(() -> service.createGroup(new GroupRequest(" ops ", null)))
                .isInstanceOf(ConflictException.class)
                .hasMessageContaining("ops");
        verify(groups, never()).save(any());
    }

    @Test
    void createGroupStoresTheTrimmedName() {
        when(groups.save(any(AccessGroup.class))).thenAnswer(inv -> {
            AccessGroup g = inv.getArgument(0);
            g.setId(5L);
            return g;
        });

        var dto = service.createGroup(new GroupRequest("  dba  ", "database admins"));

        assertThat(dto.id()).isEqualTo(5L);
        assertThat(dto.name()).isEqualTo("dba");
        assertThat(dto.members()).isEmpty();
    }

    @Test
    void deleteGroupTombstonesMembershipsAndBindings() {
        var m = GroupMembership.builder().id(10L).group(ops).user(alice).build();
        var b = AgentGroupBinding.builder().id(20L).group(ops).agentId("web-01").level(1).build();
        when(groups.findLiveById(1L)).thenReturn(Optional.of(ops));
        when(memberships.findLiveByGroup(1L)).thenReturn(List.of(m));
        when(bindings.findLiveByGroup(1L)).thenReturn(List.of(b));

        service.deleteGroup(1L);

        assertThat(ops.getDeletedAt()).isEqualTo(T0);
        assertThat(m.getDeletedAt()).isEqualTo(T0);
        assertThat(b.getDeletedAt()).isEqualTo(T0);
        verify(groups).save(ops);
        verify(visibility).invalidateAll();
    }

    @Test
    void deleteUnknownGroupIsNotFound() {
        assertThatThrownBy(() -> service.deleteGroup(9L)).isInstanceOf(NotFoundException.class);
        verifyNoInteractions(visibility);
    }

    @Test
    void addingAnExistingMemberChangesNothing() {
        when(groups.findLiveById(1L)).thenReturn(Optional.of(ops));
        when(users.findLiveById(2L)).thenReturn(Optional.of(alice));
        when(memberships.findLive(1L, 2L)).thenReturn(Optional.of(GroupMembership.builder().group(ops).user(alice).build()));

        service.addMember(1L, 2L);

        verify(memberships, never()).save(any());
        verifyNoInteractions(visibility);
    }

    @Test
    void removeMemberTombstonesTheMembership() {
        var m = GroupMembership.builder().id(10L).group(ops).user(alice).build();
        when(groups.findLiveById(1L)).thenReturn(Optional.of(ops));
        when(memberships.findLive(1L, 2L)).thenReturn(Optional.of(m));

        service.removeMember(1L, 2L);

        assertThat(m.getDeletedAt()).isEqualTo(T0);
        verify(memberships).save(m);
        verify(visibility).invalidateAll();
    }

    @Test
    void bindAgentUpdatesAnExistingBindingInPlace() {
        var existing = AgentGroupBinding.builder().id(20L).group(ops).agentId("web-01").level(0).build();
        when(groups.findLiveById(1L)).thenReturn(Optional.of(ops));
        when(bindings.findLive(1L, "web-01")).thenReturn(Optional.of(existing));

        service.bindAgent(1L, "web-01", 2);

        assertThat(existing.getLevel()).isEqualTo(PermissionLevel.SERVICE_CONTROL.value());
        verify(bindings).save(existing);
        verify(visibility).invalidateAll();
    }

    @Test
    void bindAgentCreatesAMissingBinding() {
        when(groups.findLiveById(1L)).thenReturn(Optional.of(ops));

        service.bindAgent(1L, "db-02", 3);

        var saved = ArgumentCaptor.forClass(AgentGroupBinding.class);
        verify(bindings).save(saved.capture());
        assertThat(saved.getValue().getAgentId()).isEqualTo("db-02");
        assertThat(saved.getValue().getLevel()).isEqualTo(3);
        assertThat(saved.getValue().getGroup()).isSameAs(ops);
    }

    @Test
    void bindAgentRejectsAnUnknownLevel() {
        assertThatThrownBy(() -> service.bindAgent(1L, "web-01", 7)).isInstanceOf(ValidationException.class);
        verifyNoInteractions(bindings, visibility);
    }

    @Test
    void unbindingAnUnboundAgentIsNotFound() {
        when(groups.findLiveById(1L)).thenReturn(Optional.of(ops));

        assertThatThrownBy(() -> service.unbindAgent(1L, "web-01"))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("web-01");
    }

    @Test
    void grantUpsertsTheOverrideAndReportsTheEffectiveLevel() {
        when(users.findLiveById(2L)).thenReturn(Optional.of(alice));
        when(resolver.resolve(2L, "web-01"))
                .thenReturn(AccessDecision.granted(PermissionLevel.SERVICE_CONTROL, AccessDecision.Source.OVERRIDE));

        var result = service.grant(new AuthenticatedUser(1, "root"), 2L, "web-01", 2);

        var saved = ArgumentCaptor.forClass(UserAgentPermission.class);
        verify(overrides).save(saved.capture());
        assertThat(saved.getValue().getGrantedBy()).isEqualTo(1L);
        assertThat(saved.getValue().getLevel()).isEqualTo(2);
        assertThat(result.level()).isEqualTo(PermissionLevel.SERVICE_CONTROL);
        assertThat(result.source()).isEqualTo(AccessDecision.Source.OVERRIDE);
        assertThat(result.online()).isFalse();
        verify(visibility).invalidateAll();
    }

    @Test
    void revokeTombstonesTheOverride() {
        var p = UserAgentPermission.builder().id(30L).user(alice).agentId("web-01").level(3).build();
        when(overrides.findLive(2L, "web-01")).thenReturn(Optional.of(p));

        service.revoke(2L, "web-01");

        assertThat(p.getDeletedAt()).isEqualTo(T0);
        verify(overrides).save(p);
        verify(visibility).invalidateAll();
    }

    @Test
    void revokingAMissingOverrideIsNotFound() {
        assertThatThrownBy(() -> service.revoke(2L, "web-01")).isInstanceOf(NotFoundException.class);
        verifyNoInteractions(visibility);
    }
}
