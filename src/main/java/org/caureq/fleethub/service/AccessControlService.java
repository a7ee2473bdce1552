package org.caureq.fleethub.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fleethub.api.dto.BindingDTO;
import org.caureq.fleethub.api.dto.EffectivePermissionDTO;
import org.caureq.fleethub.api.dto.GroupDTO;
import org.caureq.fleethub.api.dto.GroupRequest;
import org.caureq.fleethub.api.dto.MemberDTO;
import org.caureq.fleethub.domain.AccessGroup;
import org.caureq.fleethub.domain.AgentGroupBinding;
import org.caureq.fleethub.domain.GroupMembership;
import org.caureq.fleethub.domain.UserAgentPermission;
import org.caureq.fleethub.error.ConflictException;
import org.caureq.fleethub.error.NotFoundException;
import org.caureq.fleethub.model.Agent;
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
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Administration of the authorization graph: groups, memberships, agent bindings and per-user
 * overrides. Every removal is a soft delete; every change drops the push-stream visibility memo.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccessControlService {
    private final AccessGroupRepo groups;
    private final GroupMembershipRepo memberships;
    private final AgentGroupBindingRepo bindings;
    private final UserAgentPermissionRepo overrides;
    private final UserRepo users;
    private final PermissionResolver resolver;
    private final VisibilityCache visibility;
    private final AgentRegistry registry;
    private final Clock clock;

    /* --------------------- groups --------------------- */

    @Transactional(readOnly = true)
    public List<GroupDTO> listGroups() {
        return groups.findByDeletedAtIsNullOrderByNameAsc().stream().map(this::toDto).toList();
    }

    @Transactional(readOnly = true)
    public GroupDTO getGroup(long groupId) {
        return toDto(group(groupId));
    }

    @Transactional
    public GroupDTO createGroup(GroupRequest req) {
        var name = req.name().trim();
        if (groups.findLiveByName(name).isPresent()) throw new ConflictException("group already exists: " + name);
        var g = groups.save(AccessGroup.builder().name(name).description(req.description()).build());
        log.info("group created id={} name={}", g.getId(), name);
        return toDto(g);
    }

    @Transactional
    public GroupDTO updateGroup(long groupId, GroupRequest req) {
        var g = group(groupId);
        var name = req.name().trim();
        groups.findLiveByName(name)
                .filter(other -> !other.getId().equals(g.getId()))
                .ifPresent(other -> { throw new ConflictException("group already exists: " + name); });
        g.setName(name);
        g.setDescription(req.description());
        return toDto(groups.save(g));
    }

    /** Tombstones the group together with its memberships and bindings. */
    @Transactional
    public void deleteGroup(long groupId) {
        var g = group(groupId);
        var now = clock.instant();
        memberships.findLiveByGroup(groupId).forEach(m -> m.setDeletedAt(now));
        bindings.findLiveByGroup(groupId).forEach(b -> b.setDeletedAt(now));
        g.setDeletedAt(now);
        groups.save(g);
        visibility.invalidateAll();
        log.info("group deleted id={} name={}", groupId, g.getName());
    }

    /* --------------------- members --------------------- */

    @Transactional
    public GroupDTO addMember(long groupId, long userId) {
        var g = group(groupId);
        var u = users.findLiveById(userId).orElseThrow(() -> new NotFoundException("user not found: " + userId));
        if (memberships.findLive(groupId, userId).isEmpty()) {
            memberships.save(GroupMembership.builder().group(g).user(u).build());
            visibility.invalidateAll();
            log.info("user {} added to group {}", u.getUsername(), g.getName());
        }
        return toDto(g);
    }

    @Transactional
    public void removeMember(long groupId, long userId) {
        group(groupId);
        var m = memberships.findLive(groupId, userId)
                .orElseThrow(() -> new NotFoundException("user " + userId + " is not in group " + groupId));
        m.setDeletedAt(clock.instant());
        memberships.save(m);
        visibility.invalidateAll();
    }

    /* --------------------- bindings --------------------- */

    /** Binds the agent to the group or changes the ceiling of an existing binding. */
    @Transactional
    public GroupDTO bindAgent(long groupId, String agentId, int level) {
        var ceiling = PermissionLevel.of(level);
        var g = group(groupId);
        var b = bindings.findLive(groupId, agentId)
                .orElseGet(() -> AgentGroupBinding.builder().group(g).agentId(agentId).build());
        b.setLevel(ceiling.value());
        bindings.save(b);
        visibility.invalidateAll();
        log.info("agent {} bound to group {} with ceiling {}", agentId, g.getName(), ceiling);
        return toDto(g);
    }

    @Transactional
    public void unbindAgent(long groupId, String agentId) {
        group(groupId);
        var b = bindings.findLive(groupId, agentId)
                .orElseThrow(() -> new NotFoundException("agent " + agentId + " is not bound to group " + groupId));
        b.setDeletedAt(clock.instant());
        bindings.save(b);
        visibility.invalidateAll();
    }

    /* --------------------- overrides --------------------- */

    @Transactional
    public EffectivePermissionDTO grant(AuthenticatedUser admin, long userId, String agentId, int level) {
        var lvl = PermissionLevel.of(level);
        var u = users.findLiveById(userId).orElseThrow(() -> new NotFoundException("user not found: " + userId));
        var p = overrides.findLive(userId, agentId)
                .orElseGet(() -> UserAgentPermission.builder().user(u).agentId(agentId).build());
        p.setLevel(lvl.value());
        p.setGrantedBy(admin.userId());
        overrides.save(p);
        visibility.invalidateAll();
        log.info("override {} on {} for {} by {}", lvl, agentId, u.getUsername(), admin.username());
        var d = resolver.resolve(userId, agentId);
        return new EffectivePermissionDTO(agentId, d.level(), d.level().value(), d.source(),
                registry.agent(agentId).isPresent());
    }

    @Transactional
    public void revoke(long userId, String agentId) {
        var p = overrides.findLive(userId, agentId)
                .orElseThrow(() -> new NotFoundException("no override for user " + userId + " on " + agentId));
        p.setDeletedAt(clock.instant());
        overrides.save(p);
        visibility.invalidateAll();
    }

    /** Every agent the user can reach, with the effective level and where it comes from. */
    @Transactional(readOnly = true)
    public List<EffectivePermissionDTO> effective(long userId) {
        users.findLiveById(userId).orElseThrow(() -> new NotFoundException("user not found: " + userId));
        var online = registry.agents().stream().map(Agent::id).collect(Collectors.toSet());
        return resolver.effective(userId, online).entrySet().stream()
                .map(e -> new EffectivePermissionDTO(e.getKey(), e.getValue().level(), e.getValue().level().value(),
                        e.getValue().source(), online.contains(e.getKey())))
                .toList();
    }

    private AccessGroup group(long groupId) {
        return groups.findLiveById(groupId).orElseThrow(() -> new NotFoundException("group not found: " + groupId));
    }

    private GroupDTO toDto(AccessGroup g) {
        if (g.getId() == null) {
            return new GroupDTO(null, g.getName(), g.getDescription(), g.getCreatedAt(), List.of(), List.of());
        }
        var members = memberships.findLiveByGroup(g.getId()).stream()
                .map(m -> new MemberDTO(m.getUser().getId(), m.getUser().getUsername()))
                .toList();
        var agents = bindings.findLiveByGroup(g.getId()).stream()
                .map(b -> new BindingDTO(b.getAgentId(), PermissionLevel.of(b.getLevel())))
                .toList();
        return new GroupDTO(g.getId(), g.getName(), g.getDescription(), g.getCreatedAt(), members, agents);
    }
}
