package org.caureq.fleethub.permission;

import lombok.RequiredArgsConstructor;
import org.caureq.fleethub.error.AuthorizationException;
import org.caureq.fleethub.error.AuthorizationException.Reason;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;
import java.util.TreeSet;

/**
 * Effective (user, agent) permission:
 * superadmin is always {@link PermissionLevel#SYSTEM_ADMIN}; otherwise an explicit override
 * replaces the group ceiling; with neither, the agent is invisible.
 * Pure function of the {@link PermissionGraph}, no state of its own.
 */
@Service
@RequiredArgsConstructor
public class PermissionResolver {
    private final PermissionGraph graph;

    public AccessDecision resolve(long userId, String agentId) {
        var subject = graph.subject(userId);
        if (subject.isEmpty()) return AccessDecision.invisible();
        if (subject.get().superAdmin()) {
            return AccessDecision.granted(PermissionLevel.SYSTEM_ADMIN, AccessDecision.Source.SUPERADMIN);
        }

        OptionalInt override = graph.override(userId, agentId);
        if (override.isPresent()) {
            return AccessDecision.granted(PermissionLevel.of(override.getAsInt()), AccessDecision.Source.OVERRIDE);
        }
        OptionalInt ceiling = graph.groupCeiling(userId, agentId);
        if (ceiling.isPresent()) {
            return AccessDecision.granted(PermissionLevel.of(ceiling.getAsInt()), AccessDecision.Source.GROUP);
        }
        return AccessDecision.invisible();
    }

    /**
     * Throws unless the user holds at least {@code required} on the agent.
     * An invisible agent is reported with reason INVISIBLE so callers can render it as "not found".
     */
    public AccessDecision require(long userId, String agentId, PermissionLevel required) {
        var decision = resolve(userId, agentId);
        if (!decision.visible()) {
            throw new AuthorizationException(Reason.INVISIBLE, "agent not found: " + agentId);
        }
        if (!decision.level().atLeast(required)) {
            throw new AuthorizationException(Reason.INSUFFICIENT_LEVEL,
                    "requires " + required + " on " + agentId + ", have " + decision.level());
        }
        return decision;
    }

    public boolean isSuperAdmin(long userId) {
        return graph.subject(userId).map(PermissionGraph.Subject::superAdmin).orElse(false);
    }

    /**
     * Every agent the user can see, with its decision. {@code knownAgents} (typically the
     * connected ones) only matters for superadmins, who see everything.
     */
    public Map<String, AccessDecision> effective(long userId, Collection<String> knownAgents) {
        Map<String, AccessDecision> out = new LinkedHashMap<>();
        var subject = graph.subject(userId);
        if (subject.isEmpty()) return out;
        if (subject.get().superAdmin()) {
            for (var id : new TreeSet<>(knownAgents)) {
                out.put(id, AccessDecision.granted(PermissionLevel.SYSTEM_ADMIN, AccessDecision.Source.SUPERADMIN));
            }
            return out;
        }
        var ceilings = graph.groupCeilings(userId);
        var overrides = graph.overrides(userId);
        var ids = new TreeSet<String>();
        ids.addAll(ceilings.keySet());
        ids.addAll(overrides.keySet());
        for (var id : ids) {
            Integer o = overrides.get(id);
            if (o != null) {
                out.put(id, AccessDecision.granted(PermissionLevel.of(o), AccessDecision.Source.OVERRIDE));
            } else {
                out.put(id, AccessDecision.granted(PermissionLevel.of(ceilings.get(id)), AccessDecision.Source.GROUP));
            }
        }
        return out;
    }
}
