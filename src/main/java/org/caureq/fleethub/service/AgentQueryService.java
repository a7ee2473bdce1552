package org.caureq.fleethub.service;

import lombok.RequiredArgsConstructor;
import org.caureq.fleethub.api.dto.AgentDTO;
import org.caureq.fleethub.error.NotFoundException;
import org.caureq.fleethub.model.Agent;
import org.caureq.fleethub.permission.AccessDecision;
import org.caureq.fleethub.permission.PermissionLevel;
import org.caureq.fleethub.permission.PermissionResolver;
import org.caureq.fleethub.registry.AgentRegistry;
import org.caureq.fleethub.security.AuthenticatedUser;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Read side for connected agents. Only what the caller can see is returned; an invisible
 * agent looks exactly like an unknown one.
 */
@Service
@RequiredArgsConstructor
public class AgentQueryService {
    private final AgentRegistry registry;
    private final PermissionResolver resolver;

    public List<AgentDTO> list(AuthenticatedUser user) {
        var agents = registry.agents();
        var decisions = resolver.effective(user.userId(), agents.stream().map(Agent::id).toList());
        List<AgentDTO> out = new ArrayList<>();
        for (var a : agents) {
            AccessDecision d = decisions.get(a.id());
            if (d != null && d.visible()) out.add(AgentDTO.of(a, d));
        }
        return out;
    }

    public AgentDTO get(AuthenticatedUser user, String agentId) {
        var decision = resolver.require(user.userId(), agentId, PermissionLevel.READ_ONLY);
        var agent = registry.agent(agentId).orElseThrow(() -> NotFoundException.agent(agentId));
        return AgentDTO.of(agent, decision);
    }

    /** Ids of the connected agents the user can see. */
    public Set<String> visibleIds(AuthenticatedUser user) {
        var ids = registry.agents().stream().map(Agent::id).toList();
        return resolver.effective(user.userId(), ids).keySet().stream()
                .filter(ids::contains)
                .collect(Collectors.toCollection(TreeSet::new));
    }
}
