package org.caureq.fleethub.permission;

import lombok.RequiredArgsConstructor;
import org.caureq.fleethub.repo.AgentGroupBindingRepo;
import org.caureq.fleethub.repo.UserAgentPermissionRepo;
import org.caureq.fleethub.repo.UserRepo;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

@Component
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaPermissionGraph implements PermissionGraph {
    private final UserRepo userRepo;
    private final AgentGroupBindingRepo bindingRepo;
    private final UserAgentPermissionRepo overrideRepo;

    @Override
    public Optional<Subject> subject(long userId) {
        return userRepo.findLiveById(userId)
                .map(u -> new Subject(u.getId(), u.getUsername(), u.isSuperAdmin()));
    }

    @Override
    public OptionalInt groupCeiling(long userId, String agentId) {
        Integer max = bindingRepo.maxCeiling(userId, agentId);
        return max == null ? OptionalInt.empty() : OptionalInt.of(max);
    }

    @Override
    public OptionalInt override(long userId, String agentId) {
        return overrideRepo.findLive(userId, agentId)
                .map(p -> OptionalInt.of(p.getLevel()))
                .orElse(OptionalInt.empty());
    }

    @Override
    public Map<String, Integer> groupCeilings(long userId) {
        Map<String, Integer> out = new HashMap<>();
        for (Object[] row : bindingRepo.ceilingsForUser(userId)) {
            out.put((String) row[0], ((Number) row[1]).intValue());
        }
        return out;
    }

    @Override
    public Map<String, Integer> overrides(long userId) {
        Map<String, Integer> out = new HashMap<>();
        for (var p : overrideRepo.findLiveByUser(userId)) {
            out.put(p.getAgentId(), p.getLevel());
        }
        return out;
    }
}
