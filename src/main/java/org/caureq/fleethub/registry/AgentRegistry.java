package org.caureq.fleethub.registry;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fleethub.error.ConflictException;
import org.caureq.fleethub.model.Agent;
import org.caureq.fleethub.model.FleetSummary;
import org.caureq.fleethub.model.MetricSnapshot;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.UnaryOperator;

/**
 * Connected agents and their latest snapshot. The two tables have independent read/write
 * locks; when both are needed the agents lock is always taken first.
 * Inventory frames (static, periodic) are merged into the snapshot but an agent only counts as
 * reporting, and only has a {@link #latest} snapshot, once a metrics or realtime frame arrived.
 * Nothing here performs I/O, so no caller ever waits on storage while holding a lock.
 */
@Slf4j
@Component
public class AgentRegistry {
    private final ReentrantReadWriteLock agentsLock = new ReentrantReadWriteLock();
    private final ReentrantReadWriteLock snapshotsLock = new ReentrantReadWriteLock();
    private final Map<String, Agent> agents = new HashMap<>();
    private final Map<String, MetricSnapshot> snapshots = new HashMap<>();
    private final Set<String> sampled = new HashSet<>();

    /* --------------------- agents --------------------- */

    /** @throws ConflictException if an agent with the same id is already connected */
    public void registerAgent(Agent agent) {
        agentsLock.writeLock().lock();
        try {
            var existing = agents.get(agent.id());
            if (existing != null) {
                throw new ConflictException("agent " + agent.id() + " already connected via " + existing.transport());
            }
            agents.put(agent.id(), agent);
        } finally {
            agentsLock.writeLock().unlock();
        }
        log.info("agent registered id={} host={} transport={}", agent.id(), agent.hostname(), agent.transport());
    }

    /**
     * Removes the agent and its latest snapshot, but only if it still belongs to
     * {@code connectionId}. Unknown ids are a no-op.
     */
    public Optional<Agent> unregisterAgent(String agentId, String connectionId) {
        Agent removed;
        agentsLock.writeLock().lock();
        try {
            var current = agents.get(agentId);
            if (current == null || (connectionId != null && !connectionId.equals(current.connectionId()))) {
                return Optional.empty();
            }
            removed = agents.remove(agentId);
            snapshotsLock.writeLock().lock();
            try {
                snapshots.remove(agentId);
                sampled.remove(agentId);
            } finally {
                snapshotsLock.writeLock().unlock();
            }
        } finally {
            agentsLock.writeLock().unlock();
        }
        log.info("agent unregistered id={}", agentId);
        return Optional.of(removed);
    }

    public void touch(String agentId, Instant at) {
        agentsLock.writeLock().lock();
        try {
            agents.computeIfPresent(agentId, (k, a) -> a.withLastHeartbeat(at));
        } finally {
            agentsLock.writeLock().unlock();
        }
    }

    public Optional<Agent> agent(String agentId) {
        agentsLock.readLock().lock();
        try {
            return Optional.ofNullable(agents.get(agentId));
        } finally {
            agentsLock.readLock().unlock();
        }
    }

    public List<Agent> agents() {
        agentsLock.readLock().lock();
        try {
            var list = new ArrayList<>(agents.values());
            list.sort(Comparator.comparing(Agent::id));
            return list;
        } finally {
            agentsLock.readLock().unlock();
        }
    }

    public int connectedCount() {
        agentsLock.readLock().lock();
        try {
            return agents.size();
        } finally {
            agentsLock.readLock().unlock();
        }
    }

    /** Agents whose last heartbeat is strictly older than {@code cutoff}. */
    public List<Agent> findStale(Instant cutoff) {
        agentsLock.readLock().lock();
        try {
            return agents.values().stream()
                    .filter(a -> a.lastHeartbeat() != null && a.lastHeartbeat().isBefore(cutoff))
                    .toList();
        } finally {
            agentsLock.readLock().unlock();
        }
    }

    /* --------------------- snapshots --------------------- */

    public MetricSnapshot updateSnapshot(MetricSnapshot snapshot) {
        return mutate(snapshot.agentId(), snapshot.timestamp(), true, cur -> snapshot);
    }

    public MetricSnapshot mergeRealtime(String agentId, RealtimeUpdate update, Instant at) {
        return mutate(agentId, at, true, cur -> SnapshotMerger.realtime(cur, update, at));
    }

    public MetricSnapshot mergeStatic(String agentId, StaticUpdate update, Instant at) {
        return mutate(agentId, at, false, cur -> SnapshotMerger.staticInfo(cur, update));
    }

    public MetricSnapshot mergePeriodic(String agentId, PeriodicUpdate update, Instant at) {
        return mutate(agentId, at, false, cur -> SnapshotMerger.periodic(cur, update));
    }

    private MetricSnapshot mutate(String agentId, Instant at, boolean sample, UnaryOperator<MetricSnapshot> fn) {
        snapshotsLock.writeLock().lock();
        try {
            var cur = snapshots.getOrDefault(agentId, MetricSnapshot.empty(agentId, at));
            var next = fn.apply(cur);
            snapshots.put(agentId, next);
            if (sample) sampled.add(agentId);
            return next;
        } finally {
            snapshotsLock.writeLock().unlock();
        }
    }

    public Optional<MetricSnapshot> latest(String agentId) {
        snapshotsLock.readLock().lock();
        try {
            return sampled.contains(agentId) ? Optional.ofNullable(snapshots.get(agentId)) : Optional.empty();
        } finally {
            snapshotsLock.readLock().unlock();
        }
    }

    public Map<String, MetricSnapshot> allLatest() {
        snapshotsLock.readLock().lock();
        try {
            Map<String, MetricSnapshot> copy = new LinkedHashMap<>();
            sampled.stream().sorted().forEach(k -> copy.put(k, snapshots.get(k)));
            return copy;
        } finally {
            snapshotsLock.readLock().unlock();
        }
    }

    /* --------------------- summary --------------------- */

    public FleetSummary summary() {
        return summarize(null);
    }

    /** Summary restricted to the given agent ids; {@code null} means every agent. */
    public FleetSummary summarize(Set<String> only) {
        Set<String> known = new HashSet<>();
        agentsLock.readLock().lock();
        try {
            known.addAll(agents.keySet());
            snapshotsLock.readLock().lock();
            try {
                known.addAll(snapshots.keySet());
                if (only != null) known.retainAll(only);

                int reporting = 0;
                double cpuSum = 0;
                long total = 0, used = 0;
                for (var id : known) {
                    if (!sampled.contains(id)) continue;
                    var s = snapshots.get(id);
                    reporting++;
                    cpuSum += s.cpu().usagePercent();
                    total += s.memory().total();
                    used += s.memory().used();
                }
                double avgCpu = reporting == 0 ? 0.0 : cpuSum / reporting;
                double memPct = total == 0 ? 0.0 : (double) used / total * 100.0;
                return new FleetSummary(known.size(), reporting, avgCpu, memPct, total, used);
            } finally {
                snapshotsLock.readLock().unlock();
            }
        } finally {
            agentsLock.readLock().unlock();
        }
    }

    @PreDestroy
    public void clear() {
        agentsLock.writeLock().lock();
        try {
            snapshotsLock.writeLock().lock();
            try {
                agents.clear();
                snapshots.clear();
                sampled.clear();
            } finally {
                snapshotsLock.writeLock().unlock();
            }
        } finally {
            agentsLock.writeLock().unlock();
        }
    }
}
