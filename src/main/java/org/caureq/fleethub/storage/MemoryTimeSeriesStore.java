package org.caureq.fleethub.storage;

import org.caureq.fleethub.model.MetricSnapshot;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded per-agent ring buffer. A write at capacity evicts the oldest point of that agent only;
 * a write with the timestamp of a stored point replaces it. Each ring has its own lock, so
 * agents never contend with each other. Rings emptied by {@link #delete} are released.
 */
public class MemoryTimeSeriesStore implements TimeSeriesStore {
    public static final int DEFAULT_CAPACITY = 600; // ~10 min at 1 Hz

    private final int capacity;
    private final Map<String, Ring> rings = new ConcurrentHashMap<>();

    public MemoryTimeSeriesStore() {
        this(DEFAULT_CAPACITY);
    }

    public MemoryTimeSeriesStore(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        this.capacity = capacity;
    }

    private static final class Ring {
        final ReentrantLock lock = new ReentrantLock();
        final ArrayDeque<MetricSnapshot> points = new ArrayDeque<>();
    }

    @Override
    public void write(MetricSnapshot snapshot) {
        rings.compute(snapshot.agentId(), (k, ring) -> {
            if (ring == null) ring = new Ring();
            ring.lock.lock();
            try {
                boolean replaced = ring.points.removeIf(p -> p.timestamp().equals(snapshot.timestamp()));
                if (!replaced && ring.points.size() >= capacity) ring.points.pollFirst();
                ring.points.addLast(snapshot);
            } finally {
                ring.lock.unlock();
            }
            return ring;
        });
    }

    @Override
    public List<MetricSnapshot> query(String agentId, Instant start, Instant end, int limit) {
        var ring = rings.get(agentId);
        if (ring == null) return List.of();
        List<MetricSnapshot> matched = new ArrayList<>();
        ring.lock.lock();
        try {
            for (var p : ring.points) {
                if (start != null && p.timestamp().isBefore(start)) continue;
                if (end != null && p.timestamp().isAfter(end)) continue;
                matched.add(p);
            }
        } finally {
            ring.lock.unlock();
        }
        matched.sort(Comparator.comparing(MetricSnapshot::timestamp));
        if (limit > 0 && matched.size() > limit) {
            return List.copyOf(matched.subList(matched.size() - limit, matched.size()));
        }
        return matched;
    }

    @Override
    public Map<String, List<MetricSnapshot>> queryAll(Instant start, Instant end, int limit) {
        Map<String, List<MetricSnapshot>> out = new LinkedHashMap<>();
        for (var agentId : new TreeMap<>(rings).keySet()) {
            var pts = query(agentId, start, end, limit);
            if (!pts.isEmpty()) out.put(agentId, pts);
        }
        return out;
    }

    @Override
    public void delete(Instant before) {
        for (var agentId : List.copyOf(rings.keySet())) {
            rings.computeIfPresent(agentId, (k, ring) -> {
                ring.lock.lock();
                try {
                    ring.points.removeIf(p -> p.timestamp().isBefore(before));
                    return ring.points.isEmpty() ? null : ring;
                } finally {
                    ring.lock.unlock();
                }
            });
        }
    }

    /** Number of agents currently holding points. */
    public int agentCount() {
        return rings.size();
    }

    public int size(String agentId) {
        var ring = rings.get(agentId);
        if (ring == null) return 0;
        ring.lock.lock();
        try {
            return ring.points.size();
        } finally {
            ring.lock.unlock();
        }
    }

    public int capacity() { return capacity; }

    @Override
    public String name() { return "memory"; }

    @Override
    public void close() {
        rings.clear();
    }
}
