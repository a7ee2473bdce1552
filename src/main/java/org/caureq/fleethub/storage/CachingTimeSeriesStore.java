package org.caureq.fleethub.storage;

import lombok.extern.slf4j.Slf4j;
import org.caureq.fleethub.error.StorageException;
import org.caureq.fleethub.model.MetricSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Durable backend fronted by a memory ring. Writes land in memory first; a failing durable
 * query falls back to whatever the ring still holds for that range.
 */
@Slf4j
public class CachingTimeSeriesStore implements TimeSeriesStore {
    private final MemoryTimeSeriesStore cache;
    private final TimeSeriesStore durable;

    public CachingTimeSeriesStore(MemoryTimeSeriesStore cache, TimeSeriesStore durable) {
        this.cache = cache;
        this.durable = durable;
    }

    @Override
    public void write(MetricSnapshot snapshot) {
        cache.write(snapshot);
        durable.write(snapshot);
    }

    @Override
    public List<MetricSnapshot> query(String agentId, Instant start, Instant end, int limit) {
        try {
            return durable.query(agentId, start, end, limit);
        } catch (StorageException e) {
            var cached = cache.query(agentId, start, end, limit);
            if (cached.isEmpty()) throw e;
            log.warn("[{}] query failed for {}, serving {} cached points: {}",
                    durable.name(), agentId, cached.size(), e.getMessage());
            return cached;
        }
    }

    @Override
    public Map<String, List<MetricSnapshot>> queryAll(Instant start, Instant end, int limit) {
        try {
            return durable.queryAll(start, end, limit);
        } catch (StorageException e) {
            var cached = cache.queryAll(start, end, limit);
            if (cached.isEmpty()) throw e;
            log.warn("[{}] queryAll failed, serving cache for {} agents: {}",
                    durable.name(), cached.size(), e.getMessage());
            return cached;
        }
    }

    @Override
    public void delete(Instant before) {
        cache.delete(before);
        durable.delete(before);
    }

    @Override
    public String name() { return durable.name(); }

    @Override
    public void close() {
        try {
            durable.close();
        } finally {
            cache.close();
        }
    }
}
