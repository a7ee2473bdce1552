package org.caureq.fleethub.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fleethub.error.PartialWriteException;
import org.caureq.fleethub.error.StorageException;
import org.caureq.fleethub.model.MetricSnapshot;
import org.caureq.fleethub.storage.TimeSeriesStore;
import org.caureq.fleethub.storage.archive.MetricsArchive;
import org.springframework.stereotype.Service;

/**
 * Durable side of a metrics frame: time-series store, then the monthly archive.
 * Runs on the reporting agent's own connection thread and never throws, so a storage outage
 * cannot break the agent's stream or stall another agent.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestService {
    private final TimeSeriesStore store;
    private final MetricsArchive archive;
    private final StorageHealth health;

    public void persist(MetricSnapshot snapshot) {
        try {
            store.write(snapshot);
            health.recordSuccess();
        } catch (PartialWriteException e) {
            health.recordFailure(store.name(), e);
            log.warn("[{}] partial write for {}: written={} failed={}",
                    store.name(), snapshot.agentId(), e.written(), e.failed());
        } catch (StorageException e) {
            health.recordFailure(store.name(), e);
            log.warn("[{}] write failed for {}: {}", store.name(), snapshot.agentId(), e.getMessage());
        }

        if (!archive.enabled()) return;
        try {
            archive.record(snapshot);
        } catch (StorageException e) {
            health.recordFailure("archive", e);
            log.warn("[archive] write failed for {}: {}", snapshot.agentId(), e.getMessage());
        }
        log.debug("persisted {} @ {}", snapshot.agentId(), snapshot.timestamp());
    }
}
