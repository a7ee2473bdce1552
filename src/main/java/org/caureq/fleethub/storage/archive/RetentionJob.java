package org.caureq.fleethub.storage.archive;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fleethub.error.StorageException;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class RetentionJob {
    private final MetricsArchive archive;

    /** Creates the partition for the current month once it rolls over. */
    @Scheduled(cron = "${fleethub.archive.rollover-cron:0 0 * * * *}", zone = "UTC")
    public void rollover() {
        if (!archive.enabled()) return;
        try {
            archive.ensurePartition(MonthlyPartitions.monthOf(archive.clock().instant()));
        } catch (StorageException e) {
            log.warn("[retention] partition rollover failed: {}", e.getMessage());
        }
    }

    @Scheduled(cron = "${fleethub.archive.retention-cron:0 30 3 * * *}", zone = "UTC")
    public void cleanup() {
        if (!archive.enabled()) return;
        try {
            archive.dropExpiredPartitions();
            archive.pruneRollups();
        } catch (DataAccessException e) {
            log.error("[retention] cleanup failed: {}", e.getMessage(), e);
        }
    }
}
