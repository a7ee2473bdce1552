package org.caureq.fleethub.storage.archive;

import org.caureq.fleethub.Snapshots;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RollupAggregatorTest {

    private static final Instant HOUR = Instant.parse("2026-03-09T10:00:00Z");

    private MetricsArchive archive;
    private RollupAggregator aggregator;

    @BeforeEach
    void setUp() {
        archive = ArchiveFixture.archive();
        aggregator = new RollupAggregator(archive);
        archive.record(Snapshots.of("web-01", HOUR.plusSeconds(60), 10, 1, 4));
        archive.record(Snapshots.of("web-01", HOUR.plusSeconds(1800), 30, 3, 4));
        archive.record(Snapshots.of("web-02", HOUR.plusSeconds(120), 50, 2, 4));
        // next hour, not part of the bucket
        archive.record(Snapshots.of("web-01", HOUR.plusSeconds(3600), 99, 4, 4));
    }

    @Test
    void writesOneRowPerAgentWithData() {
        assertThat(aggregator.aggregate(Granularity.HOURLY, HOUR)).isEqualTo(2);

        var rows = archive.rollups(Granularity.HOURLY, "web-01", HOUR, HOUR);
        assertThat(rows).singleElement().satisfies(r -> {
            assertThat(r.cpuAvg()).isEqualTo(20.0);
            assertThat(r.cpuMax()).isEqualTo(30.0);
            assertThat(r.memAvg()).isEqualTo(50.0);
            assertThat(r.memMax()).isEqualTo(75.0);
            assertThat(r.dataPoints()).isEqualTo(2);
        });
    }

    @Test
    void existingBucketsAreNeverRewritten() {
        aggregator.aggregate(Granularity.HOURLY, HOUR);
        archive.record(Snapshots.of("web-01", HOUR.plusSeconds(2000), 90, 1, 4));

        assertThat(aggregator.aggregate(Granularity.HOURLY, HOUR)).isZero();
        assertThat(archive.rollups(Granularity.HOURLY, "web-01", HOUR, HOUR).get(0).dataPoints()).isEqualTo(2);
    }

    @Test
    void concurrentlyWrittenBucketDoesNotStopOtherAgents() {
        var racing = mock(MetricsArchive.class);
        var end = HOUR.plus(Granularity.HOURLY.width());
        when(racing.agentsWithData(HOUR, end)).thenReturn(new LinkedHashSet<>(List.of("web-01", "web-02")));
        when(racing.rawBucket(anyString(), eq(HOUR), eq(end)))
                .thenReturn(List.of(new HistoryPoint("x", HOUR, 10, 20, 0, 0, 0, 0, 0, 0)));
        doThrow(new DuplicateKeyException("uk_rollup_hourly"))
                .when(racing).insertRollup(eq(Granularity.HOURLY), argThat(r -> r.agentId().equals("web-01")));

        assertThat(new RollupAggregator(racing).aggregate(Granularity.HOURLY, HOUR)).isEqualTo(1);
        verify(racing).insertRollup(eq(Granularity.HOURLY), argThat(r -> r.agentId().equals("web-02")));
    }

    @Test
    void reconcileComparesRollupWithRawRows() {
        aggregator.aggregate(Granularity.HOURLY, HOUR);
        assertThat(aggregator.reconcile(Granularity.HOURLY, "web-01", HOUR).consistent()).isTrue();

        archive.record(Snapshots.of("web-01", HOUR.plusSeconds(2000), 90, 1, 4));
        var r = aggregator.reconcile(Granularity.HOURLY, "web-01", HOUR);
        assertThat(r.consistent()).isFalse();
        assertThat(r.rawPoints()).isEqualTo(3);
    }

    @Test
    void dailyBucketCoversWholeDay() {
        assertThat(aggregator.aggregate(Granularity.DAILY, HOUR.plusSeconds(5))).isEqualTo(2);
        var rows = archive.rollups(Granularity.DAILY, "web-01", Instant.parse("2026-03-09T00:00:00Z"),
                Instant.parse("2026-03-09T00:00:00Z"));
        assertThat(rows.get(0).dataPoints()).isEqualTo(3);
    }

    @Test
    void summarizeSumsNetworkTotals() {
        var p1 = new HistoryPoint("a", HOUR, 1, 1, 0, 0, 100, 10, 0, 0);
        var p2 = new HistoryPoint("a", HOUR, 3, 1, 0, 0, 200, 20, 0, 0);
        var row = RollupAggregator.summarize("a", HOUR, List.of(p1, p2));
        assertThat(row.netRxTotal()).isEqualTo(300);
        assertThat(row.netTxTotal()).isEqualTo(30);
        assertThat(row.cpuAvg()).isEqualTo(2.0);
    }
}
