package org.caureq.fleethub.storage.archive;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.YearMonth;

import static org.assertj.core.api.Assertions.assertThat;

class MonthlyPartitionsTest {

    @Test
    void nameFromMonthMatchesNameFromAnyInstantInIt() {
        var expected = MonthlyPartitions.partitionName(2026, 1);
        assertThat(expected).isEqualTo("metrics_history_2026_01");
        assertThat(MonthlyPartitions.partitionFor(Instant.parse("2026-01-01T00:00:00Z"))).isEqualTo(expected);
        assertThat(MonthlyPartitions.partitionFor(Instant.parse("2026-01-31T23:59:59.999Z"))).isEqualTo(expected);
        assertThat(MonthlyPartitions.partitionFor(Instant.parse("2026-02-01T00:00:00Z"))).isNotEqualTo(expected);
    }

    @Test
    void parsesOwnNamesCaseInsensitively() {
        assertThat(MonthlyPartitions.parse("METRICS_HISTORY_2025_12")).contains(YearMonth.of(2025, 12));
        assertThat(MonthlyPartitions.parse("metrics_history_2025_13")).isEmpty();
        assertThat(MonthlyPartitions.parse("metrics_hourly")).isEmpty();
        assertThat(MonthlyPartitions.parse(null)).isEmpty();
    }

    @Test
    void betweenSpansYearBoundary() {
        assertThat(MonthlyPartitions.between(Instant.parse("2025-11-20T00:00:00Z"), Instant.parse("2026-01-02T00:00:00Z")))
                .containsExactly("metrics_history_2025_11", "metrics_history_2025_12", "metrics_history_2026_01");
    }

    @Test
    void retentionKeepsCutoffMonthAndDropsOlderOnes() {
        var cutoff = MonthlyPartitions.retentionCutoff(Instant.parse("2026-03-10T00:00:00Z"), 30);

        assertThat(cutoff).isEqualTo(YearMonth.of(2026, 2));
        assertThat(MonthlyPartitions.expired(YearMonth.of(2026, 2), cutoff)).isFalse();
        assertThat(MonthlyPartitions.expired(YearMonth.of(2026, 3), cutoff)).isFalse();
        assertThat(MonthlyPartitions.expired(YearMonth.of(2026, 1), cutoff)).isTrue();
    }
}
