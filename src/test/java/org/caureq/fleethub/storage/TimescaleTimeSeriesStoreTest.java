package org.caureq.fleethub.storage;

import org.caureq.fleethub.Snapshots;
import org.caureq.fleethub.error.StorageException;
import org.caureq.fleethub.model.MetricSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Runs the relational backend against embedded H2 in PostgreSQL mode. */
class TimescaleTimeSeriesStoreTest {

    private TimescaleTimeSeriesStore store;

    @BeforeEach
    void setUp() {
        var ds = new DriverManagerDataSource(
                "jdbc:h2:mem:ts-" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1", "sa", "");
        assertThat(SqlDialect.of(ds)).isEqualTo(SqlDialect.H2);
        store = new TimescaleTimeSeriesStore(ds, SqlDialect.H2, Duration.ofSeconds(5));
        store.initSchema();
    }

    @Test
    void rewritingSameTimeAndAgentKeepsOneRowWithLatestValues() {
        store.write(Snapshots.detailed("web-01", Snapshots.T0, 10.0));
        store.write(Snapshots.detailed("web-01", Snapshots.T0, 55.0));

        assertThat(store.count("metrics", "web-01")).isEqualTo(1);
        assertThat(store.count("disk_metrics", "web-01")).isEqualTo(1);
        var points = store.query("web-01", null, null, 0);
        assertThat(points).hasSize(1);
        assertThat(points.get(0).cpu().usagePercent()).isEqualTo(55.0);
    }

    @Test
    void failedDetailRowRollsBackTheWholeSnapshot() {
        var s = Snapshots.detailed("web-01", Snapshots.T0, 10.0);
        var bad = s.toBuilder()
                .disks(List.of(s.disks().get(0).toBuilder().mountPoint("/" + "x".repeat(300)).build()))
                .build();

        assertThatThrownBy(() -> store.write(bad)).isInstanceOf(StorageException.class);

        assertThat(store.count("metrics", "web-01")).isZero();
        assertThat(store.count("disk_metrics", "web-01")).isZero();
    }

    @Test
    void queryReturnsMostRecentPointsChronologically() {
        for (int i = 0; i < 5; i++) {
            store.write(Snapshots.of("web-01", Snapshots.T0.plusSeconds(i), i, 1, 2));
        }

        var points = store.query("web-01", null, null, 2);
        assertThat(points).extracting(MetricSnapshot::timestamp)
                .containsExactly(Snapshots.T0.plusSeconds(3), Snapshots.T0.plusSeconds(4));
    }

    @Test
    void detailRowsAreAttachedToTheirSnapshot() {
        store.write(Snapshots.detailed("web-01", Snapshots.T0, 10.0));

        var p = store.query("web-01", Snapshots.T0, Snapshots.T0, 0).get(0);
        assertThat(p.memory().used()).isEqualTo(1_000);
        assertThat(p.disks()).singleElement().satisfies(d -> {
            assertThat(d.mountPoint()).isEqualTo("/");
            assertThat(d.readBytesPerSec()).isEqualTo(1_000);
        });
        assertThat(p.networks()).singleElement().satisfies(n -> {
            assertThat(n.iface()).isEqualTo("eth0");
            assertThat(n.up()).isTrue();
        });
    }

    @Test
    void queryAllGroupsByAgent() {
        store.write(Snapshots.of("a", Snapshots.T0, 1, 1, 2));
        store.write(Snapshots.of("b", Snapshots.T0, 2, 1, 2));

        assertThat(store.queryAll(null, null, 0)).containsOnlyKeys("a", "b");
    }

    @Test
    void deleteDropsOlderRowsFromEveryTable() {
        store.write(Snapshots.detailed("web-01", Snapshots.T0, 1));
        store.write(Snapshots.detailed("web-01", Snapshots.T0.plusSeconds(60), 2));

        store.delete(Snapshots.T0.plusSeconds(30));
        assertThat(store.count("metrics", "web-01")).isEqualTo(1);
        assertThat(store.count("network_metrics", "web-01")).isEqualTo(1);
    }
}
