package org.caureq.fleethub.storage;

import org.caureq.fleethub.Snapshots;
import org.caureq.fleethub.error.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CachingTimeSeriesStoreTest {

    @Mock
    TimeSeriesStore durable;

    private MemoryTimeSeriesStore cache;
    private CachingTimeSeriesStore store;

    @BeforeEach
    void setUp() {
        cache = new MemoryTimeSeriesStore(10);
        store = new CachingTimeSeriesStore(cache, durable);
    }

    @Test
    void writesGoToBothTiers() {
        var s = Snapshots.web01();
        store.write(s);

        verify(durable).write(s);
        assertThat(cache.size("web-01")).isEqualTo(1);
    }

    @Test
    void durableResultsWinWhenHealthy() {
        var fromDb = List.of(Snapshots.of("web-01", Snapshots.T0, 1, 1, 2));
        when(durable.query(eq("web-01"), any(), any(), anyInt())).thenReturn(fromDb);
        cache.write(Snapshots.web01());

        assertThat(store.query("web-01", null, null, 0)).isEqualTo(fromDb);
    }

    @Test
    void fallsBackToCacheWhenDurableQueryFails() {
        when(durable.query(eq("web-01"), any(), any(), anyInt())).thenThrow(new StorageException("down"));
        when(durable.name()).thenReturn("influxdb");
        cache.write(Snapshots.web01());

        assertThat(store.query("web-01", null, null, 0)).containsExactly(Snapshots.web01());
    }

    @Test
    void fallbackHoldsOneCopyOfARedeliveredPoint() {
        when(durable.query(eq("web-01"), any(), any(), anyInt())).thenThrow(new StorageException("down"));
        when(durable.name()).thenReturn("influxdb");
        store.write(Snapshots.of("web-01", Snapshots.T0, 10, 1, 2));
        store.write(Snapshots.of("web-01", Snapshots.T0, 20, 1, 2));

        assertThat(store.query("web-01", null, null, 0))
                .singleElement().satisfies(p -> assertThat(p.cpu().usagePercent()).isEqualTo(20.0));
    }

    @Test
    void rethrowsWhenCacheHasNothingEither() {
        when(durable.query(eq("web-01"), any(), any(), anyInt())).thenThrow(new StorageException("down"));

        assertThatThrownBy(() -> store.query("web-01", null, null, 0))
                .isInstanceOf(StorageException.class)
                .hasMessage("down");
    }

    @Test
    void reportsDurableName() {
        when(durable.name()).thenReturn("timescaledb");
        assertThat(store.name()).isEqualTo("timescaledb");
    }
}
