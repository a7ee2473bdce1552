package org.caureq.fleethub.storage;

import com.influxdb.client.InfluxDBClientFactory;
import com.influxdb.client.InfluxDBClientOptions;
import com.zaxxer.hikari.HikariDataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fleethub.config.TimeSeriesProps;
import org.caureq.fleethub.error.ValidationException;
import okhttp3.OkHttpClient;
import org.springframework.boot.jdbc.DataSourceBuilder;

/**
 * Picks the backend named by {@code timeseries.type}. Durable backends come wrapped in a
 * {@link CachingTimeSeriesStore} so recent points survive a backend outage.
 */
@Slf4j
@RequiredArgsConstructor
public class TimeSeriesStoreFactory {
    private final TimeSeriesProps props;

    public TimeSeriesStore create() {
        var type = StorageType.from(props.type());
        var cache = new MemoryTimeSeriesStore(props.memory().capacity());
        TimeSeriesStore store = switch (type) {
            case MEMORY -> cache;
            case INFLUXDB -> new CachingTimeSeriesStore(cache, influx());
            case TIMESCALEDB -> new CachingTimeSeriesStore(cache, timescale());
        };
        log.info("[timeseries] backend={} ringCapacity={} timeout={}", store.name(), cache.capacity(), props.timeout());
        return store;
    }

    private InfluxTimeSeriesStore influx() {
        var influx = props.influxdb();
        if (influx == null || isBlank(influx.url()) || isBlank(influx.bucket())) {
            throw new ValidationException("timeseries.influxdb.url and .bucket are required for the influxdb backend");
        }
        var options = InfluxDBClientOptions.builder()
                .url(influx.url())
                .org(influx.org())
                .bucket(influx.bucket())
                .okHttpClient(new OkHttpClient.Builder()
                        .connectTimeout(props.timeout())
                        .readTimeout(props.timeout())
                        .writeTimeout(props.timeout()));
        if (!isBlank(influx.token())) options.authenticateToken(influx.token().toCharArray());
        return new InfluxTimeSeriesStore(InfluxDBClientFactory.create(options.build()), influx);
    }

    private TimescaleTimeSeriesStore timescale() {
        var ts = props.timescaledb();
        if (ts == null || isBlank(ts.url())) {
            throw new ValidationException("timeseries.timescaledb.url is required for the timescaledb backend");
        }
        var ds = DataSourceBuilder.create()
                .type(HikariDataSource.class)
                .url(ts.url())
                .username(ts.username())
                .password(ts.password())
                .build();
        ds.setPoolName("timeseries");
        ds.setMaximumPoolSize(ts.maxPoolSize() > 0 ? ts.maxPoolSize() : 10);
        ds.setConnectionTimeout(Math.max(250, props.timeout().toMillis()));
        var store = new TimescaleTimeSeriesStore(ds, SqlDialect.of(ds), props.timeout());
        store.initSchema();
        return store;
    }

    private static boolean isBlank(String s) { return s == null || s.isBlank(); }
}
