package org.caureq.fleethub.storage.archive;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fleethub.config.AppProps;
import org.caureq.fleethub.error.StorageException;
import org.caureq.fleethub.error.ValidationException;
import org.caureq.fleethub.model.MetricSnapshot;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Long-term raw history in monthly tables on the primary database, plus the hourly and daily
 * rollup tables. Partition tables are created lazily and dropped whole by retention.
 */
@Slf4j
@Component
public class MetricsArchive {
    private final JdbcTemplate jdbc;
    private final AppProps.ArchiveProps props;
    private final Clock clock;
    private final Set<String> knownPartitions = ConcurrentHashMap.newKeySet();

    public MetricsArchive(JdbcTemplate jdbc, AppProps appProps, Clock clock) {
        this.jdbc = jdbc;
        this.props = appProps.archive();
        this.clock = clock;
    }

    public boolean enabled() { return props.enabled(); }

    @PostConstruct
    public void init() {
        if (!enabled()) {
            log.info("[archive] disabled");
            return;
        }
        ensureRollupTables();
        ensurePartition(MonthlyPartitions.monthOf(clock.instant()));
        log.info("[archive] ready, retention={}d hourly={}d daily={}d",
                props.retentionDays(), props.hourlyRetentionDays(), props.dailyRetentionDays());
    }

    /* --------------------- schema --------------------- */

    void ensureRollupTables() {
        for (var g : Granularity.values()) {
            jdbc.execute("CREATE TABLE IF NOT EXISTS " + g.table() + " ("
                    + " id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,"
                    + " agent_id VARCHAR(128) NOT NULL,"
                    + " bucket_start TIMESTAMP WITH TIME ZONE NOT NULL,"
                    + " cpu_avg DOUBLE PRECISION, cpu_max DOUBLE PRECISION,"
                    + " mem_avg DOUBLE PRECISION, mem_max DOUBLE PRECISION,"
                    + " net_rx_total BIGINT, net_tx_total BIGINT,"
                    + " data_points INT NOT NULL)");
            jdbc.execute("CREATE UNIQUE INDEX IF NOT EXISTS uq_" + g.table() + "_agent_bucket ON "
                    + g.table() + " (agent_id, bucket_start)");
        }
    }

    public String ensurePartition(YearMonth month) {
        var table = MonthlyPartitions.partitionName(month);
        if (knownPartitions.contains(table)) return table;
        try {
            jdbc.execute("CREATE TABLE IF NOT EXISTS " + table + " ("
                    + " id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,"
                    + " agent_id VARCHAR(128) NOT NULL,"
                    + " ts TIMESTAMP WITH TIME ZONE NOT NULL,"
                    + " cpu_percent DOUBLE PRECISION, mem_percent DOUBLE PRECISION,"
                    + " disk_read_ps BIGINT, disk_write_ps BIGINT,"
                    + " net_rx_ps BIGINT, net_tx_ps BIGINT,"
                    + " gpu_percent DOUBLE PRECISION, load_avg1 DOUBLE PRECISION)");
            jdbc.execute("CREATE INDEX IF NOT EXISTS idx_" + table + "_agent_ts ON " + table + " (agent_id, ts)");
        } catch (DataAccessException e) {
            throw new StorageException("archive: cannot create partition " + table, e);
        }
        knownPartitions.add(table);
        log.info("[archive] partition {} ready", table);
        return table;
    }

    /** Archive partitions present in the database, by month. */
    public Map<YearMonth, String> listPartitions() {
        Map<YearMonth, String> out = new TreeMap<>();
        List<String> names = jdbc.execute((ConnectionCallback<List<String>>) con -> {
            var md = con.getMetaData();
            var pattern = md.storesUpperCaseIdentifiers()
                    ? MonthlyPartitions.PREFIX.toUpperCase(Locale.ROOT) + "%"
                    : MonthlyPartitions.PREFIX + "%";
            List<String> found = new ArrayList<>();
            try (ResultSet rs = md.getTables(null, null, pattern, new String[]{"TABLE"})) {
                while (rs.next()) found.add(rs.getString("TABLE_NAME"));
            }
            return found;
        });
        if (names == null) return out;
        for (var n : names) {
            MonthlyPartitions.parse(n).ifPresent(ym -> out.put(ym, MonthlyPartitions.partitionName(ym)));
        }
        return out;
    }

    /* --------------------- raw history --------------------- */

    public void record(MetricSnapshot snapshot) {
        if (!enabled()) return;
        var p = HistoryPoint.of(snapshot);
        var table = ensurePartition(MonthlyPartitions.monthOf(p.timestamp()));
        try {
            jdbc.update("INSERT INTO " + table + " (agent_id, ts, cpu_percent, mem_percent, disk_read_ps, disk_write_ps,"
                            + " net_rx_ps, net_tx_ps, gpu_percent, load_avg1) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    p.agentId(), utc(p.timestamp()), p.cpuPercent(), p.memPercent(), p.diskReadPs(), p.diskWritePs(),
                    p.netRxPs(), p.netTxPs(), p.gpuPercent(), p.loadAvg1());
        } catch (DataAccessException e) {
            throw new StorageException("archive: insert failed for " + p.agentId(), e);
        }
    }

    /** Raw rows of one agent in [start, end], chronological, across every existing partition. */
    public List<HistoryPoint> queryHistory(String agentId, Instant start, Instant end, int limit) {
        return rawRange(agentId, start, end, false, limit);
    }

    /** Raw rows in [start, endExclusive). */
    List<HistoryPoint> rawBucket(String agentId, Instant start, Instant endExclusive) {
        return rawRange(agentId, start, endExclusive, true, 0);
    }

    private List<HistoryPoint> rawRange(String agentId, Instant start, Instant end, boolean endExclusive, int limit) {
        var existing = listPartitions();
        List<HistoryPoint> out = new ArrayList<>();
        for (var name : MonthlyPartitions.between(start, end)) {
            var ym = MonthlyPartitions.parse(name).orElseThrow();
            if (!existing.containsKey(ym)) continue;
            try {
                out.addAll(jdbc.query("SELECT * FROM " + name + " WHERE agent_id = ? AND ts >= ? AND ts "
                                + (endExclusive ? "<" : "<=") + " ? ORDER BY ts",
                        HISTORY_MAPPER, agentId, utc(start), utc(end)));
            } catch (DataAccessException e) {
                throw new StorageException("archive: query failed on " + name, e);
            }
        }
        out.sort(Comparator.comparing(HistoryPoint::timestamp));
        if (limit > 0 && out.size() > limit) {
            return new ArrayList<>(out.subList(out.size() - limit, out.size()));
        }
        return out;
    }

    /** Agents with at least one raw row in [start, endExclusive). */
    public Set<String> agentsWithData(Instant start, Instant endExclusive) {
        var existing = listPartitions();
        Set<String> ids = new TreeSet<>();
        for (var name : MonthlyPartitions.between(start, endExclusive)) {
            if (!existing.containsKey(MonthlyPartitions.parse(name).orElseThrow())) continue;
            ids.addAll(jdbc.queryForList("SELECT DISTINCT agent_id FROM " + name + " WHERE ts >= ? AND ts < ?",
                    String.class, utc(start), utc(endExclusive)));
        }
        return ids;
    }

    /**
     * Bucketed averages for charts. {@code interval} is one of 1m, 5m, 15m, 1h, 1d; anything else
     * picks a width from the range.
     */
    public List<HistoryPoint> queryAggregated(String agentId, Instant start, Instant end, String interval) {
        if (start.isAfter(end)) throw new ValidationException("from must not be after to");
        var raw = queryHistory(agentId, start, end, 0);
        return aggregate(agentId, raw, bucketWidth(interval, Duration.between(start, end)));
    }

    /** Averages {@code raw} into buckets of {@code width} aligned on the epoch. Empty buckets are omitted. */
    public static List<HistoryPoint> aggregate(String agentId, List<HistoryPoint> raw, Duration width) {
        if (raw.isEmpty()) return List.of();
        Map<Long, Bucket> buckets = new TreeMap<>();
        long w = width.toMillis();
        for (var p : raw) {
            long key = Math.floorDiv(p.timestamp().toEpochMilli(), w) * w;
            buckets.computeIfAbsent(key, k -> new Bucket()).add(p);
        }
        List<HistoryPoint> out = new ArrayList<>(buckets.size());
        buckets.forEach((k, b) -> out.add(b.toPoint(agentId, Instant.ofEpochMilli(k))));
        return out;
    }

    public static Duration bucketWidth(String interval, Duration range) {
        if (interval != null) {
            switch (interval) {
                case "1m": return Duration.ofMinutes(1);
                case "5m": return Duration.ofMinutes(5);
                case "15m": return Duration.ofMinutes(15);
                case "1h": return Duration.ofHours(1);
                case "1d": return Duration.ofDays(1);
                default: break;
            }
        }
        if (range.compareTo(Duration.ofHours(1)) <= 0) return Duration.ofMinutes(1);
        if (range.compareTo(Duration.ofHours(6)) <= 0) return Duration.ofMinutes(5);
        if (range.compareTo(Duration.ofHours(24)) <= 0) return Duration.ofMinutes(15);
        if (range.compareTo(Duration.ofDays(7)) <= 0) return Duration.ofHours(1);
        return Duration.ofDays(1);
    }

    private static final class Bucket {
        double cpu, mem, gpu, load;
        long diskR, diskW, rx, tx;
        int n;

        void add(HistoryPoint p) {
            cpu += p.cpuPercent(); mem += p.memPercent(); gpu += p.gpuPercent(); load += p.loadAvg1();
            diskR += p.diskReadPs(); diskW += p.diskWritePs(); rx += p.netRxPs(); tx += p.netTxPs();
            n++;
        }

        HistoryPoint toPoint(String agentId, Instant at) {
            return new HistoryPoint(agentId, at, cpu / n, mem / n, diskR / n, diskW / n, rx / n, tx / n, gpu / n, load / n);
        }
    }

    /* --------------------- rollups --------------------- */

    public boolean rollupExists(Granularity g, String agentId, Instant bucketStart) {
        Integer n = jdbc.queryForObject("SELECT COUNT(*) FROM " + g.table() + " WHERE agent_id = ? AND bucket_start = ?",
                Integer.class, agentId, utc(bucketStart));
        return n != null && n > 0;
    }

    public void insertRollup(Granularity g, RollupRow r) {
        jdbc.update("INSERT INTO " + g.table() + " (agent_id, bucket_start, cpu_avg, cpu_max, mem_avg, mem_max,"
                        + " net_rx_total, net_tx_total, data_points) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                r.agentId(), utc(r.bucketStart()), r.cpuAvg(), r.cpuMax(), r.memAvg(), r.memMax(),
                r.netRxTotal(), r.netTxTotal(), r.dataPoints());
    }

    public List<RollupRow> rollups(Granularity g, String agentId, Instant start, Instant end) {
        return jdbc.query("SELECT * FROM " + g.table() + " WHERE agent_id = ? AND bucket_start >= ? AND bucket_start <= ?"
                        + " ORDER BY bucket_start",
                (rs, i) -> new RollupRow(rs.getString("agent_id"),
                        rs.getObject("bucket_start", OffsetDateTime.class).toInstant(),
                        rs.getDouble("cpu_avg"), rs.getDouble("cpu_max"),
                        rs.getDouble("mem_avg"), rs.getDouble("mem_max"),
                        rs.getLong("net_rx_total"), rs.getLong("net_tx_total"),
                        rs.getInt("data_points")),
                agentId, utc(start), utc(end));
    }

    /* --------------------- retention --------------------- */

    /** Drops every partition whose month is strictly before start-of-month(now - retentionDays). */
    public List<String> dropExpiredPartitions() {
        var cutoff = MonthlyPartitions.retentionCutoff(clock.instant(), props.retentionDays());
        List<String> dropped = new ArrayList<>();
        for (var e : listPartitions().entrySet()) {
            if (!MonthlyPartitions.expired(e.getKey(), cutoff)) continue;
            jdbc.execute("DROP TABLE IF EXISTS " + e.getValue());
            knownPartitions.remove(e.getValue());
            dropped.add(e.getValue());
        }
        if (!dropped.isEmpty()) log.info("[archive] dropped partitions before {}: {}", cutoff, dropped);
        return dropped;
    }

    /** Age-based pruning of rollups, each granularity with its own retention. Returns rows removed. */
    public int pruneRollups() {
        var now = clock.instant();
        int hourly = jdbc.update("DELETE FROM " + Granularity.HOURLY.table() + " WHERE bucket_start < ?",
                utc(now.minus(Duration.ofDays(props.hourlyRetentionDays()))));
        int daily = jdbc.update("DELETE FROM " + Granularity.DAILY.table() + " WHERE bucket_start < ?",
                utc(now.minus(Duration.ofDays(props.dailyRetentionDays()))));
        if (hourly + daily > 0) log.info("[archive] pruned rollups hourly={} daily={}", hourly, daily);
        return hourly + daily;
    }

    public Clock clock() { return clock; }

    private static final RowMapper<HistoryPoint> HISTORY_MAPPER = (rs, i) -> new HistoryPoint(
            rs.getString("agent_id"),
            readTs(rs),
            rs.getDouble("cpu_percent"),
            rs.getDouble("mem_percent"),
            rs.getLong("disk_read_ps"),
            rs.getLong("disk_write_ps"),
            rs.getLong("net_rx_ps"),
            rs.getLong("net_tx_ps"),
            rs.getDouble("gpu_percent"),
            rs.getDouble("load_avg1"));

    private static Instant readTs(ResultSet rs) throws SQLException {
        return rs.getObject("ts", OffsetDateTime.class).toInstant();
    }

    private static OffsetDateTime utc(Instant t) {
        return OffsetDateTime.ofInstant(t, ZoneOffset.UTC);
    }
}
