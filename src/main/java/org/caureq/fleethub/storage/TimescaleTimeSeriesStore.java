package org.caureq.fleethub.storage;

import lombok.extern.slf4j.Slf4j;
import org.caureq.fleethub.error.StorageException;
import org.caureq.fleethub.model.CpuStats;
import org.caureq.fleethub.model.DiskStats;
import org.caureq.fleethub.model.MemoryStats;
import org.caureq.fleethub.model.MetricSnapshot;
import org.caureq.fleethub.model.NetworkStats;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.io.Closeable;
import java.io.IOException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Relational backend: one row per (ts, agent) in {@code metrics}, plus per-mount and
 * per-interface detail rows. Every insert is an upsert, so re-delivering a snapshot leaves
 * exactly one row carrying the latest values. A snapshot's rows are written in one transaction.
 */
@Slf4j
public class TimescaleTimeSeriesStore implements TimeSeriesStore {

    private static final List<String> METRIC_COLS = List.of("ts", "agent_id", "cpu_percent", "mem_total", "mem_used");
    private static final List<String> DISK_COLS = List.of("ts", "agent_id", "mount_point", "total", "used", "read_bps", "write_bps");
    private static final List<String> NET_COLS = List.of("ts", "agent_id", "interface", "rx_bps", "tx_bps", "is_up");

    private final DataSource dataSource;
    private final JdbcTemplate jdbc;
    private final TransactionTemplate tx;
    private final SqlDialect dialect;

    private final String upsertMetric;
    private final String upsertDisk;
    private final String upsertNet;

    public TimescaleTimeSeriesStore(DataSource dataSource, SqlDialect dialect, Duration timeout) {
        this.dataSource = dataSource;
        this.dialect = dialect;
        this.jdbc = new JdbcTemplate(dataSource);
        this.jdbc.setQueryTimeout((int) Math.max(1, timeout.toSeconds()));
        this.tx = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.upsertMetric = dialect.upsert("metrics", METRIC_COLS, List.of("ts", "agent_id"));
        this.upsertDisk = dialect.upsert("disk_metrics", DISK_COLS, List.of("ts", "agent_id", "mount_point"));
        this.upsertNet = dialect.upsert("network_metrics", NET_COLS, List.of("ts", "agent_id", "interface"));
    }

    public void initSchema() {
        try {
            jdbc.execute("""
                    CREATE TABLE IF NOT EXISTS metrics (
                        ts          TIMESTAMP WITH TIME ZONE NOT NULL,
                        agent_id    VARCHAR(128) NOT NULL,
                        cpu_percent DOUBLE PRECISION,
                        mem_total   BIGINT,
                        mem_used    BIGINT,
                        PRIMARY KEY (ts, agent_id)
                    )""");
            jdbc.execute("""
                    CREATE TABLE IF NOT EXISTS disk_metrics (
                        ts          TIMESTAMP WITH TIME ZONE NOT NULL,
                        agent_id    VARCHAR(128) NOT NULL,
                        mount_point VARCHAR(255) NOT NULL,
                        total       BIGINT,
                        used        BIGINT,
                        read_bps    BIGINT,
                        write_bps   BIGINT,
                        PRIMARY KEY (ts, agent_id, mount_point)
                    )""");
            jdbc.execute("""
                    CREATE TABLE IF NOT EXISTS network_metrics (
                        ts          TIMESTAMP WITH TIME ZONE NOT NULL,
                        agent_id    VARCHAR(128) NOT NULL,
                        interface   VARCHAR(128) NOT NULL,
                        rx_bps      BIGINT,
                        tx_bps      BIGINT,
                        is_up       BOOLEAN,
                        PRIMARY KEY (ts, agent_id, interface)
                    )""");
        } catch (DataAccessException e) {
            throw new StorageException("timescaledb: schema init failed", e);
        }
        if (dialect == SqlDialect.POSTGRES) {
            for (var t : List.of("metrics", "disk_metrics", "network_metrics")) {
                try {
                    jdbc.execute("SELECT create_hypertable('" + t + "', 'ts', if_not_exists => TRUE)");
                } catch (DataAccessException e) {
                    // plain PostgreSQL without the extension still works, just without chunking
                    log.info("[timescaledb] hypertable for {} not created: {}", t, e.getMostSpecificCause().getMessage());
                }
            }
        }
    }

    @Override
    public void write(MetricSnapshot s) {
        var ts = utc(s.timestamp());
        try {
            tx.executeWithoutResult(status -> {
                jdbc.update(upsertMetric, ts, s.agentId(), s.cpu().usagePercent(), s.memory().total(), s.memory().used());
                for (var d : s.disks()) {
                    if (d.mountPoint() == null) continue;
                    jdbc.update(upsertDisk, ts, s.agentId(), d.mountPoint(), d.total(), d.used(),
                            d.readBytesPerSec(), d.writeBytesPerSec());
                }
                for (var n : s.networks()) {
                    if (n.iface() == null) continue;
                    jdbc.update(upsertNet, ts, s.agentId(), n.iface(), n.rxBytesPerSec(), n.txBytesPerSec(), n.up());
                }
            });
        } catch (DataAccessException | TransactionException e) {
            throw new StorageException("timescaledb: write failed for " + s.agentId(), e);
        }
    }

    @Override
    public List<MetricSnapshot> query(String agentId, Instant start, Instant end, int limit) {
        var sql = new StringBuilder("SELECT ts, cpu_percent, mem_total, mem_used FROM metrics WHERE agent_id = ?");
        List<Object> args = new ArrayList<>();
        args.add(agentId);
        appendRange(sql, args, start, end);
        sql.append(" ORDER BY ts DESC LIMIT ?");
        args.add(TimeSeriesStore.effectiveLimit(limit));

        List<MetricSnapshot> rows;
        try {
            rows = new ArrayList<>(jdbc.query(sql.toString(), (rs, i) -> MetricSnapshot.builder()
                    .agentId(agentId)
                    .timestamp(readTs(rs))
                    .cpu(CpuStats.builder().usagePercent(rs.getDouble("cpu_percent")).build())
                    .memory(MemoryStats.builder().total(rs.getLong("mem_total")).used(rs.getLong("mem_used")).build())
                    .build(), args.toArray()));
        } catch (DataAccessException e) {
            throw new StorageException("timescaledb: query failed for " + agentId, e);
        }
        Collections.reverse(rows);
        if (rows.isEmpty()) return rows;
        return attachDetails(agentId, rows);
    }

    private List<MetricSnapshot> attachDetails(String agentId, List<MetricSnapshot> rows) {
        var from = utc(rows.get(0).timestamp());
        var to = utc(rows.get(rows.size() - 1).timestamp());
        Map<Instant, List<DiskStats>> disks = new HashMap<>();
        Map<Instant, List<NetworkStats>> nets = new HashMap<>();
        try {
            jdbc.query("SELECT ts, mount_point, total, used, read_bps, write_bps FROM disk_metrics"
                            + " WHERE agent_id = ? AND ts >= ? AND ts <= ? ORDER BY mount_point",
                    rs -> {
                        disks.computeIfAbsent(readTs(rs), k -> new ArrayList<>()).add(DiskStats.builder()
                                .mountPoint(rs.getString("mount_point"))
                                .total(rs.getLong("total"))
                                .used(rs.getLong("used"))
                                .readBytesPerSec(rs.getLong("read_bps"))
                                .writeBytesPerSec(rs.getLong("write_bps"))
                                .build());
                    }, agentId, from, to);
            jdbc.query("SELECT ts, interface, rx_bps, tx_bps, is_up FROM network_metrics"
                            + " WHERE agent_id = ? AND ts >= ? AND ts <= ? ORDER BY interface",
                    rs -> {
                        nets.computeIfAbsent(readTs(rs), k -> new ArrayList<>()).add(NetworkStats.builder()
                                .iface(rs.getString("interface"))
                                .rxBytesPerSec(rs.getLong("rx_bps"))
                                .txBytesPerSec(rs.getLong("tx_bps"))
                                .up(rs.getBoolean("is_up"))
                                .build());
                    }, agentId, from, to);
        } catch (DataAccessException e) {
            throw new StorageException("timescaledb: detail query failed for " + agentId, e);
        }
        List<MetricSnapshot> out = new ArrayList<>(rows.size());
        for (var r : rows) {
            out.add(r.toBuilder()
                    .disks(disks.getOrDefault(r.timestamp(), List.of()))
                    .networks(nets.getOrDefault(r.timestamp(), List.of()))
                    .build());
        }
        return out;
    }

    @Override
    public Map<String, List<MetricSnapshot>> queryAll(Instant start, Instant end, int limit) {
        var sql = new StringBuilder("SELECT DISTINCT agent_id FROM metrics WHERE 1 = 1");
        List<Object> args = new ArrayList<>();
        appendRange(sql, args, start, end);
        sql.append(" ORDER BY agent_id");
        List<String> ids;
        try {
            ids = jdbc.queryForList(sql.toString(), String.class, args.toArray());
        } catch (DataAccessException e) {
            throw new StorageException("timescaledb: agent listing failed", e);
        }
        Map<String, List<MetricSnapshot>> out = new LinkedHashMap<>();
        for (var id : ids) {
            var pts = query(id, start, end, limit);
            if (!pts.isEmpty()) out.put(id, pts);
        }
        return out;
    }

    @Override
    public void delete(Instant before) {
        var cutoff = utc(before);
        try {
            jdbc.update("DELETE FROM metrics WHERE ts < ?", cutoff);
            jdbc.update("DELETE FROM disk_metrics WHERE ts < ?", cutoff);
            jdbc.update("DELETE FROM network_metrics WHERE ts < ?", cutoff);
        } catch (DataAccessException e) {
            throw new StorageException("timescaledb: delete failed", e);
        }
    }

    public int count(String table, String agentId) {
        Integer n = jdbc.queryForObject("SELECT COUNT(*) FROM " + table + " WHERE agent_id = ?", Integer.class, agentId);
        return n == null ? 0 : n;
    }

    @Override
    public String name() { return "timescaledb"; }

    @Override
    public void close() {
        if (dataSource instanceof Closeable c) {
            try {
                c.close();
            } catch (IOException e) {
                log.warn("[timescaledb] pool close failed: {}", e.getMessage());
            }
        }
    }

    private static void appendRange(StringBuilder sql, List<Object> args, Instant start, Instant end) {
        if (start != null) {
            sql.append(" AND ts >= ?");
            args.add(utc(start));
        }
        if (end != null) {
            sql.append(" AND ts <= ?");
            args.add(utc(end));
        }
    }

    static OffsetDateTime utc(Instant t) {
        return OffsetDateTime.ofInstant(t, ZoneOffset.UTC);
    }

    private static Instant readTs(ResultSet rs) throws SQLException {
        return rs.getObject("ts", OffsetDateTime.class).toInstant();
    }
}
