package org.caureq.fleethub.storage;

import com.influxdb.client.InfluxDBClient;
import com.influxdb.client.domain.WritePrecision;
import com.influxdb.client.write.Point;
import com.influxdb.exceptions.InfluxException;
import com.influxdb.query.FluxRecord;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fleethub.config.TimeSeriesProps.InfluxProps;
import org.caureq.fleethub.error.PartialWriteException;
import org.caureq.fleethub.error.StorageException;
import org.caureq.fleethub.model.CpuStats;
import org.caureq.fleethub.model.MemoryStats;
import org.caureq.fleethub.model.MetricSnapshot;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * InfluxDB 2.x through the official client. Each measurement family is its own blocking write,
 * so one failing family neither blocks nor rolls back the others. Expiry is the bucket's
 * retention policy.
 */
@Slf4j
public class InfluxTimeSeriesStore implements TimeSeriesStore {
    private final InfluxDBClient client;
    private final InfluxProps props;

    public InfluxTimeSeriesStore(InfluxDBClient client, InfluxProps props) {
        this.client = client;
        this.props = props;
    }

    @Override
    public void write(MetricSnapshot snapshot) {
        var writeApi = client.getWriteApiBlocking();
        List<String> written = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        InfluxException firstError = null;

        for (var family : points(snapshot).entrySet()) {
            try {
                writeApi.writePoints(props.bucket(), props.org(), family.getValue());
                written.add(family.getKey());
            } catch (InfluxException e) {
                log.debug("[influxdb] {} write failed for {}: {}", family.getKey(), snapshot.agentId(), e.getMessage());
                failed.add(family.getKey());
                if (firstError == null) firstError = e;
            }
        }
        if (failed.isEmpty()) return;
        if (written.isEmpty()) {
            throw new StorageException("influxdb: write failed for " + snapshot.agentId(), firstError);
        }
        throw new PartialWriteException(snapshot.agentId(), written, failed, firstError);
    }

    /** Family name to points, millisecond precision. Families with nothing to write are left out. */
    static Map<String, List<Point>> points(MetricSnapshot s) {
        Map<String, List<Point>> out = new LinkedHashMap<>();
        out.put("cpu", List.of(point("cpu", s)
                .addField("usage_percent", s.cpu().usagePercent())));
        out.put("memory", List.of(point("memory", s)
                .addField("total", s.memory().total())
                .addField("used", s.memory().used())
                .addField("available", s.memory().available())));

        List<Point> disks = new ArrayList<>();
        for (var d : s.disks()) {
            if (d.mountPoint() == null) continue;
            disks.add(point("disk", s)
                    .addTag("mount_point", d.mountPoint())
                    .addField("total", d.total())
                    .addField("used", d.used())
                    .addField("read_bytes_per_sec", d.readBytesPerSec())
                    .addField("write_bytes_per_sec", d.writeBytesPerSec()));
        }
        if (!disks.isEmpty()) out.put("disk", disks);

        List<Point> nets = new ArrayList<>();
        for (var n : s.networks()) {
            if (n.iface() == null) continue;
            nets.add(point("network", s)
                    .addTag("interface", n.iface())
                    .addField("rx_bytes_per_sec", n.rxBytesPerSec())
                    .addField("tx_bytes_per_sec", n.txBytesPerSec())
                    .addField("is_up", n.up()));
        }
        if (!nets.isEmpty()) out.put("network", nets);
        return out;
    }

    private static Point point(String measurement, MetricSnapshot s) {
        return Point.measurement(measurement)
                .addTag("agent_id", s.agentId())
                .time(s.timestamp(), WritePrecision.MS);
    }

    @Override
    public List<MetricSnapshot> query(String agentId, Instant start, Instant end, int limit) {
        return runQuery(flux(agentId, start, end, limit)).getOrDefault(agentId, List.of());
    }

    @Override
    public Map<String, List<MetricSnapshot>> queryAll(Instant start, Instant end, int limit) {
        return runQuery(flux(null, start, end, limit));
    }

    @Override
    public void delete(Instant before) {
        // bucket retention policy handles expiry
    }

    @Override
    public String name() { return "influxdb"; }

    @Override
    public void close() {
        client.close();
    }

    String flux(String agentId, Instant start, Instant end, int limit) {
        var startExpr = start == null ? "0" : start.toString();
        // range() stop is exclusive, the contract is not
        var stopExpr = end == null ? "now()" : end.plusMillis(1).toString();
        var sb = new StringBuilder();
        sb.append("from(bucket: ").append(fluxString(props.bucket())).append(")\n")
          .append("  |> range(start: ").append(startExpr).append(", stop: ").append(stopExpr).append(")\n")
          .append("  |> filter(fn: (r) => r._measurement == \"cpu\" or r._measurement == \"memory\")\n");
        if (agentId != null) {
            sb.append("  |> filter(fn: (r) => r.agent_id == ").append(fluxString(agentId)).append(")\n");
        }
        sb.append("  |> group(columns: [\"agent_id\"])\n")
          .append("  |> pivot(rowKey: [\"_time\"], columnKey: [\"_measurement\", \"_field\"], valueColumn: \"_value\")\n")
          .append("  |> sort(columns: [\"_time\"])\n")
          .append("  |> tail(n: ").append(TimeSeriesStore.effectiveLimit(limit)).append(")\n");
        return sb.toString();
    }

    /** Escapes a value embedded in a Flux string literal. */
    static String fluxString(String v) {
        return "\"" + v.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    private Map<String, List<MetricSnapshot>> runQuery(String flux) {
        Map<String, List<MetricSnapshot>> out = new LinkedHashMap<>();
        try {
            for (var table : client.getQueryApi().query(flux, props.org())) {
                for (var record : table.getRecords()) {
                    var snap = toSnapshot(record);
                    if (snap != null) out.computeIfAbsent(snap.agentId(), k -> new ArrayList<>()).add(snap);
                }
            }
        } catch (InfluxException e) {
            throw new StorageException("influxdb: query failed", e);
        }
        return out;
    }

    private static MetricSnapshot toSnapshot(FluxRecord r) {
        var agentId = r.getValueByKey("agent_id");
        var time = r.getTime();
        if (agentId == null || time == null) return null;
        return MetricSnapshot.builder()
                .agentId(agentId.toString())
                .timestamp(time)
                .cpu(CpuStats.builder().usagePercent(number(r, "cpu_usage_percent").doubleValue()).build())
                .memory(MemoryStats.builder()
                        .total(number(r, "memory_total").longValue())
                        .used(number(r, "memory_used").longValue())
                        .available(number(r, "memory_available").longValue())
                        .build())
                .build();
    }

    private static Number number(FluxRecord r, String column) {
        return r.getValueByKey(column) instanceof Number n ? n : 0;
    }
}
