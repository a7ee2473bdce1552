package org.caureq.fleethub.storage;

import org.caureq.fleethub.model.MetricSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Uniform contract over the time-series backends.
 * <p>
 * Bounds are inclusive and {@code null} means open-ended. {@code limit <= 0} means "no limit"
 * (durable backends still cap it). Results are chronological and, when limited, hold the most
 * recent points. Failures surface as {@link org.caureq.fleethub.error.StorageException}.
 */
public interface TimeSeriesStore extends AutoCloseable {

    int MAX_QUERY_LIMIT = 10_000;

    void write(MetricSnapshot snapshot);

    List<MetricSnapshot> query(String agentId, Instant start, Instant end, int limit);

    /** Same as {@link #query} for every agent with data in range. Agents with no point are omitted. */
    Map<String, List<MetricSnapshot>> queryAll(Instant start, Instant end, int limit);

    /** Removes points strictly older than {@code before}. */
    void delete(Instant before);

    String name();

    @Override
    void close();

    static int effectiveLimit(int limit) {
        return limit <= 0 || limit > MAX_QUERY_LIMIT ? MAX_QUERY_LIMIT : limit;
    }
}
