package org.caureq.fleethub.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "timeseries")
public record TimeSeriesProps(String type, Duration timeout, MemoryProps memory,
                              InfluxProps influxdb, TimescaleProps timescaledb) {

    public TimeSeriesProps {
        type = type == null || type.isBlank() ? "memory" : type;
        timeout = timeout == null ? Duration.ofSeconds(10) : timeout;
        memory = memory == null ? new MemoryProps(0) : memory;
    }

    public record MemoryProps(int capacity) {
        public MemoryProps {
            capacity = capacity <= 0 ? 600 : capacity;
        }
    }

    public record InfluxProps(String url, String token, String org, String bucket) {}

    public record TimescaleProps(String url, String username, String password, int maxPoolSize) {}
}
