package org.caureq.fleethub.storage;

import org.caureq.fleethub.error.ValidationException;

import java.util.Locale;

public enum StorageType {
    MEMORY, INFLUXDB, TIMESCALEDB;

    public static StorageType from(String raw) {
        if (raw == null || raw.isBlank()) return MEMORY;
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "memory" -> MEMORY;
            case "influxdb", "influx" -> INFLUXDB;
            case "timescaledb", "timescale" -> TIMESCALEDB;
            default -> throw new ValidationException(
                    "unsupported time-series storage type: " + raw + " (supported: memory, influxdb, timescaledb)");
        };
    }
}
