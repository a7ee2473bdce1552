package org.caureq.fleethub.storage;

import org.caureq.fleethub.error.StorageException;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/** The few SQL differences between PostgreSQL/TimescaleDB and the embedded H2 database. */
public enum SqlDialect {
    POSTGRES {
        @Override
        public String upsert(String table, List<String> columns, List<String> keys) {
            var updates = columns.stream().filter(c -> !keys.contains(c))
                    .map(c -> c + " = EXCLUDED." + c)
                    .collect(Collectors.joining(", "));
            return "INSERT INTO " + table + " (" + String.join(", ", columns) + ") VALUES (" + placeholders(columns)
                    + ") ON CONFLICT (" + String.join(", ", keys) + ") DO UPDATE SET " + updates;
        }
    },
    H2 {
        @Override
        public String upsert(String table, List<String> columns, List<String> keys) {
            return "MERGE INTO " + table + " (" + String.join(", ", columns) + ") KEY (" + String.join(", ", keys)
                    + ") VALUES (" + placeholders(columns) + ")";
        }
    };

    public abstract String upsert(String table, List<String> columns, List<String> keys);

    private static String placeholders(List<String> columns) {
        return columns.stream().map(c -> "?").collect(Collectors.joining(", "));
    }

    public static SqlDialect of(DataSource ds) {
        try (Connection c = ds.getConnection()) {
            var product = c.getMetaData().getDatabaseProductName().toLowerCase(Locale.ROOT);
            return product.contains("h2") ? H2 : POSTGRES;
        } catch (SQLException e) {
            throw new StorageException("cannot detect database dialect", e);
        }
    }
}
