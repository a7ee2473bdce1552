package org.caureq.fleethub.storage.archive;

import org.caureq.fleethub.config.AppProps;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

final class ArchiveFixture {
    static final Instant NOW = Instant.parse("2026-03-10T00:00:00Z");

    private ArchiveFixture() {}

    static MetricsArchive archive() {
        var ds = new DriverManagerDataSource("jdbc:h2:mem:archive-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", "");
        var props = new AppProps(null, null, null, null, new AppProps.ArchiveProps(true, 30, 90, 365), null);
        var archive = new MetricsArchive(new JdbcTemplate(ds), props, Clock.fixed(NOW, ZoneOffset.UTC));
        archive.init();
        return archive;
    }
}
