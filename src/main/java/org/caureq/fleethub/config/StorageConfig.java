package org.caureq.fleethub.config;

import org.caureq.fleethub.storage.TimeSeriesStore;
import org.caureq.fleethub.storage.TimeSeriesStoreFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class StorageConfig {

    @Bean(destroyMethod = "close")
    public TimeSeriesStore timeSeriesStore(TimeSeriesProps props) {
        return new TimeSeriesStoreFactory(props).create();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
