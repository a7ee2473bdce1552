package org.caureq.fleethub;

import org.caureq.fleethub.config.AppProps;
import org.caureq.fleethub.config.TimeSeriesProps;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({AppProps.class, TimeSeriesProps.class})
public class FleetHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(FleetHubApplication.class, args);
    }

}
