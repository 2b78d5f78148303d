package com.cardrewards.ingest.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(IngestProperties.class)
public class IngestConfig {

    /**
     * System clock used for output file names and event log timestamps.
     */
    @Bean
    public Clock ingestClock() {
        return Clock.systemDefaultZone();
    }
}
