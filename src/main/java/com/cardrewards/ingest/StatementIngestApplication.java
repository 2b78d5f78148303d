package com.cardrewards.ingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for the statement ingest service.
 *
 * Long-running inbox watcher featuring:
 * - Normalization of vendor CSV exports through a text-generation model (WebClient)
 * - Resilience4j circuit breaker and retry around the model call
 * - Natural-key deduplication against the transaction store
 * - Reward points from the (category, card) multiplier table
 * - Processed/failed archiving with completion markers and an append-only event log
 */
@SpringBootApplication
@EnableJpaRepositories
@EnableTransactionManagement
@EnableScheduling
public class StatementIngestApplication {

    public static void main(String[] args) {
        SpringApplication.run(StatementIngestApplication.class, args);
    }
}
