package com.cardrewards.ingest.domain;

import java.time.LocalDateTime;

/**
 * One line of the append-only ingestion event log.
 */
public record IngestionEvent(
    LocalDateTime timestamp,
    String filename,
    Status status,
    String message
) {

    public enum Status {
        PROCESSED("processed"),
        FAILED("failed");

        private final String label;

        Status(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }
}
