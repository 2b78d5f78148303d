package com.cardrewards.ingest.domain;

/**
 * Counts of rows persisted and rows dropped as re-imports for one statement.
 */
public record ImportSummary(int added, int skipped) {

    public static ImportSummary empty() {
        return new ImportSummary(0, 0);
    }
}
