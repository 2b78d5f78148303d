package com.cardrewards.ingest.domain;

/**
 * Result of driving one inbox file to a terminal state.
 */
public record FileOutcome(
    String filename,
    FileState state,
    int added,
    int skipped,
    String message
) {

    public static FileOutcome processed(String filename, ImportSummary summary) {
        return new FileOutcome(filename, FileState.ARCHIVED_PROCESSED, summary.added(), summary.skipped(), "");
    }

    public static FileOutcome failed(String filename, String message) {
        return new FileOutcome(filename, FileState.ARCHIVED_FAILED, 0, 0, message);
    }

    public static FileOutcome alreadyHandled(String filename) {
        return new FileOutcome(filename, FileState.ALREADY_HANDLED, 0, 0, "");
    }
}
