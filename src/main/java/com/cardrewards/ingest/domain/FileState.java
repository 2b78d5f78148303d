package com.cardrewards.ingest.domain;

/**
 * Lifecycle states of one inbox file.
 */
public enum FileState {
    DISCOVERED,
    NORMALIZING,
    NORMALIZED,
    VALIDATING,
    IMPORTING,
    ARCHIVED_PROCESSED,
    ARCHIVED_FAILED,
    /** Completion marker already present; nothing was done. */
    ALREADY_HANDLED;

    public boolean isTerminal() {
        return this == ARCHIVED_PROCESSED || this == ARCHIVED_FAILED || this == ALREADY_HANDLED;
    }
}
