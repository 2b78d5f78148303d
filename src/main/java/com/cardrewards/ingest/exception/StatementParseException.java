package com.cardrewards.ingest.exception;

/**
 * Thrown when a canonical row cannot be converted into a transaction.
 * Carries the 1-based record number (header excluded) of the offending row.
 */
public class StatementParseException extends RuntimeException {

    private final long recordNumber;

    public StatementParseException(long recordNumber, String message, Throwable cause) {
        super("Row parsing failed at record " + recordNumber + ": " + message, cause);
        this.recordNumber = recordNumber;
    }

    public StatementParseException(long recordNumber, String message) {
        this(recordNumber, message, null);
    }

    public long getRecordNumber() {
        return recordNumber;
    }
}
