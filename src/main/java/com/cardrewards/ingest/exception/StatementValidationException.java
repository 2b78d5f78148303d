package com.cardrewards.ingest.exception;

/**
 * Thrown when normalizer output does not expose the canonical header fields.
 */
public class StatementValidationException extends RuntimeException {

    public StatementValidationException(String message) {
        super(message);
    }
}
