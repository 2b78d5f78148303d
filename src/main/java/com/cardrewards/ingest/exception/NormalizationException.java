package com.cardrewards.ingest.exception;

/**
 * Exception thrown when the normalization model call fails.
 * Wraps HTTP errors, timeouts and empty responses from the model endpoint.
 */
public class NormalizationException extends RuntimeException {

    private final int statusCode;

    public NormalizationException(String message) {
        super(message);
        this.statusCode = 0;
    }

    public NormalizationException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public NormalizationException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public NormalizationException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status returned by the model endpoint, or 0 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    @Override
    public String toString() {
        return "NormalizationException{" +
               "message='" + getMessage() + '\'' +
               ", statusCode=" + statusCode +
               '}';
    }
}
