package com.chat.relay.service.ingest;

/**
 * Exception thrown when an event cannot be taken in for an unexpected reason.
 *
 * A full queue or a filtered channel are regular outcomes reported through
 * {@link IngestStatus}, not exceptions.
 */
public class IngestionException extends RuntimeException {

    private final String errorCode;

    public IngestionException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
