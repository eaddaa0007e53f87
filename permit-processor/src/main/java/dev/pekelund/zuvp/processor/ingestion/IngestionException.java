package dev.pekelund.zuvp.processor.ingestion;

/**
 * Raised when a submitted document cannot be accepted: unsupported type, empty or unreadable content.
 */
public class IngestionException extends RuntimeException {

    public IngestionException(String message) {
        super(message);
    }

    public IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
