package dev.pekelund.zuvp.extraction;

public class ExtractionCacheException extends RuntimeException {

    public ExtractionCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
