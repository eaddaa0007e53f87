package dev.pekelund.zuvp.processor;

/**
 * Raised when the pipeline itself fails outside the data path, for example when it is interrupted while
 * waiting for an extraction or when the configured rate yields a fee that cannot be represented.
 */
public class PermitProcessingException extends RuntimeException {

    public PermitProcessingException(String message) {
        super(message);
    }

    public PermitProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
