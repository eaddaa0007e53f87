package dev.pekelund.zuvp.render;

/**
 * Signals that the draft documents could not be rendered.
 */
public class RenderException extends RuntimeException {

    public RenderException(String message) {
        super(message);
    }

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
