package dev.pekelund.zuvp.fees;

/**
 * Signals that a fee cannot be represented in whole CZK.
 */
public class FeeCalculationException extends RuntimeException {

    public FeeCalculationException(String message, Throwable cause) {
        super(message, cause);
    }
}
