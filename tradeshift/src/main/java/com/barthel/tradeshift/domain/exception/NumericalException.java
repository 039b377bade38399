package com.barthel.tradeshift.domain.exception;

/**
 * Raised when a linear-algebra routine cannot produce a result for its input.
 */
public class NumericalException extends RuntimeException {

    public NumericalException(String message) {
        super(message);
    }

    public NumericalException(String message, Throwable cause) {
        super(message, cause);
    }
}
