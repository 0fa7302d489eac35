package com.nosota.splitpay.error;

/**
 * The request is well-formed but violates a business rule.
 */
public class ValidationException extends RuntimeException {
    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
