package com.nosota.splitpay.error;

/**
 * The request carries no usable credentials: missing, malformed, expired or wrong-type token, or bad username/password.
 */
public class UnauthorizedException extends RuntimeException {
    public UnauthorizedException(String message) {
        super(message);
    }

    public UnauthorizedException(String message, Throwable cause) {
        super(message, cause);
    }
}
