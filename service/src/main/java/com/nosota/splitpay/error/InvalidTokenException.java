package com.nosota.splitpay.error;

/**
 * Token is missing, malformed, badly signed or lacks a required claim.
 */
public class InvalidTokenException extends UnauthorizedException {
    public InvalidTokenException(String message) {
        super(message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
