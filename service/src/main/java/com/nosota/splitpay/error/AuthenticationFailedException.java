package com.nosota.splitpay.error;

/**
 * Bad username or password. The message never tells which of the two was wrong.
 */
public class AuthenticationFailedException extends UnauthorizedException {
    public AuthenticationFailedException(String message) {
        super(message);
    }
}
