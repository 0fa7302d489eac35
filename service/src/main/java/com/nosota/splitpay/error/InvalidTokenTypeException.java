package com.nosota.splitpay.error;

/**
 * A refresh token was presented where an access token is required, or the other way round.
 */
public class InvalidTokenTypeException extends UnauthorizedException {
    public InvalidTokenTypeException(String message) {
        super(message);
    }
}
