package com.nosota.splitpay.error;

public class ExpiredTokenException extends UnauthorizedException {
    public ExpiredTokenException(String message) {
        super(message);
    }
}
