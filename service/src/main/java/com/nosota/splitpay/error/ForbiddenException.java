package com.nosota.splitpay.error;

/**
 * The caller is authenticated but not allowed to perform the operation.
 */
public class ForbiddenException extends RuntimeException {
    public ForbiddenException(String message) {
        super(message);
    }

    public ForbiddenException(String message, Throwable cause) {
        super(message, cause);
    }
}
