package com.nosota.splitpay.error;

public class InsufficientRoleException extends ForbiddenException {
    public InsufficientRoleException(String message) {
        super(message);
    }
}
