package com.nosota.splitpay.error;

public class NotGroupAdminException extends ForbiddenException {
    public NotGroupAdminException(String message) {
        super(message);
    }
}
