package com.nosota.splitpay.error;

public class NotGroupMemberException extends ForbiddenException {
    public NotGroupMemberException(String message) {
        super(message);
    }
}
