package com.nosota.splitpay.error;

public class GroupAlreadyExistsException extends ConflictException {
    public GroupAlreadyExistsException(String message) {
        super(message);
    }
}
