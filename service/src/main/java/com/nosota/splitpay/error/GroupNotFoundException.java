package com.nosota.splitpay.error;

public class GroupNotFoundException extends NotFoundException {
    public GroupNotFoundException(String message) {
        super(message);
    }
}
