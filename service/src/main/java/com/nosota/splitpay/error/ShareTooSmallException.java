package com.nosota.splitpay.error;

public class ShareTooSmallException extends ValidationException {
    public ShareTooSmallException(String message) {
        super(message);
    }
}
