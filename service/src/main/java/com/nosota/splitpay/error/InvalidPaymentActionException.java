package com.nosota.splitpay.error;

public class InvalidPaymentActionException extends ValidationException {
    public InvalidPaymentActionException(String message) {
        super(message);
    }
}
