package com.nosota.splitpay.error;

public class PaymentNotFoundException extends NotFoundException {
    public PaymentNotFoundException(String message) {
        super(message);
    }
}
