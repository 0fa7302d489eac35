package com.nosota.splitpay.error;

/**
 * Approval was requested for a payment whose amount differs from the current split.
 */
public class ShortPaymentException extends ValidationException {
    public ShortPaymentException(String message) {
        super(message);
    }
}
