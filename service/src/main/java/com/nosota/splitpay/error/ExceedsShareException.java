package com.nosota.splitpay.error;

/**
 * The submitted amount is larger than the member's share. Overpayments are rejected outright.
 */
public class ExceedsShareException extends ValidationException {
    public ExceedsShareException(String message) {
        super(message);
    }
}
