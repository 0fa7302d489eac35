package com.nosota.splitpay.error;

public class InvalidBudgetException extends ValidationException {
    public InvalidBudgetException(String message) {
        super(message);
    }
}
