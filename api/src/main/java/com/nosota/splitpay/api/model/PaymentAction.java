package com.nosota.splitpay.api.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Decision a group admin can take on a member's payment.
 */
public enum PaymentAction {
    APPROVE,
    DENY;

    /**
     * Resolves an action from its wire value, ignoring case.
     *
     * @param value raw action, e.g. "approve"
     * @return the action, or empty if the value is not a known action
     */
    public static Optional<PaymentAction> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(action -> action.name().equals(normalized))
                .findFirst();
    }
}
