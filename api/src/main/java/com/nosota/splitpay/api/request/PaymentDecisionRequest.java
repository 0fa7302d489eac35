package com.nosota.splitpay.api.request;

import jakarta.validation.constraints.NotBlank;

/**
 * Request from a group admin to approve or deny a member's payment.
 *
 * @param username Member whose payment is decided
 * @param action   "approve" or "deny"
 */
public record PaymentDecisionRequest(
        @NotBlank(message = "Username is required")
        String username,

        @NotBlank(message = "Action is required")
        String action
) {
}
