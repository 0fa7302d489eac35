package com.nosota.splitpay.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nosota.splitpay.api.model.PaymentStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Payment record of one member in one group.
 *
 * @param username   Member the payment belongs to
 * @param paidAmount Amount the member reported as paid
 * @param status     Approval state
 * @param updatedAt  Time of the last change
 */
public record PaymentDTO(
        String username,
        @JsonProperty("paid_amount") BigDecimal paidAmount,
        PaymentStatus status,
        @JsonProperty("updated_at") LocalDateTime updatedAt
) {}
