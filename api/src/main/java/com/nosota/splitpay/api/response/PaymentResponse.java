package com.nosota.splitpay.api.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nosota.splitpay.api.dto.PaymentDTO;

/**
 * Payment snapshot returned by submit and decide operations.
 */
public record PaymentResponse(
        String msg,
        @JsonProperty("group_name") String groupName,
        PaymentDTO payment
) {}
