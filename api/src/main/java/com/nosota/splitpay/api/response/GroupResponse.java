package com.nosota.splitpay.api.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nosota.splitpay.api.dto.PaymentDTO;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Full snapshot of an expense group.
 *
 * @param name        Group name
 * @param admin       Username of the creator, the only one allowed to decide payments
 * @param budget      Total amount split across members
 * @param splitAmount Share of each member (budget / member count, 2 decimals)
 * @param members     Member usernames, sorted
 * @param payments    Payment record per member
 * @param createdAt   Creation time
 */
public record GroupResponse(
        String name,
        String admin,
        BigDecimal budget,
        @JsonProperty("split_amount") BigDecimal splitAmount,
        List<String> members,
        Map<String, PaymentDTO> payments,
        @JsonProperty("created_at") LocalDateTime createdAt
) {}
