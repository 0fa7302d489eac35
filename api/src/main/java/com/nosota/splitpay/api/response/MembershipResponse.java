package com.nosota.splitpay.api.response;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Result of adding a member: the recomputed share per member.
 */
public record MembershipResponse(
        String msg,
        @JsonProperty("split_per_member") BigDecimal splitPerMember
) {}
