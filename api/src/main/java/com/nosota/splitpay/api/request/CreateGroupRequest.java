package com.nosota.splitpay.api.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * Request for creating an expense group. The caller becomes the group admin.
 *
 * <p>Budget positivity is checked by the ledger itself so that a non-positive
 * budget is reported as an invalid budget rather than a generic validation error.
 *
 * @param groupName  Unique group name
 * @param budget     Total amount to split, at most 2 decimal places
 * @param addCreator Whether the admin is also a paying member, true when omitted
 */
public record CreateGroupRequest(
        @NotBlank(message = "Group name is required")
        @Size(max = 100, message = "Group name must be at most 100 characters")
        @JsonProperty("group_name")
        String groupName,

        @NotNull(message = "Budget is required")
        @Digits(integer = 15, fraction = 2, message = "Budget must have at most 2 decimal places")
        BigDecimal budget,

        @JsonProperty("add_creator")
        Boolean addCreator
) {
}
