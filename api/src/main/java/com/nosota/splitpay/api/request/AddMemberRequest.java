package com.nosota.splitpay.api.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record AddMemberRequest(
        @NotBlank(message = "Username is required")
        String username,

        @NotBlank(message = "Group name is required")
        @JsonProperty("group_name")
        String groupName
) {
}
