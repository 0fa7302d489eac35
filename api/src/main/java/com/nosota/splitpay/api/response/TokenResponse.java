package com.nosota.splitpay.api.response;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Token pair issued on login.
 */
public record TokenResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("refresh_token") String refreshToken,
        @JsonProperty("token_type") String tokenType
) {}
