package com.nosota.splitpay.api.response;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * New access token issued in exchange for a refresh token.
 */
public record AccessTokenResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("token_type") String tokenType
) {}
