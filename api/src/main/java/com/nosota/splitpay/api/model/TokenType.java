package com.nosota.splitpay.api.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kind of signed token. Only access tokens authorize requests;
 * refresh tokens can only be exchanged for a new access token.
 */
public enum TokenType {
    ACCESS("access"),
    REFRESH("refresh");

    private final String claimValue;

    TokenType(String claimValue) {
        this.claimValue = claimValue;
    }

    /**
     * Value stored in the {@code token_type} claim.
     */
    public String claimValue() {
        return claimValue;
    }

    public static Optional<TokenType> fromClaimValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.claimValue.equals(value))
                .findFirst();
    }
}
