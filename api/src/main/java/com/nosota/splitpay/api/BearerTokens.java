package com.nosota.splitpay.api;

import java.util.Optional;

/**
 * Helpers for the {@code Authorization: Bearer <token>} header.
 */
public final class BearerTokens {

    public static final String SCHEME = "bearer";

    private static final String PREFIX = "Bearer ";

    private BearerTokens() {
    }

    /**
     * Builds the header value for a token.
     */
    public static String header(String token) {
        return PREFIX + token;
    }

    /**
     * Extracts the token from a header value. The scheme is matched case-insensitively.
     *
     * @param authorization raw header value, may be null
     * @return the token, or empty if the header is missing, uses another scheme or carries no token
     */
    public static Optional<String> extract(String authorization) {
        if (authorization == null || authorization.length() <= PREFIX.length()) {
            return Optional.empty();
        }
        if (!authorization.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
            return Optional.empty();
        }
        String token = authorization.substring(PREFIX.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
