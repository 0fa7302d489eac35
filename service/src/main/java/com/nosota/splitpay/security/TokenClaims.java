package com.nosota.splitpay.security;

import com.nosota.splitpay.api.model.TokenType;

import java.time.Instant;
import java.util.List;

/**
 * Claims carried by a verified token. Immutable; a new token is a new value.
 *
 * @param subject   Username
 * @param roles     Roles at issue time
 * @param groups    Group names at issue time
 * @param issuedAt  Issue time (second precision)
 * @param expiresAt Expiry time (second precision)
 * @param tokenType Access or refresh
 * @param tokenId   Random token id ({@code jti})
 */
public record TokenClaims(
        String subject,
        List<String> roles,
        List<String> groups,
        Instant issuedAt,
        Instant expiresAt,
        TokenType tokenType,
        String tokenId
) {
    public boolean hasRole(String role) {
        return roles.contains(role);
    }
}
