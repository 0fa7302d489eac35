package com.nosota.splitpay.security;

import com.nosota.splitpay.api.BearerTokens;
import com.nosota.splitpay.api.model.TokenType;
import com.nosota.splitpay.error.InsufficientRoleException;
import com.nosota.splitpay.error.InvalidTokenException;
import com.nosota.splitpay.error.InvalidTokenTypeException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Set;

/**
 * Turns an inbound {@code Authorization} header into verified claims and enforces role policy.
 * Stateless: every protected operation calls it first.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AccessControlGate {

    public static final String ROLE_ADMIN = "admin";

    private final TokenService tokenService;

    /**
     * Verifies the bearer access token of a request. Token service failures propagate unchanged.
     *
     * @param authorization Raw {@code Authorization} header
     * @return Claims of the access token
     * @throws InvalidTokenException     if the header is missing or the token is invalid
     * @throws InvalidTokenTypeException if a refresh token is presented
     */
    public TokenClaims authenticateRequest(String authorization) {
        TokenClaims claims = tokenService.verify(extractToken(authorization));
        if (claims.tokenType() != TokenType.ACCESS) {
            throw new InvalidTokenTypeException("Access token required");
        }
        return claims;
    }

    /**
     * Extracts the raw token from a {@code Bearer} header without verifying it.
     */
    public String extractToken(String authorization) {
        return BearerTokens.extract(authorization)
                .orElseThrow(() -> new InvalidTokenException("Missing bearer token"));
    }

    /**
     * Passes if the caller holds at least one of the required roles.
     *
     * @throws InsufficientRoleException otherwise
     */
    public void requireRoles(TokenClaims claims, Set<String> requiredRoles) {
        if (Collections.disjoint(claims.roles(), requiredRoles)) {
            log.warn("Role check failed: subject={}, roles={}, required={}",
                    claims.subject(), claims.roles(), requiredRoles);
            throw new InsufficientRoleException("Forbidden: insufficient role");
        }
    }
}
