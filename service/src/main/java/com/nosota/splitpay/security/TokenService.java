package com.nosota.splitpay.security;

import com.nosota.splitpay.api.model.TokenType;
import com.nosota.splitpay.error.ExpiredTokenException;
import com.nosota.splitpay.error.InvalidTokenException;
import com.nosota.splitpay.error.InvalidTokenTypeException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.UUID;

/**
 * Issues and verifies signed, expiring JWTs (HS256).
 *
 * <p>Token lifecycle: issued → valid → expired. Expiry is checked on verification only;
 * there is no revocation and refresh tokens are not rotated, so a refresh token can be
 * exchanged repeatedly until it expires.
 *
 * <p>Claims: {@code sub}, {@code roles}, {@code groups}, {@code iat}, {@code exp},
 * {@code token_type} and {@code jti}. A token lacking any of them is rejected.
 */
@Service
@Slf4j
public class TokenService {

    static final String CLAIM_ROLES = "roles";
    static final String CLAIM_GROUPS = "groups";
    static final String CLAIM_TOKEN_TYPE = "token_type";

    private final Key key;
    private final Duration accessTokenTtl;
    private final Duration refreshTokenTtl;
    private final Clock clock;

    public TokenService(
            @Value("${splitpay.security.jwt.secret}") String secret,
            @Value("${splitpay.security.jwt.access-token-ttl:30m}") Duration accessTokenTtl,
            @Value("${splitpay.security.jwt.refresh-token-ttl:7d}") Duration refreshTokenTtl,
            Clock clock) {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.accessTokenTtl = accessTokenTtl;
        this.refreshTokenTtl = refreshTokenTtl;
        this.clock = clock;
        log.info("Token service initialized: accessTokenTtl={}, refreshTokenTtl={}", accessTokenTtl, refreshTokenTtl);
    }

    public String issueAccessToken(String subject, Collection<String> roles, Collection<String> groups) {
        return issue(subject, roles, groups, TokenType.ACCESS, accessTokenTtl);
    }

    public String issueRefreshToken(String subject, Collection<String> roles, Collection<String> groups) {
        return issue(subject, roles, groups, TokenType.REFRESH, refreshTokenTtl);
    }

    /**
     * Decodes a token and checks its signature, expiry and claims.
     *
     * @param token Compact JWT
     * @return The verified claims
     * @throws ExpiredTokenException if the token is past its expiry
     * @throws InvalidTokenException if the token is malformed, badly signed or lacks a claim
     */
    public TokenClaims verify(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Token is missing");
        }

        try {
            Claims claims = Jwts.parserBuilder()
                    .setSigningKey(key)
                    .setClock(() -> Date.from(clock.instant()))
                    .build()
                    .parseClaimsJws(token)
                    .getBody();
            return toTokenClaims(claims);
        } catch (ExpiredJwtException e) {
            log.debug("Rejected expired token: subject={}", e.getClaims().getSubject());
            throw new ExpiredTokenException("Token expired");
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected invalid token: {}", e.getMessage());
            throw new InvalidTokenException("Invalid token", e);
        }
    }

    /**
     * Exchanges a refresh token for a new access token with the same subject, roles and groups.
     *
     * @throws InvalidTokenTypeException if the token is not a refresh token
     */
    public String refresh(String refreshToken) {
        TokenClaims claims = verify(refreshToken);
        if (claims.tokenType() != TokenType.REFRESH) {
            throw new InvalidTokenTypeException("Invalid refresh token");
        }
        log.debug("Refreshing access token: subject={}", claims.subject());
        return issueAccessToken(claims.subject(), claims.roles(), claims.groups());
    }

    private String issue(String subject, Collection<String> roles, Collection<String> groups,
                         TokenType tokenType, Duration ttl) {
        // JWT dates have second precision
        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = issuedAt.plus(ttl);

        return Jwts.builder()
                .setId(UUID.randomUUID().toString())
                .setSubject(subject)
                .claim(CLAIM_ROLES, List.copyOf(roles))
                .claim(CLAIM_GROUPS, List.copyOf(groups))
                .claim(CLAIM_TOKEN_TYPE, tokenType.claimValue())
                .setIssuedAt(Date.from(issuedAt))
                .setExpiration(Date.from(expiresAt))
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    private TokenClaims toTokenClaims(Claims claims) {
        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw missingClaim("sub");
        }
        Date issuedAt = dateClaim(claims, Claims.ISSUED_AT);
        Date expiresAt = dateClaim(claims, Claims.EXPIRATION);
        String tokenId = claims.getId();
        if (tokenId == null || tokenId.isBlank()) {
            throw missingClaim("jti");
        }
        Object rawType = claims.get(CLAIM_TOKEN_TYPE);
        TokenType tokenType = TokenType.fromClaimValue(rawType instanceof String ? (String) rawType : null)
                .orElseThrow(() -> missingClaim(CLAIM_TOKEN_TYPE));

        return new TokenClaims(
                subject,
                stringList(claims, CLAIM_ROLES),
                stringList(claims, CLAIM_GROUPS),
                issuedAt.toInstant(),
                expiresAt.toInstant(),
                tokenType,
                tokenId
        );
    }

    /**
     * Reads a NumericDate claim (seconds since the epoch). Any other JSON type is rejected.
     */
    private static Date dateClaim(Claims claims, String name) {
        Object value = claims.get(name);
        if (value == null) {
            throw missingClaim(name);
        }
        if (!(value instanceof Number)) {
            throw new InvalidTokenException("Token claim '" + name + "' must be a numeric date");
        }
        return claims.get(name, Date.class);
    }

    private static List<String> stringList(Claims claims, String name) {
        Object value = claims.get(name);
        if (!(value instanceof List)) {
            throw missingClaim(name);
        }
        List<String> result = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (!(item instanceof String)) {
                throw new InvalidTokenException("Token claim '" + name + "' must contain only strings");
            }
            result.add((String) item);
        }
        return List.copyOf(result);
    }

    private static InvalidTokenException missingClaim(String name) {
        return new InvalidTokenException("Token is missing required claim: " + name);
    }
}
