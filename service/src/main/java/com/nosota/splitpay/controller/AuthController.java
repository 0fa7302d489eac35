package com.nosota.splitpay.controller;

import com.nosota.splitpay.api.AuthApi;
import com.nosota.splitpay.api.BearerTokens;
import com.nosota.splitpay.api.dto.UserSummaryDTO;
import com.nosota.splitpay.api.request.LoginRequest;
import com.nosota.splitpay.api.request.RegisterRequest;
import com.nosota.splitpay.api.response.AccessTokenResponse;
import com.nosota.splitpay.api.response.ProfileResponse;
import com.nosota.splitpay.api.response.RegisterResponse;
import com.nosota.splitpay.api.response.TokenResponse;
import com.nosota.splitpay.api.response.UserListResponse;
import com.nosota.splitpay.dto.UserIdentity;
import com.nosota.splitpay.mapper.UserAccountMapper;
import com.nosota.splitpay.security.AccessControlGate;
import com.nosota.splitpay.security.TokenClaims;
import com.nosota.splitpay.security.TokenService;
import com.nosota.splitpay.service.CredentialService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * REST controller for registration, login and token handling.
 *
 * <p>Implements {@link AuthApi}. Protected endpoints go through {@link AccessControlGate}.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class AuthController implements AuthApi {

    private final CredentialService credentialService;
    private final TokenService tokenService;
    private final AccessControlGate accessControlGate;

    @Override
    public ResponseEntity<RegisterResponse> register(RegisterRequest request) {
        log.info("Register request: username={}, role={}, groups={}",
                request.username(), request.role(), request.groups());

        UserIdentity identity = credentialService.register(
                request.username(),
                request.password(),
                request.role(),
                CredentialService.parseGroupNames(request.groups())
        );

        RegisterResponse response = new RegisterResponse(
                "User registered successfully",
                identity.username(),
                identity.roles(),
                identity.groups()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Override
    public ResponseEntity<TokenResponse> login(LoginRequest request) {
        UserIdentity identity = credentialService.authenticate(request.username(), request.password());

        String accessToken = tokenService.issueAccessToken(identity.username(), identity.roles(), identity.groups());
        String refreshToken = tokenService.issueRefreshToken(identity.username(), identity.roles(), identity.groups());

        log.info("Tokens issued: username={}", identity.username());
        return ResponseEntity.ok(new TokenResponse(accessToken, refreshToken, BearerTokens.SCHEME));
    }

    @Override
    public ResponseEntity<AccessTokenResponse> refresh(String authorization) {
        String accessToken = tokenService.refresh(accessControlGate.extractToken(authorization));
        return ResponseEntity.ok(new AccessTokenResponse(accessToken, BearerTokens.SCHEME));
    }

    @Override
    public ResponseEntity<ProfileResponse> whoAmI(String authorization) {
        TokenClaims claims = accessControlGate.authenticateRequest(authorization);
        return ResponseEntity.ok(new ProfileResponse("Hello " + claims.subject(), claims.roles()));
    }

    @Override
    public ResponseEntity<UserListResponse> listUsers(String authorization) {
        TokenClaims claims = accessControlGate.authenticateRequest(authorization);
        accessControlGate.requireRoles(claims, Set.of(AccessControlGate.ROLE_ADMIN));

        Map<String, UserSummaryDTO> users = new LinkedHashMap<>();
        for (UserIdentity identity : credentialService.listUsers()) {
            users.put(identity.username(), UserAccountMapper.INSTANCE.toSummary(identity));
        }

        log.debug("Users listed by {}: count={}", claims.subject(), users.size());
        return ResponseEntity.ok(new UserListResponse(users));
    }
}
