package com.nosota.splitpay.api;

import com.nosota.splitpay.api.request.LoginRequest;
import com.nosota.splitpay.api.request.RegisterRequest;
import com.nosota.splitpay.api.response.AccessTokenResponse;
import com.nosota.splitpay.api.response.ProfileResponse;
import com.nosota.splitpay.api.response.RegisterResponse;
import com.nosota.splitpay.api.response.TokenResponse;
import com.nosota.splitpay.api.response.UserListResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Authentication API: registration, login, token refresh and role-gated endpoints.
 *
 * <p>Protected endpoints take the raw {@code Authorization} header
 * ({@code Bearer <token>}) and verify it server-side.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>AuthController - in service module (server-side implementation)</li>
 *   <li>AuthClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1")
public interface AuthApi {

    /**
     * Registers a new user and joins the listed groups.
     *
     * @param request Username, password, optional role and comma-separated groups
     * @return Created identity; 400 if the username is taken, 404 if a listed group does not exist
     */
    @PostMapping("/auth/register")
    ResponseEntity<RegisterResponse> register(
            @RequestBody @Valid RegisterRequest request);

    /**
     * Verifies credentials and issues an access/refresh token pair.
     *
     * @param request Username and password
     * @return Token pair; 401 on bad credentials
     */
    @PostMapping("/auth/login")
    ResponseEntity<TokenResponse> login(
            @RequestBody @Valid LoginRequest request);

    /**
     * Exchanges a refresh token for a new access token.
     *
     * @param authorization {@code Bearer <refresh token>}
     * @return New access token; 401 if the token is expired, invalid or not a refresh token
     */
    @PostMapping("/auth/refresh")
    ResponseEntity<AccessTokenResponse> refresh(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization);

    /**
     * Greets the caller identified by the access token.
     */
    @GetMapping("/protected")
    ResponseEntity<ProfileResponse> whoAmI(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization);

    /**
     * Lists all registered users. Requires role "admin".
     *
     * @return Users keyed by username; 403 for callers without the admin role
     */
    @GetMapping("/admin/users")
    ResponseEntity<UserListResponse> listUsers(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization);
}
