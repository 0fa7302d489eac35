package com.nosota.splitpay.api;

import com.nosota.splitpay.api.request.LoginRequest;
import com.nosota.splitpay.api.request.RegisterRequest;
import com.nosota.splitpay.api.response.AccessTokenResponse;
import com.nosota.splitpay.api.response.ProfileResponse;
import com.nosota.splitpay.api.response.RegisterResponse;
import com.nosota.splitpay.api.response.TokenResponse;
import com.nosota.splitpay.api.response.UserListResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient-based implementation of AuthApi for consuming the splitpay service.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consuming services must
 * manually register it as a bean in their configuration:
 * <pre>
 * {@code
 * @Bean
 * public AuthClient authClient(WebClient.Builder builder,
 *                              @Value("${services.splitpay.url}") String baseUrl) {
 *     return new AuthClient(builder.baseUrl(baseUrl).build());
 * }
 * }
 * </pre>
 *
 * <p>Non-2xx responses surface as {@code WebClientResponseException}.
 */
@RequiredArgsConstructor
@Slf4j
public class AuthClient implements AuthApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<RegisterResponse> register(RegisterRequest request) {
        log.debug("Calling register: username={}", request.username());

        return webClient.post()
                .uri("/api/v1/auth/register")
                .bodyValue(request)
                .retrieve()
                .toEntity(RegisterResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<TokenResponse> login(LoginRequest request) {
        log.debug("Calling login: username={}", request.username());

        return webClient.post()
                .uri("/api/v1/auth/login")
                .bodyValue(request)
                .retrieve()
                .toEntity(TokenResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<AccessTokenResponse> refresh(String authorization) {
        log.debug("Calling refresh");

        return webClient.post()
                .uri("/api/v1/auth/refresh")
                .headers(headers -> setAuthorization(headers, authorization))
                .retrieve()
                .toEntity(AccessTokenResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ProfileResponse> whoAmI(String authorization) {
        log.debug("Calling whoAmI");

        return webClient.get()
                .uri("/api/v1/protected")
                .headers(headers -> setAuthorization(headers, authorization))
                .retrieve()
                .toEntity(ProfileResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<UserListResponse> listUsers(String authorization) {
        log.debug("Calling listUsers");

        return webClient.get()
                .uri("/api/v1/admin/users")
                .headers(headers -> setAuthorization(headers, authorization))
                .retrieve()
                .toEntity(UserListResponse.class)
                .block();
    }

    static void setAuthorization(HttpHeaders headers, String authorization) {
        if (authorization != null) {
            headers.set(HttpHeaders.AUTHORIZATION, authorization);
        }
    }
}
