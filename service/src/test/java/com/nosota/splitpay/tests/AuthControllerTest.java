package com.nosota.splitpay.tests;

import com.fasterxml.jackson.databind.JsonNode;
import com.nosota.splitpay.TestBase;
import com.nosota.splitpay.api.BearerTokens;
import com.nosota.splitpay.api.request.LoginRequest;
import com.nosota.splitpay.api.request.RegisterRequest;
import com.nosota.splitpay.filter.CorrelationIdFilter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.emptyString;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests for AuthController via REST API with MockMvc.
 *
 * <ul>
 *   <li>Registration and login</li>
 *   <li>Access and refresh token handling</li>
 *   <li>Role-protected user listing</li>
 *   <li>Error body and correlation id</li>
 * </ul>
 */
@DisplayName("5. Auth Controller Tests")
public class AuthControllerTest extends TestBase {

    @Test
    void register_ReturnsCreatedUser() throws Exception {
        String username = uniqueName("alice");
        RegisterRequest request = new RegisterRequest(username, PASSWORD, null, null);

        mockMvc.perform(post("/api/v1/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.msg").value("User registered successfully"))
                .andExpect(jsonPath("$.username").value(username))
                .andExpect(jsonPath("$.roles[0]").value("user"))
                .andExpect(jsonPath("$.groups").isEmpty());
    }

    @Test
    void register_DuplicateUsername_Returns400() throws Exception {
        String username = registerUser("bob");
        RegisterRequest request = new RegisterRequest(username, PASSWORD, null, null);

        mockMvc.perform(post("/api/v1/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Conflict"));
    }

    @Test
    void register_ShortPassword_Returns400() throws Exception {
        RegisterRequest request = new RegisterRequest(uniqueName("carol"), "short", null, null);

        mockMvc.perform(post("/api/v1/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(containsString("password")));
    }

    @Test
    void register_UnknownGroup_Returns404() throws Exception {
        String username = uniqueName("dave");
        RegisterRequest request = new RegisterRequest(username, PASSWORD, null, "no-such-group-" + username);

        mockMvc.perform(post("/api/v1/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isNotFound());

        assertThat(userAccountRepository.existsById(username)).isFalse();
    }

    @Test
    void login_IssuesTokenPairUsableOnProtectedEndpoint() throws Exception {
        String username = registerUser("erin");

        JsonNode tokens = login(username, PASSWORD);
        assertThat(tokens.get("token_type").asText()).isEqualTo("bearer");

        mockMvc.perform(get("/api/v1/protected")
                        .header(HttpHeaders.AUTHORIZATION, BearerTokens.header(tokens.get("access_token").asText())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.msg").value("Hello " + username))
                .andExpect(jsonPath("$.roles[0]").value("user"));
    }

    @Test
    void login_WrongPassword_Returns401() throws Exception {
        String username = registerUser("frank");
        LoginRequest request = new LoginRequest(username, "not-the-password");

        mockMvc.perform(post("/api/v1/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Invalid credentials"));
    }

    @Test
    void protected_WithoutToken_Returns401() throws Exception {
        mockMvc.perform(get("/api/v1/protected"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void protected_WithRefreshToken_Returns401() throws Exception {
        String username = registerUser("gina");
        JsonNode tokens = login(username, PASSWORD);

        mockMvc.perform(get("/api/v1/protected")
                        .header(HttpHeaders.AUTHORIZATION, BearerTokens.header(tokens.get("refresh_token").asText())))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Access token required"));
    }

    @Test
    void refresh_IssuesNewAccessToken() throws Exception {
        String username = registerUser("hank");
        JsonNode tokens = login(username, PASSWORD);

        MvcResult result = mockMvc.perform(post("/api/v1/auth/refresh")
                        .header(HttpHeaders.AUTHORIZATION, BearerTokens.header(tokens.get("refresh_token").asText())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.token_type").value("bearer"))
                .andReturn();

        String accessToken = objectMapper.readTree(result.getResponse().getContentAsString())
                .get("access_token").asText();
        assertThat(tokenService.verify(accessToken).subject()).isEqualTo(username);
    }

    @Test
    void refresh_WithAccessToken_Returns401() throws Exception {
        String username = registerUser("ivy");

        mockMvc.perform(post("/api/v1/auth/refresh")
                        .header(HttpHeaders.AUTHORIZATION, bearer(username)))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void listUsers_RequiresAdminRole() throws Exception {
        String user = registerUser("plain");
        String admin = registerUser("boss", "admin");

        mockMvc.perform(get("/api/v1/admin/users")
                        .header(HttpHeaders.AUTHORIZATION, bearer(user)))
                .andExpect(status().isForbidden());

        mockMvc.perform(get("/api/v1/admin/users")
                        .header(HttpHeaders.AUTHORIZATION, bearer(admin)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.users['" + user + "'].roles[0]").value("user"))
                .andExpect(jsonPath("$.users['" + admin + "'].roles[0]").value("admin"))
                .andExpect(jsonPath("$.users['" + admin + "'].password_hash").doesNotExist());
    }

    @Test
    void errors_CarryCorrelationId() throws Exception {
        mockMvc.perform(get("/api/v1/protected")
                        .header(CorrelationIdFilter.HEADER, "trace-42"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string(CorrelationIdFilter.HEADER, "trace-42"))
                .andExpect(jsonPath("$.correlationId").value("trace-42"))
                .andExpect(jsonPath("$.path").value("/api/v1/protected"));

        mockMvc.perform(get("/api/v1/protected"))
                .andExpect(header().string(CorrelationIdFilter.HEADER, not(emptyString())));
    }

    private JsonNode login(String username, String password) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/v1/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new LoginRequest(username, password))))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }
}
