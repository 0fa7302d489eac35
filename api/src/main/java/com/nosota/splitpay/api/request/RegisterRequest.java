package com.nosota.splitpay.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Request for registering a new user.
 *
 * @param username Unique login name
 * @param password Plaintext password, hashed before storage
 * @param role     Initial role, "user" when omitted
 * @param groups   Comma-separated names of existing groups to join, may be empty
 */
public record RegisterRequest(
        @NotBlank(message = "Username is required")
        @Pattern(regexp = "^[A-Za-z0-9_.-]{1,64}$",
                message = "Username must be 1-64 characters of letters, digits, '_', '.' or '-'")
        String username,

        @NotBlank(message = "Password is required")
        @Size(min = 8, max = 128, message = "Password must be 8-128 characters")
        String password,

        @Pattern(regexp = "^[A-Za-z0-9_-]{1,32}$", message = "Role must be 1-32 characters of letters, digits, '_' or '-'")
        String role,

        String groups
) {
}
