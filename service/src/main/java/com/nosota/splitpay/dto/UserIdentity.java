package com.nosota.splitpay.dto;

import java.util.List;

/**
 * User as seen outside the credential store: identity, roles and groups, never the password hash.
 */
public record UserIdentity(
        String username,
        List<String> roles,
        List<String> groups
) {}
