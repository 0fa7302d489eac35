package com.nosota.splitpay.api.dto;

import java.util.List;

/**
 * Public view of a registered user, without credentials.
 */
public record UserSummaryDTO(
        List<String> roles,
        List<String> groups
) {}
