package com.nosota.splitpay.api.response;

import com.nosota.splitpay.api.dto.UserSummaryDTO;

import java.util.Map;

/**
 * All registered users keyed by username.
 */
public record UserListResponse(
        Map<String, UserSummaryDTO> users
) {}
