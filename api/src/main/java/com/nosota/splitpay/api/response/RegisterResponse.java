package com.nosota.splitpay.api.response;

import java.util.List;

public record RegisterResponse(
        String msg,
        String username,
        List<String> roles,
        List<String> groups
) {}
