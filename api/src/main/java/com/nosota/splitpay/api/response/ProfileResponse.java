package com.nosota.splitpay.api.response;

import java.util.List;

public record ProfileResponse(
        String msg,
        List<String> roles
) {}
