package com.dgw.resolver.api;

import jakarta.servlet.http.HttpServletRequest;
import java.util.UUID;

public final class RequestIdUtil {
    private RequestIdUtil() {
    }

    public static String resolveOrGenerate(HttpServletRequest request, String headerName) {
        String value = request.getHeader(headerName);
        if (value != null && !value.isBlank()) {
            return value.trim();
        }
        return UUID.randomUUID().toString();
    }
}
