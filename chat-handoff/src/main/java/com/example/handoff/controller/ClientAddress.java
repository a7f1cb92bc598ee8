package com.example.handoff.controller;

import jakarta.servlet.http.HttpServletRequest;

final class ClientAddress {

    private ClientAddress() {
    }

    static String resolve(HttpServletRequest request) {
        String forwardedFor = request.getHeader("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            return forwardedFor.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
