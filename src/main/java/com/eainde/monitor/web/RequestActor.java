package com.eainde.monitor.web;

import jakarta.servlet.http.HttpServletRequest;

import java.security.Principal;

/**
 * Identifies the user behind a request. Authentication happens upstream; the
 * gateway forwards the user id in {@link #USER_HEADER}.
 */
public final class RequestActor {

    public static final String USER_HEADER = "X-Monitor-User";

    private RequestActor() {
    }

    /**
     * @return the user id, or {@code null} for anonymous requests
     */
    public static String resolve(HttpServletRequest request) {
        Principal principal = request.getUserPrincipal();
        if (principal != null) {
            return principal.getName();
        }
        String header = request.getHeader(USER_HEADER);
        return header == null || header.isBlank() ? null : header.strip();
    }
}
