package com.flagship.general_ledger.web;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Acting-user header and originating address of an HTTP call, recorded on approval actions.
 */
public final class RequestOrigin {

    public static final String USER_HEADER = "X-User";
    static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";

    private RequestOrigin() {
    }

    /**
     * First hop of {@code X-Forwarded-For} when present, else the socket peer address.
     */
    public static String addressOf(HttpServletRequest request) {
        String forwarded = request.getHeader(FORWARDED_FOR_HEADER);
        if (forwarded != null && !forwarded.isBlank()) {
            int comma = forwarded.indexOf(',');
            return (comma >= 0 ? forwarded.substring(0, comma) : forwarded).trim();
        }
        return request.getRemoteAddr();
    }
}
