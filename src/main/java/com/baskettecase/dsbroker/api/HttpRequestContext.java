package com.baskettecase.dsbroker.api;

import com.baskettecase.dsbroker.audit.RequestContext;
import jakarta.servlet.http.HttpServletRequest;

/**
 * {@link RequestContext} over a servlet request.
 */
public class HttpRequestContext implements RequestContext {

    static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";

    private final String forwardedIdentity;

    public HttpRequestContext(HttpServletRequest request) {
        // Resolved eagerly: the request object must not be touched after the request completes
        String forwardedFor = request.getHeader(FORWARDED_FOR_HEADER);
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            this.forwardedIdentity = forwardedFor.trim();
        } else if (request.getRemoteAddr() != null) {
            this.forwardedIdentity = request.getRemoteAddr();
        } else {
            this.forwardedIdentity = "unknown";
        }
    }

    @Override
    public String forwardedIdentity() {
        return forwardedIdentity;
    }
}
