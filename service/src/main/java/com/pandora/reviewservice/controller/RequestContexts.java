package com.pandora.reviewservice.controller;

import com.pandora.reviewservice.service.RequestContext;
import jakarta.servlet.http.HttpServletRequest;

/**
 * Builds a {@link RequestContext} from the identity header set by the authenticating proxy.
 */
final class RequestContexts {

    static final String ACTOR_HEADER = "X-Actor-Id";
    static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";

    private RequestContexts() {
    }

    static RequestContext of(Long actorId, HttpServletRequest request) {
        return new RequestContext(actorId, originAddress(request));
    }

    // first hop of X-Forwarded-For, else the socket peer
    static String originAddress(HttpServletRequest request) {
        String forwarded = request.getHeader(FORWARDED_FOR_HEADER);
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
