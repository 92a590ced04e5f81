package com.toolgate.gateway.infrastructure.web;

import com.toolgate.gateway.domain.pipeline.InboundRequest;
import jakarta.servlet.http.HttpServletRequest;

/**
 * {@link InboundRequest} over a servlet request. The body is supplied by the caller, already read.
 */
public class ServletInboundRequest implements InboundRequest {

    private static final byte[] NO_BODY = new byte[0];

    private final HttpServletRequest request;
    private final String path;
    private final byte[] body;

    public ServletInboundRequest(HttpServletRequest request, byte[] body) {
        this.request = request;
        this.path = AuthorizationFilter.pathWithinApplication(request);
        this.body = body == null ? NO_BODY : body;
    }

    /** For requests whose body is irrelevant, such as discovery lookups. */
    public static ServletInboundRequest withoutBody(HttpServletRequest request) {
        return new ServletInboundRequest(request, NO_BODY);
    }

    @Override
    public String method() {
        return request.getMethod();
    }

    @Override
    public String path() {
        return path;
    }

    @Override
    public String header(String name) {
        return request.getHeader(name);
    }

    @Override
    public byte[] body() {
        return body;
    }

    @Override
    public boolean secure() {
        return request.isSecure();
    }
}
