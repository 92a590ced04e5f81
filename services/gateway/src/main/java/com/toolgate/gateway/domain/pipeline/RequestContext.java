package com.toolgate.gateway.domain.pipeline;

import com.toolgate.gateway.domain.request.ParsedRequest;
import com.toolgate.gateway.domain.request.RequestConfig;
import com.toolgate.security.Credential;
import java.util.Optional;

/**
 * Results the stages attach for later stages and for the dispatcher.
 *
 * <p>One instance per request, touched only by the thread serving it.
 */
public class RequestContext {

    /** Servlet request attribute under which the forwarded context is exposed. */
    public static final String ATTRIBUTE = "com.toolgate.gateway.RequestContext";

    private Credential credential;
    private RequestConfig requestConfig = RequestConfig.empty();
    private ParsedRequest parsedRequest;

    public Credential credential() {
        return credential;
    }

    public void attachCredential(Credential credential) {
        this.credential = credential;
    }

    public RequestConfig requestConfig() {
        return requestConfig;
    }

    public void attachRequestConfig(RequestConfig requestConfig) {
        this.requestConfig = requestConfig == null ? RequestConfig.empty() : requestConfig;
    }

    /** Empty when the body was not a JSON-RPC 2.0 call; consumers then fall back or skip. */
    public Optional<ParsedRequest> parsedRequest() {
        return Optional.ofNullable(parsedRequest);
    }

    public void attachParsedRequest(ParsedRequest parsedRequest) {
        this.parsedRequest = parsedRequest;
    }
}
