package com.toolgate.gateway.domain.pipeline;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A response that ends the pipeline.
 *
 * @param status  HTTP status code
 * @param headers response headers
 * @param body    plain-text body
 */
public record DenialResponse(int status, Map<String, String> headers, String body) {

    public static final String WWW_AUTHENTICATE = "WWW-Authenticate";

    public DenialResponse {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    /**
     * 401 pointing the client at the discovery document.
     */
    public static DenialResponse unauthorized(String resourceMetadataUrl) {
        return new DenialResponse(401,
                Map.of(WWW_AUTHENTICATE, "Bearer resource_metadata=" + quote(resourceMetadataUrl)),
                "Unauthorized");
    }

    /**
     * 400 for a credential that is present but unusable.
     */
    public static DenialResponse badRequest(String message) {
        return new DenialResponse(400, Map.of(), message);
    }

    /**
     * 403 insufficient-scope challenge.
     *
     * @param recommendedScopes scopes the client should request: what it holds plus what is missing
     * @param missingScopes     the operation's required scopes
     */
    public static DenialResponse insufficientScope(Collection<String> recommendedScopes, String resourceMetadataUrl,
                                                   Collection<String> missingScopes) {
        String challenge = "Bearer error=\"insufficient_scope\""
                + ", scope=" + quote(String.join(" ", recommendedScopes))
                + ", resource_metadata=" + quote(resourceMetadataUrl)
                + ", error_description=" + quote("Additional scopes required: " + String.join(", ", missingScopes));
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(WWW_AUTHENTICATE, challenge);
        return new DenialResponse(403, headers, "Forbidden: insufficient scopes");
    }

    private static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
