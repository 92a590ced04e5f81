package com.toolgate.gateway.domain.request;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON-RPC envelope fields extracted once per request.
 *
 * @param method       JSON-RPC method, never empty
 * @param itemName     operation name for {@code tools/call} and {@code prompts/get}, URI for
 *                     {@code resources/read}; null for other methods
 * @param arguments    shallow decode of {@code params.arguments} when it is an object, otherwise null
 * @param ownerHint    {@code arguments.owner} when it is a string
 * @param resourceHint {@code arguments.repo} when it is a string
 */
public record ParsedRequest(
        String method,
        String itemName,
        Map<String, Object> arguments,
        String ownerHint,
        String resourceHint) {

    public static final String TOOLS_CALL = "tools/call";
    public static final String PROMPTS_GET = "prompts/get";
    public static final String RESOURCES_READ = "resources/read";

    public ParsedRequest {
        if (method == null || method.isEmpty()) {
            throw new IllegalArgumentException("method must not be null or empty");
        }
        arguments = arguments == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public static ParsedRequest of(String method) {
        return new ParsedRequest(method, null, null, null, null);
    }

    public boolean isToolCall() {
        return TOOLS_CALL.equals(method);
    }

    /** True when both owner and repository hints are present. */
    public boolean hasRepositoryHints() {
        return ownerHint != null && !ownerHint.isEmpty() && resourceHint != null && !resourceHint.isEmpty();
    }

    /** Label used in logs, e.g. {@code tools/call:create_gist}. */
    public String operationLabel() {
        return itemName == null || itemName.isEmpty() ? method : method + ":" + itemName;
    }
}
