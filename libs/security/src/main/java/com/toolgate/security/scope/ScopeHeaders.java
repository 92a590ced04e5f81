package com.toolgate.security.scope;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsing for the upstream {@code X-OAuth-Scopes} header.
 */
public final class ScopeHeaders {

    /** Response header listing the scopes granted to the calling token. */
    public static final String OAUTH_SCOPES = "X-OAuth-Scopes";

    private ScopeHeaders() {
        // utility class
    }

    /**
     * Splits a comma-separated value, trimming entries and dropping empty ones.
     * A null or blank value yields an empty list.
     */
    public static List<String> parseCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (String part : value.split(",")) {
            String trimmed = part.strip();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return List.copyOf(result);
    }
}
