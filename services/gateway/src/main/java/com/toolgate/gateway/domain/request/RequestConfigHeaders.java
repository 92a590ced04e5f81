package com.toolgate.gateway.domain.request;

import com.toolgate.gateway.domain.pipeline.InboundRequest;
import com.toolgate.security.scope.ScopeHeaders;
import java.util.Locale;
import java.util.Set;

/**
 * Names and parsing rules of the {@code X-MCP-*} directive headers.
 */
public final class RequestConfigHeaders {

    public static final String READONLY = "X-MCP-Readonly";
    public static final String TOOLSETS = "X-MCP-Toolsets";
    public static final String TOOLS = "X-MCP-Tools";
    public static final String LOCKDOWN = "X-MCP-Lockdown";
    public static final String INSIDERS = "X-MCP-Insiders";
    public static final String FEATURES = "X-MCP-Features";

    private static final Set<String> FALSE_VALUES = Set.of("", "false", "0", "no", "off", "n", "f");

    private RequestConfigHeaders() {
        // utility class
    }

    /**
     * Builds the header-derived configuration for a request.
     */
    public static RequestConfig read(InboundRequest request) {
        return new RequestConfig(
                relaxedParseBool(request.header(READONLY)),
                ScopeHeaders.parseCommaSeparated(request.header(TOOLSETS)),
                ScopeHeaders.parseCommaSeparated(request.header(TOOLS)),
                relaxedParseBool(request.header(LOCKDOWN)),
                relaxedParseBool(request.header(INSIDERS)),
                ScopeHeaders.parseCommaSeparated(request.header(FEATURES)));
    }

    /**
     * Everything except an absent value and the usual spellings of "no" counts as true.
     * Case-insensitive and whitespace-tolerant.
     */
    public static boolean relaxedParseBool(String value) {
        if (value == null) {
            return false;
        }
        return !FALSE_VALUES.contains(value.strip().toLowerCase(Locale.ROOT));
    }
}
