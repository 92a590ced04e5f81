package com.toolgate.gateway.domain.request;

import java.util.List;

/**
 * Side-channel directives for the catalogue filter behind the dispatcher.
 *
 * @param readOnly  only read-only operations should be offered
 * @param toolsets  allow-listed operation-set names
 * @param tools     explicitly allowed operation names
 * @param lockdown  apply the lockdown content policy
 * @param insiders  enable insiders-only operations
 * @param features  feature-flag names
 */
public record RequestConfig(
        boolean readOnly,
        List<String> toolsets,
        List<String> tools,
        boolean lockdown,
        boolean insiders,
        List<String> features) {

    private static final RequestConfig EMPTY = new RequestConfig(false, List.of(), List.of(), false, false, List.of());

    public RequestConfig {
        toolsets = toolsets == null ? List.of() : List.copyOf(toolsets);
        tools = tools == null ? List.of() : List.copyOf(tools);
        features = features == null ? List.of() : List.copyOf(features);
    }

    public static RequestConfig empty() {
        return EMPTY;
    }

    /**
     * Applies directives carried in the URL. A route that names them wins over headers.
     */
    public RequestConfig overriddenBy(RouteDirectives route) {
        return new RequestConfig(
                readOnly || route.readOnly(),
                route.toolset() != null ? List.of(route.toolset()) : toolsets,
                tools,
                lockdown,
                insiders || route.insiders(),
                features);
    }
}
