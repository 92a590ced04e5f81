package com.toolgate.security.scope;

import java.util.Collection;
import java.util.Set;

/**
 * Static entry point for expanding required scopes against {@link ScopeHierarchy#standard()}.
 */
public final class ScopeExpander {

    private ScopeExpander() {
        // utility class
    }

    /**
     * Expands required scopes to the accepted set, e.g. {@code public_repo} also accepts {@code repo}.
     */
    public static Set<String> expand(Collection<String> required) {
        return ScopeHierarchy.standard().expand(required);
    }

    public static Set<String> expand(String... required) {
        return expand(Set.of(required));
    }
}
