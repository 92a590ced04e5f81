package com.toolgate.security.scope;

import java.util.List;
import java.util.Set;

/**
 * Scope requirements of one operation.
 *
 * @param requiredScopes the narrow scopes, in catalogue order; these are what remediation messages name
 * @param acceptedScopes the closure of {@code requiredScopes} under the scope hierarchy; any one suffices
 */
public record OperationScopeInfo(List<String> requiredScopes, Set<String> acceptedScopes) {

    public OperationScopeInfo {
        requiredScopes = requiredScopes == null ? List.of() : List.copyOf(requiredScopes);
        acceptedScopes = acceptedScopes == null ? Set.of() : Set.copyOf(acceptedScopes);
    }

    /** True when the operation requires nothing. */
    public boolean isEmpty() {
        return requiredScopes.isEmpty() && acceptedScopes.isEmpty();
    }
}
