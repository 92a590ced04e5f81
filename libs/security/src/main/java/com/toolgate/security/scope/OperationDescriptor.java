package com.toolgate.security.scope;

import java.util.List;

/**
 * Catalogue entry for one registered operation, as far as scope checks are concerned.
 *
 * @param name           operation name as sent in {@code params.name}
 * @param requiredScopes narrow scopes the operation needs; empty means no requirement
 */
public record OperationDescriptor(String name, List<String> requiredScopes) {

    public OperationDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        requiredScopes = requiredScopes == null ? List.of() : List.copyOf(requiredScopes);
    }
}
