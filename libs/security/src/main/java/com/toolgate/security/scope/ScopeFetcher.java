package com.toolgate.security.scope;

import java.util.List;

/**
 * Retrieves the scopes granted to a token by the upstream platform.
 */
@FunctionalInterface
public interface ScopeFetcher {

    /**
     * @param token the raw token, without scheme
     * @return granted scopes in upstream order; empty is a valid answer
     * @throws ScopeFetchException if the upstream rejects the token or cannot be reached
     */
    List<String> fetchScopes(String token);
}
