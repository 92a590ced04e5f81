package com.toolgate.security;

import com.toolgate.observability.SecretMasker;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A classified bearer credential, scoped to a single request.
 * <p>
 * Instances are created by {@link CredentialClassifier} and mutated once by scope hydration
 * through {@link #attachScopes(Collection)}. They are never shared across requests, so no
 * synchronisation is applied.
 */
public final class Credential {

    private final String token;
    private final CredentialType type;
    private boolean scopesFetched;
    private Set<String> scopes = Set.of();

    public Credential(String token, CredentialType type) {
        this.token = Objects.requireNonNull(token, "token must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
    }

    /** The raw token, without any scheme prefix. Never log this value. */
    public String token() {
        return token;
    }

    public CredentialType type() {
        return type;
    }

    /**
     * Whether scopes have been fetched for this credential. An empty scope set with this flag
     * set means the credential genuinely has no scopes.
     */
    public boolean scopesFetched() {
        return scopesFetched;
    }

    /** Granted scopes in upstream order; empty until hydrated. */
    public Set<String> scopes() {
        return scopes;
    }

    /**
     * Attaches fetched scopes and marks the credential as hydrated.
     *
     * @param fetched scopes reported upstream (may be empty, must not be null)
     */
    public void attachScopes(Collection<String> fetched) {
        Objects.requireNonNull(fetched, "fetched must not be null");
        this.scopes = Collections.unmodifiableSet(new LinkedHashSet<>(fetched));
        this.scopesFetched = true;
    }

    @Override
    public String toString() {
        return "Credential[type=%s, token=%s, scopesFetched=%s, scopes=%s]"
                .formatted(type, SecretMasker.mask(token), scopesFetched, scopes);
    }
}
