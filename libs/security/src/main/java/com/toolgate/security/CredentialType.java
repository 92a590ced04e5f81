package com.toolgate.security;

import java.util.Optional;

/**
 * Kinds of bearer credential the gateway understands.
 * <p>
 * Declaration order is classification order: {@link CredentialClassifier} tries each literal
 * prefix in turn and the first match wins. {@link #UNKNOWN} has no prefix and is never the
 * result of a successful classification.
 */
public enum CredentialType {

    /** Personal access token of the classic family. Scopes are discoverable via a header probe. */
    CLASSIC_TOKEN("ghp_"),
    /** Fine-grained personal access token. Permissions are not reported as scopes. */
    FINE_GRAINED_TOKEN("github_pat_"),
    /** Token from an interactive OAuth flow; the client can re-authorize for more scopes. */
    INTERACTIVE_ACCESS_TOKEN("gho_"),
    /** App token acting on behalf of a user. */
    DELEGATED_USER_TOKEN("ghu_"),
    /** App installation token acting as the app itself. */
    DELEGATED_SERVICE_TOKEN("ghs_"),
    UNKNOWN(null);

    private final String prefix;

    CredentialType(String prefix) {
        this.prefix = prefix;
    }

    /** Literal token prefix, or empty for {@link #UNKNOWN}. */
    public Optional<String> prefix() {
        return Optional.ofNullable(prefix);
    }

    /**
     * Whether granted scopes can be read from the upstream {@code X-OAuth-Scopes} header.
     */
    public boolean supportsScopeDiscovery() {
        return this == CLASSIC_TOKEN;
    }

    /**
     * Whether the client can obtain an upgraded credential on demand, which makes an
     * insufficient-scope challenge actionable.
     */
    public boolean supportsScopeChallenge() {
        return this == INTERACTIVE_ACCESS_TOKEN;
    }
}
