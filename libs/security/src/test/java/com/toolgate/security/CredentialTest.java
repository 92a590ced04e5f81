package com.toolgate.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Credential")
class CredentialTest {

    @Test
    @DisplayName("marks the credential hydrated even when no scopes were reported")
    void emptyScopesStillCountAsFetched() {
        Credential credential = new Credential("github_pat_abc", CredentialType.FINE_GRAINED_TOKEN);

        credential.attachScopes(List.of());

        assertThat(credential.scopesFetched()).isTrue();
        assertThat(credential.scopes()).isEmpty();
    }

    @Test
    @DisplayName("keeps upstream scope order and ignores later changes to the source list")
    void copiesScopes() {
        Credential credential = new Credential("ghp_abc", CredentialType.CLASSIC_TOKEN);
        List<String> source = new ArrayList<>(List.of("repo", "gist", "read:org"));

        credential.attachScopes(source);
        source.add("admin:org");

        assertThat(credential.scopes()).containsExactly("repo", "gist", "read:org");
        assertThatThrownBy(() -> credential.scopes().add("user"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("only the classic family supports header-based scope discovery")
    void scopeDiscoverySupport() {
        assertThat(CredentialType.CLASSIC_TOKEN.supportsScopeDiscovery()).isTrue();
        assertThat(CredentialType.INTERACTIVE_ACCESS_TOKEN.supportsScopeDiscovery()).isFalse();
        assertThat(CredentialType.INTERACTIVE_ACCESS_TOKEN.supportsScopeChallenge()).isTrue();
        assertThat(CredentialType.CLASSIC_TOKEN.supportsScopeChallenge()).isFalse();
        assertThat(CredentialType.UNKNOWN.prefix()).isEmpty();
    }
}
