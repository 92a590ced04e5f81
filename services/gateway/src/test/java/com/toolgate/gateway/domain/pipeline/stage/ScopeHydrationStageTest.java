package com.toolgate.gateway.domain.pipeline.stage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.toolgate.gateway.domain.pipeline.RequestContext;
import com.toolgate.gateway.domain.pipeline.StubInboundRequest;
import com.toolgate.security.Credential;
import com.toolgate.security.CredentialType;
import com.toolgate.security.scope.ScopeFetchException;
import com.toolgate.security.scope.ScopeFetcher;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ScopeHydrationStage")
class ScopeHydrationStageTest {

    private final ScopeFetcher fetcher = mock(ScopeFetcher.class);
    private final ScopeHydrationStage stage = new ScopeHydrationStage(fetcher);

    private RequestContext contextWith(CredentialType type) {
        var context = new RequestContext();
        context.attachCredential(new Credential("token-value-1234", type));
        return context;
    }

    @Test
    @DisplayName("hydrates classic tokens")
    void hydratesClassicTokens() {
        when(fetcher.fetchScopes("token-value-1234")).thenReturn(List.of("repo", "gist"));
        var context = contextWith(CredentialType.CLASSIC_TOKEN);

        assertThat(stage.process(StubInboundRequest.post("/"), context).forwarded()).isTrue();
        assertThat(context.credential().scopesFetched()).isTrue();
        assertThat(context.credential().scopes()).containsExactly("repo", "gist");
    }

    @Test
    @DisplayName("leaves other credential types alone")
    void skipsOtherTypes() {
        var context = contextWith(CredentialType.FINE_GRAINED_TOKEN);

        stage.process(StubInboundRequest.post("/"), context);

        verify(fetcher, never()).fetchScopes(anyString());
        assertThat(context.credential().scopesFetched()).isFalse();
    }

    @Test
    @DisplayName("forwards without scopes when the fetch fails")
    void fetchFailureIsAbsorbed() {
        when(fetcher.fetchScopes(anyString())).thenThrow(
                new ScopeFetchException(ScopeFetchException.Reason.INVALID_CREDENTIAL, 401, "invalid"));
        var context = contextWith(CredentialType.CLASSIC_TOKEN);

        assertThat(stage.process(StubInboundRequest.post("/"), context).forwarded()).isTrue();
        assertThat(context.credential().scopesFetched()).isFalse();
        assertThat(context.credential().scopes()).isEmpty();
    }
}
