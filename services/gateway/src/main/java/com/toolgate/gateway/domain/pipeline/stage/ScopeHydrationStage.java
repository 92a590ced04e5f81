package com.toolgate.gateway.domain.pipeline.stage;

import com.toolgate.gateway.domain.pipeline.AuthorizationStage;
import com.toolgate.gateway.domain.pipeline.InboundRequest;
import com.toolgate.gateway.domain.pipeline.RequestContext;
import com.toolgate.gateway.domain.pipeline.StageOutcome;
import com.toolgate.security.Credential;
import com.toolgate.security.scope.ScopeFetchException;
import com.toolgate.security.scope.ScopeFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stage 4: fetches scopes for credential types that expose them. Never terminates; a failed fetch
 * leaves the credential unhydrated.
 */
public class ScopeHydrationStage implements AuthorizationStage {

    private static final Logger log = LoggerFactory.getLogger(ScopeHydrationStage.class);

    private final ScopeFetcher scopeFetcher;

    public ScopeHydrationStage(ScopeFetcher scopeFetcher) {
        this.scopeFetcher = scopeFetcher;
    }

    @Override
    public String name() {
        return "scope-hydration";
    }

    @Override
    public StageOutcome process(InboundRequest request, RequestContext context) {
        Credential credential = context.credential();
        if (credential == null || credential.scopesFetched() || !credential.type().supportsScopeDiscovery()) {
            return StageOutcome.forward();
        }
        try {
            credential.attachScopes(scopeFetcher.fetchScopes(credential.token()));
            log.debug("Hydrated {}", credential);
        } catch (ScopeFetchException e) {
            log.warn("Scope fetch failed for {}: {} {}", credential, e.reason(), e.getMessage());
        }
        return StageOutcome.forward();
    }
}
