package com.toolgate.gateway.domain.pipeline.stage;

import com.toolgate.gateway.domain.discovery.ResourceMetadataUrls;
import com.toolgate.gateway.domain.pipeline.AuthorizationStage;
import com.toolgate.gateway.domain.pipeline.DenialResponse;
import com.toolgate.gateway.domain.pipeline.InboundRequest;
import com.toolgate.gateway.domain.pipeline.RequestContext;
import com.toolgate.gateway.domain.pipeline.StageOutcome;
import com.toolgate.gateway.domain.request.ParsedRequest;
import com.toolgate.gateway.domain.request.RequestParser;
import com.toolgate.security.Credential;
import com.toolgate.security.scope.OperationScopeIndex;
import com.toolgate.security.scope.OperationScopeInfo;
import com.toolgate.security.scope.ScopeFetchException;
import com.toolgate.security.scope.ScopeFetcher;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stage 5: answers an operation call the actor lacks scopes for with a 403 challenge naming the
 * scopes to request.
 *
 * <p>Only interactive access tokens are challenged, and only for {@code tools/call}. Everything
 * else, unknown operations included, is forwarded. If the actor's scopes cannot be determined the
 * request is forwarded too; the upstream call decides.
 */
public class ScopeChallengeStage implements AuthorizationStage {

    private static final Logger log = LoggerFactory.getLogger(ScopeChallengeStage.class);

    private final ScopeFetcher scopeFetcher;
    private final OperationScopeIndex scopeIndex;
    private final ResourceMetadataUrls metadataUrls;
    private final RequestParser parser;

    public ScopeChallengeStage(ScopeFetcher scopeFetcher, OperationScopeIndex scopeIndex,
                               ResourceMetadataUrls metadataUrls, RequestParser parser) {
        this.scopeFetcher = scopeFetcher;
        this.scopeIndex = scopeIndex;
        this.metadataUrls = metadataUrls;
        this.parser = parser;
    }

    @Override
    public String name() {
        return "scope-challenge";
    }

    @Override
    public StageOutcome process(InboundRequest request, RequestContext context) {
        Credential credential = context.credential();
        if (credential == null || !credential.type().supportsScopeChallenge()) {
            return StageOutcome.forward();
        }

        Optional<ParsedRequest> parsed = context.parsedRequest();
        if (parsed.isEmpty()) {
            parsed = parser.parse(request.method(), request.body());
        }
        if (parsed.isEmpty() || !parsed.get().isToolCall() || parsed.get().itemName() == null) {
            return StageOutcome.forward();
        }

        String operation = parsed.get().itemName();
        Optional<OperationScopeInfo> info = scopeIndex.lookup(operation);
        if (info.isEmpty() || info.get().isEmpty()) {
            return StageOutcome.forward();
        }

        if (!credential.scopesFetched()) {
            try {
                credential.attachScopes(scopeFetcher.fetchScopes(credential.token()));
            } catch (ScopeFetchException e) {
                log.warn("Cannot check scopes for {} on {}: {}", credential, operation, e.getMessage());
                return StageOutcome.forward();
            }
        }

        Set<String> actorScopes = credential.scopes();
        if (OperationScopeIndex.hasAcceptedScope(info.get(), actorScopes)) {
            return StageOutcome.forward();
        }

        List<String> missing = OperationScopeIndex.missingScopes(info.get(), actorScopes);
        Set<String> recommended = new LinkedHashSet<>(actorScopes);
        recommended.addAll(missing);
        String metadataUrl = metadataUrls.metadataUrl(request, metadataUrls.resolveResourcePath(request.path()));
        log.info("Challenging {} for {}: missing {}", credential.type(), operation, missing);
        return StageOutcome.terminate(DenialResponse.insufficientScope(recommended, metadataUrl, missing));
    }
}
