package com.toolgate.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.toolgate.gateway.domain.discovery.ResourceMetadataUrls;
import com.toolgate.gateway.domain.dispatch.MethodNotFoundDispatcher;
import com.toolgate.gateway.domain.dispatch.OperationDispatcher;
import com.toolgate.gateway.domain.lockdown.LockdownContentPolicy;
import com.toolgate.gateway.domain.pipeline.AuthorizationPipeline;
import com.toolgate.gateway.domain.pipeline.AuthorizationStage;
import com.toolgate.gateway.domain.pipeline.stage.CredentialExtractionStage;
import com.toolgate.gateway.domain.pipeline.stage.RequestConfigExtractionStage;
import com.toolgate.gateway.domain.pipeline.stage.RequestParseStage;
import com.toolgate.gateway.domain.pipeline.stage.ScopeChallengeStage;
import com.toolgate.gateway.domain.pipeline.stage.ScopeHydrationStage;
import com.toolgate.gateway.domain.request.RequestParser;
import com.toolgate.lockdown.AccessLockdownCache;
import com.toolgate.lockdown.GitHubRepoAccessClient;
import com.toolgate.lockdown.LockdownOptions;
import com.toolgate.lockdown.RepoAccessQuery;
import com.toolgate.lockdown.RepoAccessQueryException;
import com.toolgate.observability.MetricFactory;
import com.toolgate.security.scope.HttpScopeFetcher;
import com.toolgate.security.scope.OperationScopeIndex;
import com.toolgate.security.scope.ScopeFetcher;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Assembles the authorization pipeline and its collaborators.
 *
 * <p>Stage order is fixed here: credential, request config, parse, scope hydration and, when
 * {@code toolgate.gateway.scope-challenge} is on, the scope challenge.
 */
@Configuration
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    public static final String SERVICE_NAME = "toolgate-gateway";

    @Bean
    public HttpClient upstreamHttpClient(UpstreamProperties upstream) {
        return HttpClient.newBuilder()
                .connectTimeout(upstream.scopeFetchTimeout())
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    @Bean
    public ScopeFetcher scopeFetcher(HttpClient upstreamHttpClient, UpstreamProperties upstream) {
        return new HttpScopeFetcher(upstreamHttpClient, upstream.apiUrl(), upstream.scopeFetchTimeout());
    }

    @Bean
    public OperationScopeIndex operationScopeIndex(OperationCatalogProperties catalog) {
        return OperationScopeIndex.build(catalog.toDescriptors());
    }

    @Bean
    public AccessLockdownCache accessLockdownCache(HttpClient upstreamHttpClient, ObjectMapper objectMapper,
                                                   UpstreamProperties upstream) {
        var query = repoAccessQuery(upstreamHttpClient, objectMapper, upstream);
        var options = LockdownOptions.defaults()
                .withTtl(upstream.repoAccessTtl())
                .withCacheName(upstream.repoAccessCacheName());
        return AccessLockdownCache.getInstance(query, options);
    }

    /**
     * The upstream access-fact lookup. Without a lockdown token every lookup fails without
     * contacting upstream, so lockdown-mode requests are refused rather than filtered as anonymous.
     */
    static RepoAccessQuery repoAccessQuery(HttpClient httpClient, ObjectMapper objectMapper,
                                           UpstreamProperties upstream) {
        if (upstream.lockdownToken().isBlank()) {
            log.warn("toolgate.upstream.lockdown-token is not set; lockdown-mode requests will fail");
            return (actor, owner, repo) -> {
                throw new RepoAccessQueryException(owner + "/" + repo, "lockdown lookups are disabled");
            };
        }
        return new GitHubRepoAccessClient(httpClient, objectMapper, upstream.graphqlUrl(),
                upstream.lockdownToken(), Duration.ofSeconds(10));
    }

    @Bean
    public LockdownContentPolicy lockdownContentPolicy(AccessLockdownCache accessLockdownCache) {
        return new LockdownContentPolicy(accessLockdownCache);
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry meterRegistry) {
        return new MetricFactory(meterRegistry, SERVICE_NAME);
    }

    @Bean
    public ResourceMetadataUrls resourceMetadataUrls(GatewayProperties gateway) {
        return new ResourceMetadataUrls(gateway.baseUrl(), gateway.resourcePath());
    }

    @Bean
    public RequestParser requestParser(ObjectMapper objectMapper) {
        return new RequestParser(objectMapper);
    }

    @Bean
    public AuthorizationPipeline authorizationPipeline(GatewayProperties gateway,
                                                       ResourceMetadataUrls metadataUrls,
                                                       RequestParser requestParser,
                                                       ScopeFetcher scopeFetcher,
                                                       OperationScopeIndex operationScopeIndex) {
        List<AuthorizationStage> stages = new ArrayList<>();
        stages.add(new CredentialExtractionStage(metadataUrls));
        stages.add(new RequestConfigExtractionStage(metadataUrls));
        stages.add(new RequestParseStage(requestParser));
        stages.add(new ScopeHydrationStage(scopeFetcher));
        if (gateway.scopeChallenge()) {
            stages.add(new ScopeChallengeStage(scopeFetcher, operationScopeIndex, metadataUrls, requestParser));
        }
        return new AuthorizationPipeline(stages);
    }

    @Bean
    public OperationDispatcher operationDispatcher(ObjectMapper objectMapper) {
        return new MethodNotFoundDispatcher(objectMapper);
    }
}
