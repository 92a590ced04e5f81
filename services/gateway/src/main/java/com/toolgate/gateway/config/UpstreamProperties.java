package com.toolgate.gateway.config;

import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Upstream platform endpoints and the caches in front of them, bound from
 * {@code toolgate.upstream.*}.
 *
 * @param apiUrl              REST API root probed for {@code X-OAuth-Scopes}
 * @param graphqlUrl          GraphQL endpoint for repository access facts
 * @param scopeFetchTimeout   bound on each scope probe
 * @param repoAccessTtl       lifetime of cached access facts; zero or negative never expires
 * @param repoAccessCacheName label of the shared access cache
 * @param lockdownToken       service credential the access-fact queries run as; when blank no lookup is
 *                            made and lockdown-mode requests fail with an upstream error
 */
@ConfigurationProperties(prefix = "toolgate.upstream")
@Validated
public record UpstreamProperties(
        @NotNull URI apiUrl,
        @NotNull URI graphqlUrl,
        Duration scopeFetchTimeout,
        Duration repoAccessTtl,
        String repoAccessCacheName,
        String lockdownToken) {

    public UpstreamProperties {
        if (apiUrl == null) {
            apiUrl = URI.create("https://api.github.com/");
        }
        if (graphqlUrl == null) {
            graphqlUrl = URI.create("https://api.github.com/graphql");
        }
        if (scopeFetchTimeout == null || scopeFetchTimeout.isZero() || scopeFetchTimeout.isNegative()) {
            scopeFetchTimeout = Duration.ofSeconds(5);
        }
        if (repoAccessTtl == null) {
            repoAccessTtl = Duration.ofMinutes(20);
        }
        if (repoAccessCacheName == null || repoAccessCacheName.isBlank()) {
            repoAccessCacheName = "repo-access-cache";
        }
        if (lockdownToken == null) {
            lockdownToken = "";
        }
    }
}
