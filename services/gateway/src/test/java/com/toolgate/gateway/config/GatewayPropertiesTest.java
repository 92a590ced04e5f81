package com.toolgate.gateway.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Gateway configuration properties")
class GatewayPropertiesTest {

    @Test
    @DisplayName("gateway properties fall back to defaults")
    void gatewayDefaults() {
        var props = new GatewayProperties(null, null, null, null, null, null);

        assertThat(props.baseUrl()).isEmpty();
        assertThat(props.resourcePath()).isEmpty();
        assertThat(props.authorizationServer()).isEqualTo(GatewayProperties.DEFAULT_AUTHORIZATION_SERVER);
        assertThat(props.resourceName()).isEqualTo("Toolgate");
        assertThat(props.scopeChallenge()).isTrue();
        assertThat(props.healthPath()).isEqualTo("/_ping");
    }

    @Test
    @DisplayName("explicit gateway values are kept")
    void gatewayExplicit() {
        var props = new GatewayProperties("https://tools.example.com", "/mcp", "https://auth.example.com",
                "Tools", false, "/healthz");

        assertThat(props.resourcePath()).isEqualTo("/mcp");
        assertThat(props.scopeChallenge()).isFalse();
        assertThat(props.healthPath()).isEqualTo("/healthz");
    }

    @Test
    @DisplayName("upstream properties fall back to the public API and a 20 minute cache")
    void upstreamDefaults() {
        var props = new UpstreamProperties(null, null, Duration.ZERO, null, " ", null);

        assertThat(props.apiUrl()).isEqualTo(URI.create("https://api.github.com/"));
        assertThat(props.graphqlUrl()).isEqualTo(URI.create("https://api.github.com/graphql"));
        assertThat(props.scopeFetchTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(props.repoAccessTtl()).isEqualTo(Duration.ofMinutes(20));
        assertThat(props.repoAccessCacheName()).isEqualTo("repo-access-cache");
        assertThat(props.lockdownToken()).isEmpty();
    }

    @Test
    @DisplayName("a non-positive access TTL is kept as given")
    void negativeTtlKept() {
        var props = new UpstreamProperties(null, null, null, Duration.ofSeconds(-1), null, null);

        assertThat(props.repoAccessTtl()).isNegative();
    }

    @Test
    @DisplayName("catalogue entries become operation descriptors")
    void catalogueDescriptors() {
        var catalog = new OperationCatalogProperties(List.of(
                new OperationCatalogProperties.Operation("get_me", null),
                new OperationCatalogProperties.Operation("create_gist", List.of("gist"))));

        assertThat(catalog.toDescriptors())
                .extracting(d -> d.name() + "=" + d.requiredScopes())
                .containsExactly("get_me=[]", "create_gist=[gist]");
    }
}
