package com.toolgate.gateway.domain.discovery;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * OAuth protected resource metadata document.
 */
public record ProtectedResourceMetadata(
        @JsonProperty("resource") String resource,
        @JsonProperty("authorization_servers") List<String> authorizationServers,
        @JsonProperty("resource_name") String resourceName,
        @JsonProperty("scopes_supported") List<String> scopesSupported,
        @JsonProperty("bearer_methods_supported") List<String> bearerMethodsSupported) {

    public static final List<String> HEADER_ONLY = List.of("header");
}
