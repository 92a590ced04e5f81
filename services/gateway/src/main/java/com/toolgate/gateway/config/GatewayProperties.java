package com.toolgate.gateway.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externally visible shape of the gateway, bound from {@code toolgate.gateway.*}.
 *
 * <pre>
 * toolgate:
 *   gateway:
 *     base-url: https://tools.example.com
 *     resource-path: /mcp
 *     authorization-server: https://github.com/login/oauth
 * </pre>
 *
 * @param baseUrl             public URL of the gateway; when blank, host and scheme come from the request
 * @param resourcePath        externally visible base path, restored when a proxy strips it
 * @param authorizationServer OAuth authorization server advertised by the discovery document
 * @param resourceName        human-readable resource name for the discovery document
 * @param scopeChallenge      whether insufficient-scope challenges are issued (stage 5)
 * @param healthPath          unauthenticated liveness path
 */
@ConfigurationProperties(prefix = "toolgate.gateway")
@Validated
public record GatewayProperties(
        String baseUrl,
        String resourcePath,
        @NotBlank String authorizationServer,
        @NotBlank String resourceName,
        Boolean scopeChallenge,
        @NotBlank String healthPath) {

    public static final String DEFAULT_AUTHORIZATION_SERVER = "https://github.com/login/oauth";
    public static final String DEFAULT_HEALTH_PATH = "/_ping";

    /**
     * Applies defaults before Bean Validation runs.
     */
    public GatewayProperties {
        if (baseUrl == null) {
            baseUrl = "";
        }
        if (resourcePath == null) {
            resourcePath = "";
        }
        if (authorizationServer == null || authorizationServer.isBlank()) {
            authorizationServer = DEFAULT_AUTHORIZATION_SERVER;
        }
        if (resourceName == null || resourceName.isBlank()) {
            resourceName = "Toolgate";
        }
        if (scopeChallenge == null) {
            scopeChallenge = Boolean.TRUE;
        }
        if (healthPath == null || healthPath.isBlank()) {
            healthPath = DEFAULT_HEALTH_PATH;
        }
    }
}
