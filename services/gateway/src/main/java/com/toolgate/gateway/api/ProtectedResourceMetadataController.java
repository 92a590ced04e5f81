package com.toolgate.gateway.api;

import com.toolgate.gateway.config.GatewayProperties;
import com.toolgate.gateway.domain.discovery.ProtectedResourceMetadata;
import com.toolgate.gateway.domain.discovery.ResourceMetadataUrls;
import com.toolgate.gateway.infrastructure.web.AuthorizationFilter;
import com.toolgate.gateway.infrastructure.web.ServletInboundRequest;
import com.toolgate.security.scope.OperationScopeIndex;
import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Serves the OAuth protected resource metadata that 401 and 403 challenges point at.
 *
 * <p>Answers under the bare prefix and for every route shape below the configured resource path or
 * the {@code /mcp} fallback; anything else is a 404.
 */
@RestController
public class ProtectedResourceMetadataController {

    private final GatewayProperties properties;
    private final ResourceMetadataUrls metadataUrls;
    private final List<String> scopesSupported;

    public ProtectedResourceMetadataController(GatewayProperties properties, ResourceMetadataUrls metadataUrls,
                                               OperationScopeIndex operationScopeIndex) {
        this.properties = properties;
        this.metadataUrls = metadataUrls;
        this.scopesSupported = operationScopeIndex.allRequiredScopes();
    }

    @GetMapping({ResourceMetadataUrls.WELL_KNOWN_PREFIX, ResourceMetadataUrls.WELL_KNOWN_PREFIX + "/**"})
    public ResponseEntity<ProtectedResourceMetadata> metadata(HttpServletRequest request) {
        String suffix = AuthorizationFilter.pathWithinApplication(request)
                .substring(ResourceMetadataUrls.WELL_KNOWN_PREFIX.length());
        if (!metadataUrls.isDiscoveryRoute(suffix)) {
            return ResponseEntity.notFound().build();
        }

        var inbound = ServletInboundRequest.withoutBody(request);
        String resource = metadataUrls.resourceUrl(inbound, metadataUrls.resolveResourcePath(suffix));
        return ResponseEntity.ok(new ProtectedResourceMetadata(
                resource,
                List.of(properties.authorizationServer()),
                properties.resourceName(),
                scopesSupported,
                ProtectedResourceMetadata.HEADER_ONLY));
    }
}
