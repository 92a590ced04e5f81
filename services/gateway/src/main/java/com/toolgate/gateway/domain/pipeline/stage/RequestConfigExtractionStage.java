package com.toolgate.gateway.domain.pipeline.stage;

import com.toolgate.gateway.domain.discovery.ResourceMetadataUrls;
import com.toolgate.gateway.domain.pipeline.AuthorizationStage;
import com.toolgate.gateway.domain.pipeline.InboundRequest;
import com.toolgate.gateway.domain.pipeline.RequestContext;
import com.toolgate.gateway.domain.pipeline.StageOutcome;
import com.toolgate.gateway.domain.request.RequestConfig;
import com.toolgate.gateway.domain.request.RequestConfigHeaders;
import com.toolgate.gateway.domain.request.RouteDirectives;

/**
 * Stage 2: reads the {@code X-MCP-*} headers and the route directives into a {@link RequestConfig}.
 * Never terminates.
 */
public class RequestConfigExtractionStage implements AuthorizationStage {

    private final ResourceMetadataUrls metadataUrls;

    public RequestConfigExtractionStage(ResourceMetadataUrls metadataUrls) {
        this.metadataUrls = metadataUrls;
    }

    @Override
    public String name() {
        return "request-config";
    }

    @Override
    public StageOutcome process(InboundRequest request, RequestContext context) {
        RequestConfig config = RequestConfigHeaders.read(request);
        RouteDirectives route = RouteDirectives.parse(relativePath(request.path())).orElse(RouteDirectives.none());
        context.attachRequestConfig(config.overriddenBy(route));
        return StageOutcome.forward();
    }

    private String relativePath(String path) {
        String base = metadataUrls.resourcePath();
        if (path == null || base.isEmpty()) {
            return path;
        }
        if (path.equals(base)) {
            return "/";
        }
        return path.startsWith(base + "/") ? path.substring(base.length()) : path;
    }
}
