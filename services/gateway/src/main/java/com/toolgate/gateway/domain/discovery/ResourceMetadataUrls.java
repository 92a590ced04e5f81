package com.toolgate.gateway.domain.discovery;

import com.toolgate.gateway.domain.pipeline.InboundRequest;
import com.toolgate.gateway.domain.request.RouteDirectives;
import java.util.List;
import java.util.Locale;

/**
 * Builds the externally visible resource URL and the discovery document URL for a request.
 *
 * <p>Proxies may strip the configured resource path before forwarding, so paths are resolved
 * back to the external form first. Host and scheme come from {@code X-Forwarded-Host} and
 * {@code X-Forwarded-Proto} when present; a configured base URL overrides both.
 */
public class ResourceMetadataUrls {

    public static final String WELL_KNOWN_PREFIX = "/.well-known/oauth-protected-resource";
    public static final String FALLBACK_RESOURCE_PATH = "/mcp";
    public static final String FORWARDED_HOST = "X-Forwarded-Host";
    public static final String FORWARDED_PROTO = "X-Forwarded-Proto";

    private final String baseUrl;
    private final String resourcePath;

    /**
     * @param baseUrl      public URL of the gateway, blank to derive it per request
     * @param resourcePath configured external base path, blank for none
     */
    public ResourceMetadataUrls(String baseUrl, String resourcePath) {
        this.baseUrl = baseUrl == null ? "" : baseUrl.strip();
        this.resourcePath = normalizeBasePath(resourcePath);
    }

    /** Normalized configured base path ({@code /mcp} form), or empty. */
    public String resourcePath() {
        return resourcePath;
    }

    /**
     * Restores the configured base path on a request path that a proxy may have stripped.
     */
    public String resolveResourcePath(String path) {
        String candidate = path == null || path.isEmpty() ? "/" : path;
        if (resourcePath.isEmpty()) {
            return candidate;
        }
        if (candidate.equals("/")) {
            return resourcePath;
        }
        if (candidate.equals(resourcePath) || candidate.startsWith(resourcePath + "/")) {
            return candidate;
        }
        return resourcePath + candidate;
    }

    /**
     * URL of the discovery document describing {@code resolvedPath}.
     */
    public String metadataUrl(InboundRequest request, String resolvedPath) {
        String suffix = "";
        if (resolvedPath != null && !resolvedPath.isEmpty() && !resolvedPath.equals("/")) {
            suffix = resolvedPath.startsWith("/") ? resolvedPath : "/" + resolvedPath;
        }
        return origin(request) + WELL_KNOWN_PREFIX + suffix;
    }

    /**
     * Canonical URL of the protected resource at {@code resolvedPath}.
     */
    public String resourceUrl(InboundRequest request, String resolvedPath) {
        String path = resolvedPath == null || resolvedPath.isEmpty() ? "/" : resolvedPath;
        if (!path.startsWith("/")) {
            path = "/" + path;
        }
        return origin(request) + path;
    }

    /**
     * Whether {@code suffix} (the path after {@link #WELL_KNOWN_PREFIX}) names a served route:
     * a route shape under no base path, the configured base path or the {@code /mcp} fallback.
     */
    public boolean isDiscoveryRoute(String suffix) {
        String path = suffix == null ? "" : suffix;
        for (String base : List.of(resourcePath, FALLBACK_RESOURCE_PATH)) {
            if (!base.isEmpty() && (path.equals(base) || path.startsWith(base + "/"))) {
                return RouteDirectives.parse(path.substring(base.length())).isPresent();
            }
        }
        return RouteDirectives.parse(path).isPresent();
    }

    public String effectiveHost(InboundRequest request) {
        String forwarded = request.header(FORWARDED_HOST);
        if (forwarded != null && !forwarded.isEmpty()) {
            return forwarded;
        }
        String host = request.header("Host");
        return host == null || host.isEmpty() ? "localhost" : host;
    }

    public String effectiveScheme(InboundRequest request) {
        String forwarded = request.header(FORWARDED_PROTO);
        if (forwarded != null && !forwarded.isEmpty()) {
            return forwarded.toLowerCase(Locale.ROOT);
        }
        return request.secure() ? "https" : "http";
    }

    private String origin(InboundRequest request) {
        if (!baseUrl.isEmpty()) {
            return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        }
        return effectiveScheme(request) + "://" + effectiveHost(request);
    }

    static String normalizeBasePath(String path) {
        String trimmed = path == null ? "" : path.strip();
        if (trimmed.isEmpty() || trimmed.equals("/")) {
            return "";
        }
        if (!trimmed.startsWith("/")) {
            trimmed = "/" + trimmed;
        }
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
