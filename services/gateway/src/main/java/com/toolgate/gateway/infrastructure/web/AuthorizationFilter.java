package com.toolgate.gateway.infrastructure.web;

import com.toolgate.gateway.config.GatewayProperties;
import com.toolgate.gateway.domain.discovery.ResourceMetadataUrls;
import com.toolgate.gateway.domain.pipeline.AuthorizationPipeline;
import com.toolgate.gateway.domain.pipeline.DenialResponse;
import com.toolgate.gateway.domain.pipeline.PipelineResult;
import com.toolgate.gateway.domain.pipeline.RequestContext;
import com.toolgate.observability.MetricFactory;
import io.micrometer.core.instrument.Timer;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Runs the {@link AuthorizationPipeline} for every request that reaches an operation endpoint.
 *
 * <p>A denial is written straight to the response and the chain stops. Otherwise the pipeline's
 * {@link RequestContext} is exposed as a request attribute and the chain continues with a request
 * whose body can be read again.
 *
 * <p>The health probe, the discovery document, actuator and the error page bypass the pipeline.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class AuthorizationFilter extends OncePerRequestFilter {

    static final String DECISIONS_METRIC = "toolgate.authz.decisions";
    static final String DURATION_METRIC = "toolgate.authz.duration";

    private final AuthorizationPipeline pipeline;
    private final GatewayProperties properties;
    private final MetricFactory metrics;
    private final Timer duration;

    public AuthorizationFilter(AuthorizationPipeline pipeline, GatewayProperties properties, MetricFactory metrics) {
        this.pipeline = pipeline;
        this.properties = properties;
        this.metrics = metrics;
        this.duration = metrics.timer(DURATION_METRIC, "Time spent in the authorization pipeline");
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        // only reads are exempt; any other method on these paths could reach the operation endpoint
        if (!isRead(request.getMethod())) {
            return false;
        }
        String path = pathWithinApplication(request);
        return path.equals(properties.healthPath())
                || path.startsWith(ResourceMetadataUrls.WELL_KNOWN_PREFIX)
                || path.equals("/actuator") || path.startsWith("/actuator/")
                || path.equals("/error");
    }

    private static boolean isRead(String method) {
        return "GET".equals(method) || "HEAD".equals(method);
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        var cached = new CachedBodyHttpServletRequest(request);
        Timer.Sample sample = Timer.start(metrics.registry());
        PipelineResult result;
        try {
            result = pipeline.evaluate(new ServletInboundRequest(cached, cached.cachedBody()));
        } finally {
            sample.stop(duration);
        }

        if (!result.isForwarded()) {
            metrics.counter(DECISIONS_METRIC, "Authorization pipeline decisions",
                    "outcome", "denied", "stage", result.decidedBy()).increment();
            writeDenial(response, result.denial());
            return;
        }

        metrics.counter(DECISIONS_METRIC, "Authorization pipeline decisions",
                "outcome", "forwarded", "stage", "none").increment();
        cached.setAttribute(RequestContext.ATTRIBUTE, result.context());
        filterChain.doFilter(cached, response);
    }

    private static void writeDenial(HttpServletResponse response, DenialResponse denial) throws IOException {
        response.setStatus(denial.status());
        denial.headers().forEach(response::setHeader);
        response.setContentType(MediaType.TEXT_PLAIN_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getWriter().write(denial.body());
        response.getWriter().flush();
    }

    public static String pathWithinApplication(HttpServletRequest request) {
        String uri = request.getRequestURI();
        if (uri == null || uri.isEmpty()) {
            return "/";
        }
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            uri = uri.substring(contextPath.length());
        }
        return uri.isEmpty() ? "/" : uri;
    }
}
