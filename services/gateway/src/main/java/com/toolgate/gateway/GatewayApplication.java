package com.toolgate.gateway;

import com.toolgate.gateway.config.GatewayProperties;
import com.toolgate.gateway.config.OperationCatalogProperties;
import com.toolgate.gateway.config.UpstreamProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Toolgate gateway: runs the authorization pipeline in front of the operation dispatcher.
 *
 * <p>Request flow:
 *
 * <ol>
 *   <li>{@code CorrelationIdFilter} establishes the correlation context
 *   <li>{@code AuthorizationFilter} runs the ordered stages and either answers with a denial or
 *       forwards
 *   <li>{@code OperationEndpointController} hands surviving requests to the dispatcher
 * </ol>
 *
 * <p>The discovery document, {@code /_ping} and actuator endpoints bypass the pipeline.
 */
@SpringBootApplication
@EnableConfigurationProperties({
        GatewayProperties.class,
        UpstreamProperties.class,
        OperationCatalogProperties.class
})
public class GatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(GatewayApplication.class, args);
    }
}
