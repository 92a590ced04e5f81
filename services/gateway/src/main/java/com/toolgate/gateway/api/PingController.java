package com.toolgate.gateway.api;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Unauthenticated liveness probe for load balancers.
 */
@RestController
public class PingController {

    @GetMapping(path = "${toolgate.gateway.health-path:/_ping}", produces = MediaType.TEXT_PLAIN_VALUE)
    public String ping() {
        return "pong";
    }
}
