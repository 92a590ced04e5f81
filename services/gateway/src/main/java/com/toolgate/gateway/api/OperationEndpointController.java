package com.toolgate.gateway.api;

import com.toolgate.gateway.domain.dispatch.DispatchResponse;
import com.toolgate.gateway.domain.dispatch.OperationDispatcher;
import com.toolgate.gateway.domain.pipeline.RequestContext;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * JSON-RPC entry point. Only requests the authorization pipeline forwarded reach this controller;
 * a request without the pipeline's context is answered with a server error.
 */
@RestController
public class OperationEndpointController {

    private final OperationDispatcher dispatcher;

    public OperationEndpointController(OperationDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @PostMapping(path = "/**", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Object> handle(
            @RequestBody(required = false) byte[] body,
            @RequestAttribute(name = RequestContext.ATTRIBUTE, required = false) RequestContext context) {
        if (context == null) {
            throw new IllegalStateException("request reached the operation endpoint without an authorization context");
        }
        DispatchResponse response = dispatcher.dispatch(body == null ? new byte[0] : body, context);
        return ResponseEntity.status(response.status()).body(response.body());
    }
}
