package com.toolgate.gateway.domain.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.toolgate.gateway.domain.pipeline.RequestContext;
import com.toolgate.gateway.domain.request.ParsedRequest;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default dispatcher for a gateway with no operation handlers registered: every call gets a
 * JSON-RPC error. The body is read here on its own; the pipeline's parse result is only used for
 * logging.
 */
public class MethodNotFoundDispatcher implements OperationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(MethodNotFoundDispatcher.class);

    public static final int PARSE_ERROR = -32700;
    public static final int METHOD_NOT_FOUND = -32601;

    private final ObjectMapper objectMapper;

    public MethodNotFoundDispatcher(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public DispatchResponse dispatch(byte[] body, RequestContext context) {
        JsonNode root;
        try {
            root = body == null || body.length == 0 ? null : objectMapper.readTree(body);
        } catch (IOException e) {
            return DispatchResponse.ok(error(NullNode.getInstance(), PARSE_ERROR, "Parse error"));
        }
        if (root == null || !root.isObject()) {
            return DispatchResponse.ok(error(NullNode.getInstance(), PARSE_ERROR, "Parse error"));
        }

        JsonNode id = root.has("id") ? root.get("id") : NullNode.getInstance();
        String method = root.path("method").asText("");
        log.debug("No handler for {}", context.parsedRequest().map(ParsedRequest::operationLabel).orElse(method));
        return DispatchResponse.ok(error(id, METHOD_NOT_FOUND, "Method not found: " + method));
    }

    private ObjectNode error(JsonNode id, int code, String message) {
        ObjectNode response = objectMapper.createObjectNode();
        response.put("jsonrpc", "2.0");
        response.set("id", id);
        ObjectNode error = response.putObject("error");
        error.put("code", code);
        error.put("message", message);
        return response;
    }
}
