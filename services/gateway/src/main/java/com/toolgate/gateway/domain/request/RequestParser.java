package com.toolgate.gateway.domain.request;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-pass extraction of the JSON-RPC method, item name and arguments.
 *
 * <p>Parsing is an optimization, never a gate: anything that is not a POST with a JSON-RPC 2.0
 * object body yields {@link Optional#empty()} rather than an error. The body is passed in as
 * bytes and never consumed, so later readers see the same payload.
 */
public class RequestParser {

    private static final Logger log = LoggerFactory.getLogger(RequestParser.class);

    static final String JSONRPC_VERSION = "2.0";
    private static final TypeReference<LinkedHashMap<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public RequestParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param httpMethod the transport verb
     * @param body       the raw request body, may be null or empty
     * @return the parse result, or empty when the request is not a JSON-RPC 2.0 call
     */
    public Optional<ParsedRequest> parse(String httpMethod, byte[] body) {
        if (!"POST".equalsIgnoreCase(httpMethod) || body == null || body.length == 0) {
            return Optional.empty();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            log.debug("Request body is not JSON: {}", e.getMessage());
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }

        JsonNode version = root.get("jsonrpc");
        JsonNode method = root.get("method");
        if (version == null || !version.isTextual() || !JSONRPC_VERSION.equals(version.asText())
                || method == null || !method.isTextual() || method.asText().isEmpty()) {
            return Optional.empty();
        }

        JsonNode params = root.path("params");
        return Optional.of(switch (method.asText()) {
            case ParsedRequest.TOOLS_CALL -> toolCall(params);
            case ParsedRequest.PROMPTS_GET -> new ParsedRequest(ParsedRequest.PROMPTS_GET,
                    textOrNull(params.get("name")), null, null, null);
            case ParsedRequest.RESOURCES_READ -> new ParsedRequest(ParsedRequest.RESOURCES_READ,
                    textOrNull(params.get("uri")), null, null, null);
            default -> ParsedRequest.of(method.asText());
        });
    }

    private ParsedRequest toolCall(JsonNode params) {
        String name = textOrNull(params.get("name"));
        JsonNode argumentsNode = params.get("arguments");
        if (argumentsNode == null || !argumentsNode.isObject()) {
            return new ParsedRequest(ParsedRequest.TOOLS_CALL, name, null, null, null);
        }

        Map<String, Object> arguments;
        try {
            arguments = objectMapper.convertValue(argumentsNode, ARGUMENTS_TYPE);
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring undecodable tool arguments: {}", e.getMessage());
            return new ParsedRequest(ParsedRequest.TOOLS_CALL, name, null, null, null);
        }

        return new ParsedRequest(ParsedRequest.TOOLS_CALL, name, arguments,
                textOrNull(argumentsNode.get("owner")), textOrNull(argumentsNode.get("repo")));
    }

    private static String textOrNull(JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : null;
    }
}
