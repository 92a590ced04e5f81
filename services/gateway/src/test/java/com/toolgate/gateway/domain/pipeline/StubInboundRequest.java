package com.toolgate.gateway.domain.pipeline;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builder-style {@link InboundRequest} for stage and pipeline tests.
 */
public final class StubInboundRequest implements InboundRequest {

    private String method = "POST";
    private String path = "/";
    private final Map<String, String> headers = new TreeMap<>();
    private byte[] body = new byte[0];
    private boolean secure;

    public static StubInboundRequest post(String path) {
        return new StubInboundRequest().path(path);
    }

    public StubInboundRequest method(String method) {
        this.method = method;
        return this;
    }

    public StubInboundRequest path(String path) {
        this.path = path;
        return this;
    }

    public StubInboundRequest header(String name, String value) {
        headers.put(name.toLowerCase(Locale.ROOT), value);
        return this;
    }

    public StubInboundRequest bearer(String token) {
        return header("Authorization", "Bearer " + token);
    }

    public StubInboundRequest body(String json) {
        this.body = json.getBytes(StandardCharsets.UTF_8);
        return this;
    }

    public StubInboundRequest toolCall(String operation) {
        return body("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/call\",\"params\":{\"name\":\""
                + operation + "\",\"arguments\":{}}}");
    }

    public StubInboundRequest secure(boolean secure) {
        this.secure = secure;
        return this;
    }

    @Override
    public String method() {
        return method;
    }

    @Override
    public String path() {
        return path;
    }

    @Override
    public String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }

    @Override
    public byte[] body() {
        return body;
    }

    @Override
    public boolean secure() {
        return secure;
    }
}
