package com.toolgate.gateway.domain.dispatch;

/**
 * @param status HTTP status to answer with
 * @param body   JSON document
 */
public record DispatchResponse(int status, Object body) {

    public static DispatchResponse ok(Object body) {
        return new DispatchResponse(200, body);
    }
}
