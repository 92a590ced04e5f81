package com.toolgate.security.scope;

import java.util.OptionalInt;

/**
 * Failure to discover a token's scopes. Always non-fatal for the request pipeline.
 */
public class ScopeFetchException extends RuntimeException {

    public enum Reason {
        /** Upstream answered 401. */
        INVALID_CREDENTIAL,
        /** Upstream answered with any other non-2xx status. */
        UNEXPECTED_UPSTREAM_STATUS,
        /** The probe never produced a response. */
        NETWORK_ERROR
    }

    private final Reason reason;
    private final int statusCode;

    public ScopeFetchException(Reason reason, int statusCode, String message) {
        super(message);
        this.reason = reason;
        this.statusCode = statusCode;
    }

    public ScopeFetchException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.statusCode = -1;
    }

    public Reason reason() {
        return reason;
    }

    /** Upstream status code, when the failure came from a response. */
    public OptionalInt statusCode() {
        return statusCode < 0 ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }
}
