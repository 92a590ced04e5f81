package com.toolgate.observability;

/**
 * Immutable correlation context for one inbound gateway request.
 * <p>
 * The context is established by the web layer as soon as a request arrives and is bridged into
 * SLF4J MDC so every log line written while the authorization pipeline runs carries the same
 * identifiers. The operation is unknown until the request body has been parsed, so it starts out
 * {@code null} and is filled in with {@link #withOperation(String)}.
 *
 * @param correlationId identifier propagated from (or returned to) the client via {@code X-Correlation-ID}
 * @param requestId     identifier for this specific HTTP exchange
 * @param operation     JSON-RPC method and item name (e.g. {@code tools/call:get_file_contents}), nullable
 */
public record CorrelationContext(
        String correlationId,
        String requestId,
        String operation
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    /** MDC key for the parsed operation. */
    public static final String MDC_OPERATION = "operation";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Returns a copy of this context carrying the given operation.
     */
    public CorrelationContext withOperation(String operation) {
        return new CorrelationContext(correlationId, requestId, operation);
    }
}
