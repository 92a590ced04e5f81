package com.toolgate.gateway.domain.pipeline;

/**
 * Transport-neutral view of an inbound request, as seen by the pipeline stages.
 */
public interface InboundRequest {

    /** HTTP verb, upper case. */
    String method();

    /** Request path as received, without query string. */
    String path();

    /** First value of the named header, or null. Names are case-insensitive. */
    String header(String name);

    /** Raw body; empty array when there is none. Repeated calls return the same bytes. */
    byte[] body();

    /** Whether the request arrived over TLS. */
    boolean secure();
}
