package com.toolgate.gateway.domain.dispatch;

import com.toolgate.gateway.domain.pipeline.RequestContext;

/**
 * Receives requests that passed the authorization pipeline.
 */
public interface OperationDispatcher {

    /**
     * @param body    the request body, unconsumed by the pipeline
     * @param context what the pipeline attached: credential, request config, parse result
     * @return the JSON-RPC response document
     */
    DispatchResponse dispatch(byte[] body, RequestContext context);
}
