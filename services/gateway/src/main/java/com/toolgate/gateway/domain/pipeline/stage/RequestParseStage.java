package com.toolgate.gateway.domain.pipeline.stage;

import com.toolgate.gateway.domain.pipeline.AuthorizationStage;
import com.toolgate.gateway.domain.pipeline.InboundRequest;
import com.toolgate.gateway.domain.pipeline.RequestContext;
import com.toolgate.gateway.domain.pipeline.StageOutcome;
import com.toolgate.gateway.domain.request.ParsedRequest;
import com.toolgate.gateway.domain.request.RequestParser;
import com.toolgate.observability.CorrelationContextHolder;
import java.util.Optional;

/**
 * Stage 3: parses the JSON-RPC envelope once and attaches it. Never terminates; a body that does
 * not parse leaves nothing attached.
 */
public class RequestParseStage implements AuthorizationStage {

    private final RequestParser parser;

    public RequestParseStage(RequestParser parser) {
        this.parser = parser;
    }

    @Override
    public String name() {
        return "parse";
    }

    @Override
    public StageOutcome process(InboundRequest request, RequestContext context) {
        Optional<ParsedRequest> parsed = parser.parse(request.method(), request.body());
        parsed.ifPresent(p -> {
            context.attachParsedRequest(p);
            CorrelationContextHolder.updateOperation(p.operationLabel());
        });
        return StageOutcome.forward();
    }
}
