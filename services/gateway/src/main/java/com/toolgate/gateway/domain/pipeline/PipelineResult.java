package com.toolgate.gateway.domain.pipeline;

import java.util.Optional;

/**
 * Result of running the whole pipeline.
 *
 * @param context      everything the stages attached
 * @param denial       the terminating response, null when the request was forwarded
 * @param decidedBy    name of the stage that terminated, null when forwarded
 */
public record PipelineResult(RequestContext context, DenialResponse denial, String decidedBy) {

    public static PipelineResult forwarded(RequestContext context) {
        return new PipelineResult(context, null, null);
    }

    public static PipelineResult denied(RequestContext context, DenialResponse denial, String stage) {
        return new PipelineResult(context, denial, stage);
    }

    public boolean isForwarded() {
        return denial == null;
    }

    public Optional<DenialResponse> denialResponse() {
        return Optional.ofNullable(denial);
    }
}
