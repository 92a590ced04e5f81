package com.toolgate.gateway.domain.pipeline;

/**
 * One step of the {@link AuthorizationPipeline}.
 *
 * <p>Stages handle their own expected failures and express them as an outcome; they do not throw
 * for them.
 */
public interface AuthorizationStage {

    /** Short name for logs and metrics. */
    String name();

    /**
     * @param request the inbound request
     * @param context results attached by earlier stages; this stage may attach its own
     */
    StageOutcome process(InboundRequest request, RequestContext context);
}
