package com.toolgate.gateway.domain.pipeline;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered chain of {@link AuthorizationStage}s, composed once at startup.
 *
 * <p>Stages run strictly in list order; the first one to terminate decides the response and no
 * later stage runs.
 */
public class AuthorizationPipeline {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationPipeline.class);

    private final List<AuthorizationStage> stages;

    public AuthorizationPipeline(List<AuthorizationStage> stages) {
        if (stages == null || stages.isEmpty()) {
            throw new IllegalArgumentException("stages must not be empty");
        }
        this.stages = List.copyOf(stages);
        log.info("Authorization pipeline: {}", this.stages.stream().map(AuthorizationStage::name).toList());
    }

    public List<AuthorizationStage> stages() {
        return stages;
    }

    public PipelineResult evaluate(InboundRequest request) {
        RequestContext context = new RequestContext();
        for (AuthorizationStage stage : stages) {
            StageOutcome outcome = stage.process(request, context);
            if (!outcome.forwarded()) {
                DenialResponse denial = outcome.denial().orElseThrow();
                log.info("Request {} {} denied by {} with status {}",
                        request.method(), request.path(), stage.name(), denial.status());
                return PipelineResult.denied(context, denial, stage.name());
            }
        }
        return PipelineResult.forwarded(context);
    }
}
