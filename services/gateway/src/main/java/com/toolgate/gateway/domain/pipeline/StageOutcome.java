package com.toolgate.gateway.domain.pipeline;

import java.util.Objects;
import java.util.Optional;

/**
 * What a stage decided: pass the request on, or answer it.
 */
public final class StageOutcome {

    private static final StageOutcome FORWARD = new StageOutcome(null);

    private final DenialResponse denial;

    private StageOutcome(DenialResponse denial) {
        this.denial = denial;
    }

    public static StageOutcome forward() {
        return FORWARD;
    }

    public static StageOutcome terminate(DenialResponse denial) {
        return new StageOutcome(Objects.requireNonNull(denial, "denial must not be null"));
    }

    public boolean forwarded() {
        return denial == null;
    }

    public Optional<DenialResponse> denial() {
        return Optional.ofNullable(denial);
    }
}
