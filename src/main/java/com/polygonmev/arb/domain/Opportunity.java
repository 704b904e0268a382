package com.polygonmev.arb.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A candidate trade reported by a strategy producer. Immutable; consumed by at
 * most one cycle.
 */
@Value
@Builder
public class Opportunity {

    @NonNull
    String id;

    @NonNull
    BigDecimal expectedProfitUsd;

    /**
     * Probability in [0, 1]; {@code null} when the producer left scoring to the
     * engine's confidence scorer.
     */
    @With
    Double confidence;

    @NonNull
    OpportunityPayload payload;

    /**
     * When the producer saw it; stamped by the scheduler's clock when left unset.
     */
    @With
    Instant detectedAt;

    public StrategyKind getKind() {
        return payload.kind();
    }

    public int getPriority() {
        return payload.kind().priority();
    }

    public boolean isScored() {
        return confidence != null;
    }
}
