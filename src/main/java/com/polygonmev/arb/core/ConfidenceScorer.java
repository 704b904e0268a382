package com.polygonmev.arb.core;

import com.polygonmev.arb.domain.StrategyKind;

import java.math.BigDecimal;

/**
 * Probability in [0, 1] that an opportunity is real and still executable.
 */
@FunctionalInterface
public interface ConfidenceScorer {

    double score(BigDecimal expectedProfitUsd, StrategyKind kind);
}
