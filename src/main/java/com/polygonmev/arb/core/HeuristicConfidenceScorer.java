package com.polygonmev.arb.core;

import com.polygonmev.arb.domain.StrategyKind;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Scorer used when no trained model is plugged in.
 */
@Component
public class HeuristicConfidenceScorer implements ConfidenceScorer {

    private static final BigDecimal HIGH_PROFIT_USD = BigDecimal.TEN;

    @Override
    public double score(BigDecimal expectedProfitUsd, StrategyKind kind) {
        return expectedProfitUsd.compareTo(HIGH_PROFIT_USD) > 0 ? 0.7 : 0.5;
    }
}
