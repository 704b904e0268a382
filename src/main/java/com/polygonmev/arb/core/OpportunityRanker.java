package com.polygonmev.arb.core;

import com.polygonmev.arb.domain.Opportunity;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Picks one opportunity per cycle.
 *
 * <p>Opportunities under the confidence threshold are dropped. Among the rest the
 * most profitable wins, except that every opportunity within {@code similarityBand}
 * USD of the best is considered a tie and the highest strategy priority among
 * them is taken. Equal priorities keep profit order.
 */
public class OpportunityRanker {

    private static final Comparator<Opportunity> BY_PROFIT_DESC =
            Comparator.comparing(Opportunity::getExpectedProfitUsd).reversed();

    private final double minConfidence;
    private final BigDecimal similarityBandUsd;

    public OpportunityRanker(double minConfidence, BigDecimal similarityBandUsd) {
        this.minConfidence = minConfidence;
        this.similarityBandUsd = similarityBandUsd;
    }

    public Optional<Opportunity> select(Collection<Opportunity> candidates) {
        List<Opportunity> eligible = candidates.stream()
                .filter(o -> o.isScored() && o.getConfidence() >= minConfidence)
                .sorted(BY_PROFIT_DESC)
                .toList();
        if (eligible.isEmpty()) {
            return Optional.empty();
        }

        BigDecimal floor = eligible.get(0).getExpectedProfitUsd().subtract(similarityBandUsd);
        Opportunity winner = eligible.get(0);
        for (Opportunity candidate : eligible) {
            if (candidate.getExpectedProfitUsd().compareTo(floor) < 0) {
                break;
            }
            if (candidate.getPriority() > winner.getPriority()) {
                winner = candidate;
            }
        }
        return Optional.of(winner);
    }
}
