package com.polygonmev.arb.domain;

import java.math.BigDecimal;

/**
 * What happened to one opportunity in one cycle. {@code realizedPnlUsd} is zero
 * when nothing was mined.
 */
public record ExecutionReport(long cycleId,
                              String opportunityId,
                              StrategyKind kind,
                              BigDecimal expectedProfitUsd,
                              ExecutionOutcome outcome,
                              String txHash,
                              BigDecimal realizedPnlUsd,
                              BigDecimal gasCostUsd) {

    public static ExecutionReport notSubmitted(long cycleId, Opportunity opportunity, ExecutionOutcome outcome) {
        return new ExecutionReport(cycleId, opportunity.getId(), opportunity.getKind(),
                opportunity.getExpectedProfitUsd(), outcome, null, BigDecimal.ZERO, BigDecimal.ZERO);
    }
}
