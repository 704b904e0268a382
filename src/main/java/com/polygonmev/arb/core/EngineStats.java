package com.polygonmev.arb.core;

import com.polygonmev.arb.domain.ExecutionOutcome;
import com.polygonmev.arb.domain.ExecutionReport;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Running totals since startup.
 */
@Component
public class EngineStats {

    public record Snapshot(long cycles, long opportunitiesSelected, long totalTrades, long successfulTrades,
                           long failedTrades, long timedOutTrades, BigDecimal totalProfitUsd,
                           BigDecimal totalGasSpentUsd, Duration uptime) {

        public double successRate() {
            return totalTrades == 0 ? 0.0 : (double) successfulTrades / totalTrades;
        }

        @Override
        public String toString() {
            return String.format("cycles=%d selected=%d trades=%d success=%d failed=%d timedOut=%d "
                            + "successRate=%.1f%% profit=$%s gas=$%s uptime=%s",
                    cycles, opportunitiesSelected, totalTrades, successfulTrades, failedTrades, timedOutTrades,
                    successRate() * 100, totalProfitUsd.setScale(2, RoundingMode.HALF_UP),
                    totalGasSpentUsd.setScale(2, RoundingMode.HALF_UP), uptime);
        }
    }

    private final Clock clock;
    private final Instant startedAt;

    private long cycles;
    private long opportunitiesSelected;
    private long totalTrades;
    private long successfulTrades;
    private long failedTrades;
    private long timedOutTrades;
    private BigDecimal totalProfitUsd = BigDecimal.ZERO;
    private BigDecimal totalGasSpentUsd = BigDecimal.ZERO;

    public EngineStats(Clock clock) {
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public synchronized void recordCycle(boolean selected) {
        cycles++;
        if (selected) {
            opportunitiesSelected++;
        }
    }

    public synchronized void record(ExecutionReport report) {
        ExecutionOutcome outcome = report.outcome();
        if (outcome.wasSubmitted() || outcome == ExecutionOutcome.SUBMISSION_FAILED) {
            totalTrades++;
        }
        switch (outcome) {
            case SUCCESS -> successfulTrades++;
            case REVERTED, SUBMISSION_FAILED -> failedTrades++;
            case TIMED_OUT -> timedOutTrades++;
            default -> {
            }
        }
        totalProfitUsd = totalProfitUsd.add(report.realizedPnlUsd());
        totalGasSpentUsd = totalGasSpentUsd.add(report.gasCostUsd());
    }

    /**
     * A timed-out trade that was mined or cancelled later.
     */
    public synchronized void recordResolved(ExecutionReport report) {
        timedOutTrades = Math.max(0, timedOutTrades - 1);
        if (report.outcome() == ExecutionOutcome.SUCCESS) {
            successfulTrades++;
        } else {
            failedTrades++;
        }
        totalProfitUsd = totalProfitUsd.add(report.realizedPnlUsd());
        totalGasSpentUsd = totalGasSpentUsd.add(report.gasCostUsd());
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(cycles, opportunitiesSelected, totalTrades, successfulTrades, failedTrades,
                timedOutTrades, totalProfitUsd, totalGasSpentUsd, Duration.between(startedAt, clock.instant()));
    }
}
