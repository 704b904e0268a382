package com.polygonmev.arb.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Snapshot of the kill switch. {@code dayId} is days since the epoch (UTC).
 */
public record RiskState(long dayId,
                        BigDecimal accumulatedLossUsd,
                        int failedTxCount,
                        boolean tripped,
                        String tripReason,
                        Instant trippedAt) {
}
