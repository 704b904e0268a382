package com.polygonmev.arb.core;

import com.polygonmev.arb.config.EngineProperties;
import com.polygonmev.arb.domain.RiskState;
import com.polygonmev.arb.infra.alert.AlertNotifier;
import com.polygonmev.arb.infra.alert.AlertPriority;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Daily loss circuit breaker.
 *
 * <p>Armed until same-day realized loss reaches the ceiling (or {@link #trip(String)}
 * is called), then tripped until {@link #reset()}. Failed submissions only raise
 * an alert. Counters roll over at the UTC day boundary; the tripped flag does not.
 * Alerts are sent after the lock is released.
 */
@Slf4j
@Service
public class RiskGovernor {

    private static final long SECONDS_PER_DAY = 86_400L;

    private final Clock clock;
    private final AlertNotifier alertNotifier;
    private final BigDecimal maxDailyLossUsd;
    private final int maxFailedTxBeforeAlert;
    private final boolean autoKillEnabled;

    private final ReentrantLock lock = new ReentrantLock();
    private long dayId;
    private BigDecimal accumulatedLossUsd = BigDecimal.ZERO;
    private int failedTxCount;
    private boolean failureAlertRaised;
    private boolean tripped;
    private String tripReason;
    private Instant trippedAt;

    public RiskGovernor(EngineProperties properties, Clock clock, AlertNotifier alertNotifier) {
        this.clock = clock;
        this.alertNotifier = alertNotifier;
        this.maxDailyLossUsd = properties.risk().maxDailyLossUsd();
        this.maxFailedTxBeforeAlert = properties.risk().maxFailedTxBeforeAlert();
        this.autoKillEnabled = properties.risk().autoKillEnabled();
        this.dayId = currentDay();
        log.info("[KILL-SWITCH] Initialized: max daily loss ${}, alert after {} failed tx, auto-kill {}",
                maxDailyLossUsd, maxFailedTxBeforeAlert, autoKillEnabled ? "on" : "off");
    }

    /**
     * Records the realized PnL of one execution; only losses count.
     */
    public void recordOutcome(BigDecimal realizedPnlUsd) {
        if (realizedPnlUsd.signum() < 0) {
            recordLoss(realizedPnlUsd.negate());
        }
    }

    public void recordLoss(BigDecimal lossUsd) {
        if (lossUsd.signum() <= 0) {
            return;
        }
        String reason = null;
        BigDecimal total;
        lock.lock();
        try {
            rollOverIfNewDay();
            accumulatedLossUsd = accumulatedLossUsd.add(lossUsd);
            total = accumulatedLossUsd;
            if (!tripped && autoKillEnabled && accumulatedLossUsd.compareTo(maxDailyLossUsd) >= 0) {
                reason = "Daily loss limit exceeded: $" + accumulatedLossUsd.toPlainString();
                markTripped(reason);
            }
        } finally {
            lock.unlock();
        }

        log.warn("[KILL-SWITCH] Loss recorded: ${} (daily total ${})", lossUsd, total);
        if (reason != null) {
            announceTrip(reason);
        } else if (!autoKillEnabled && total.compareTo(maxDailyLossUsd) >= 0) {
            alertNotifier.notify("Daily loss limit exceeded",
                    "Daily loss is $" + total.toPlainString() + " but auto-kill is disabled", AlertPriority.HIGH);
        }
    }

    public void recordFailure() {
        int count;
        boolean raiseAlert = false;
        lock.lock();
        try {
            rollOverIfNewDay();
            failedTxCount++;
            count = failedTxCount;
            if (failedTxCount >= maxFailedTxBeforeAlert && !failureAlertRaised) {
                failureAlertRaised = true;
                raiseAlert = true;
            }
        } finally {
            lock.unlock();
        }

        log.warn("[KILL-SWITCH] Failed transaction recorded (count today: {})", count);
        if (raiseAlert) {
            alertNotifier.notify("High failed transaction count",
                    count + " failed transactions today; review before the kill switch is tripped manually",
                    AlertPriority.HIGH);
        }
    }

    /**
     * Manual trip. A no-op when already tripped.
     */
    public void trip(String reason) {
        lock.lock();
        try {
            if (tripped) {
                return;
            }
            markTripped(reason);
        } finally {
            lock.unlock();
        }
        announceTrip(reason);
    }

    public void reset() {
        lock.lock();
        try {
            tripped = false;
            tripReason = null;
            trippedAt = null;
        } finally {
            lock.unlock();
        }
        log.info("[KILL-SWITCH] Reset manually");
        alertNotifier.notify("Kill switch reset", "Trading may resume", AlertPriority.NORMAL);
    }

    public boolean isTripped() {
        lock.lock();
        try {
            return tripped;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @throws RiskTrippedException when tripped
     */
    public void ensureArmed() {
        lock.lock();
        try {
            if (tripped) {
                throw new RiskTrippedException(tripReason);
            }
        } finally {
            lock.unlock();
        }
    }

    public RiskState snapshot() {
        lock.lock();
        try {
            rollOverIfNewDay();
            return new RiskState(dayId, accumulatedLossUsd, failedTxCount, tripped, tripReason, trippedAt);
        } finally {
            lock.unlock();
        }
    }

    private void markTripped(String reason) {
        tripped = true;
        tripReason = reason;
        trippedAt = clock.instant();
    }

    private void announceTrip(String reason) {
        log.error("[KILL-SWITCH] ACTIVATED: {}", reason);
        alertNotifier.notify("KILL SWITCH ACTIVATED", reason, AlertPriority.CRITICAL);
    }

    private void rollOverIfNewDay() {
        long today = currentDay();
        if (today != dayId) {
            log.info("[KILL-SWITCH] New trading day {}, resetting counters (loss ${}, failures {})",
                    today, accumulatedLossUsd, failedTxCount);
            dayId = today;
            accumulatedLossUsd = BigDecimal.ZERO;
            failedTxCount = 0;
            failureAlertRaised = false;
        }
    }

    private long currentDay() {
        return Math.floorDiv(clock.instant().getEpochSecond(), SECONDS_PER_DAY);
    }
}
