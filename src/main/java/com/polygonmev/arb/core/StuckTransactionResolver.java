package com.polygonmev.arb.core;

import com.polygonmev.arb.config.EngineProperties;
import com.polygonmev.arb.domain.ExecutionOutcome;
import com.polygonmev.arb.domain.ExecutionReport;
import com.polygonmev.arb.domain.FeeParameters;
import com.polygonmev.arb.domain.IntentState;
import com.polygonmev.arb.domain.TransactionIntent;
import com.polygonmev.arb.infra.alert.AlertNotifier;
import com.polygonmev.arb.infra.alert.AlertPriority;
import com.polygonmev.arb.infra.rpc.ChainGateway;
import com.polygonmev.arb.infra.rpc.RpcCallException;
import com.polygonmev.arb.infra.rpc.RpcErrorKind;
import com.polygonmev.arb.infra.signing.SigningException;
import com.polygonmev.arb.infra.signing.TransactionSigner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.web3j.protocol.core.methods.response.TransactionReceipt;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Takes over intents whose confirmation wait timed out. Once one has waited
 * past the stuck threshold it is re-sent with bumped fees, up to the configured
 * number of speed-ups, and then cancelled with a zero-value self-transfer on
 * the same nonce.
 */
@Slf4j
@Component
public class StuckTransactionResolver {

    static final BigInteger CANCEL_GAS_LIMIT = BigInteger.valueOf(21_000);

    private final NonceSequencer nonceSequencer;
    private final ChainGateway gateway;
    private final TransactionSigner signer;
    private final OutcomeRecorder outcomeRecorder;
    private final RiskGovernor riskGovernor;
    private final EngineStats stats;
    private final AlertNotifier alertNotifier;
    private final Clock clock;
    private final BigDecimal feeMultiplier;
    private final int maxSpeedUps;
    private final boolean enabled;

    private final Map<BigInteger, TransactionIntent> tracked = new ConcurrentHashMap<>();

    public StuckTransactionResolver(NonceSequencer nonceSequencer, ChainGateway gateway, TransactionSigner signer,
                                    OutcomeRecorder outcomeRecorder, RiskGovernor riskGovernor, EngineStats stats,
                                    AlertNotifier alertNotifier, Clock clock, EngineProperties properties) {
        this.nonceSequencer = nonceSequencer;
        this.gateway = gateway;
        this.signer = signer;
        this.outcomeRecorder = outcomeRecorder;
        this.riskGovernor = riskGovernor;
        this.stats = stats;
        this.alertNotifier = alertNotifier;
        this.clock = clock;
        this.feeMultiplier = properties.nonce().replacementFeeMultiplier();
        this.maxSpeedUps = properties.nonce().maxSpeedUps();
        this.enabled = properties.nonce().resolverEnabled();
    }

    public void track(TransactionIntent intent) {
        tracked.put(intent.getNonce(), intent);
        log.warn("[NONCE] Tracking unconfirmed tx {} (nonce {}, cycle {})", intent.getTxHash(), intent.getNonce(),
                intent.getCycleId());
    }

    public int trackedCount() {
        return tracked.size();
    }

    @Scheduled(fixedDelayString = "${engine.nonce.sweep-interval:PT15S}",
            initialDelayString = "${engine.nonce.sweep-interval:PT15S}")
    public void sweep() {
        if (!enabled || tracked.isEmpty()) {
            return;
        }
        try {
            resolve();
        } catch (RpcCallException e) {
            log.warn("[NONCE] Stuck transaction sweep failed: {}", e.getMessage());
        }
    }

    /**
     * One pass over tracked intents. An intent leaves tracking only once one of
     * its hashes is mined, it is cancelled, or its nonce is found to be gone.
     *
     * @return number of intents that were sped up, cancelled, dropped or found mined
     */
    public int resolve() {
        BigInteger block = gateway.blockNumber();
        int handled = 0;

        for (TransactionIntent intent : List.copyOf(tracked.values())) {
            Optional<TransactionReceipt> receipt = findReceipt(intent);
            if (receipt.isPresent()) {
                settle(intent, receipt.get());
                handled++;
                continue;
            }
            if (!nonceSequencer.isStuck(intent.getSubmittedBlock(), block)) {
                continue;
            }

            if (!nonceSequencer.isInFlight(intent.getNonce())) {
                drop(intent, block, "the network no longer holds nonce " + intent.getNonce());
            } else if (intent.getReplacements() < maxSpeedUps) {
                speedUp(intent, block);
            } else {
                cancel(intent, block);
            }
            handled++;
        }
        return handled;
    }

    /**
     * Newest hash first, since a replacement usually wins.
     */
    private Optional<TransactionReceipt> findReceipt(TransactionIntent intent) {
        List<String> hashes = intent.getBroadcastHashes();
        for (int i = hashes.size() - 1; i >= 0; i--) {
            Optional<TransactionReceipt> receipt = gateway.transactionReceipt(hashes.get(i));
            if (receipt.isPresent()) {
                return receipt;
            }
        }
        return Optional.empty();
    }

    private void settle(TransactionIntent intent, TransactionReceipt receipt) {
        tracked.remove(intent.getNonce());
        ExecutionReport report = outcomeRecorder.recordMined(intent, receipt);
        stats.recordResolved(report);
        log.info("[EXECUTION] cycle={} kind={} opportunity={} expected=${} outcome={} tx={} pnl=${} (late)",
                report.cycleId(), report.kind(), report.opportunityId(), report.expectedProfitUsd(),
                report.outcome(), report.txHash(), report.realizedPnlUsd());
    }

    private void speedUp(TransactionIntent intent, BigInteger block) {
        FeeParameters bumped = intent.getFees().bumped(feeMultiplier);
        TransactionIntent replacement = intent.toBuilder().fees(bumped).build();
        String txHash = broadcast(intent, replacement, "speed-up", block);
        if (txHash == null) {
            return;
        }

        intent.transitionTo(IntentState.SPED_UP);
        intent.setFees(bumped);
        intent.recordBroadcast(txHash, block, clock.instant());
        intent.setReplacements(intent.getReplacements() + 1);
        nonceSequencer.markSubmitted(intent.getNonce(), txHash, block);
        intent.transitionTo(IntentState.PENDING);
        intent.transitionTo(IntentState.STUCK);
        log.warn("[NONCE] Sped up nonce {} -> {} (replacement {}/{}, tip {} gwei)", intent.getNonce(), txHash,
                intent.getReplacements(), maxSpeedUps, GasPricer.weiToGwei(bumped.maxPriorityFeePerGas()));
    }

    private void cancel(TransactionIntent intent, BigInteger block) {
        String self = nonceSequencer.getAddress();
        TransactionIntent cancellation = TransactionIntent.builder()
                .cycleId(intent.getCycleId())
                .opportunity(intent.getOpportunity())
                .target(self)
                .calldata("0x")
                .value(BigInteger.ZERO)
                .gasLimit(CANCEL_GAS_LIMIT)
                .fees(intent.getFees().bumped(feeMultiplier))
                .nonce(intent.getNonce())
                .build();
        String txHash = broadcast(intent, cancellation, "cancel", block);
        if (txHash == null) {
            return;
        }

        close(intent, IntentState.CANCELLED, txHash);
        log.warn("[NONCE] Cancelled nonce {} with {} at block {}", intent.getNonce(), txHash, block);
        alertNotifier.notify("Transaction cancelled",
                "Cycle " + intent.getCycleId() + " (" + intent.getKind() + ") nonce " + intent.getNonce()
                        + " was stuck after " + intent.getReplacements() + " speed-ups and has been cancelled",
                AlertPriority.HIGH);
    }

    /**
     * Closes an intent none of whose hashes was mined and that can no longer be
     * replaced. Booked as a failed trade.
     */
    private void drop(TransactionIntent intent, BigInteger block, String reason) {
        close(intent, IntentState.DROPPED, intent.getTxHash());
        log.error("[NONCE] Dropped nonce {} at block {}: {} (hashes {})", intent.getNonce(), block, reason,
                intent.getBroadcastHashes());
        alertNotifier.notify("Transaction dropped",
                "Cycle " + intent.getCycleId() + " (" + intent.getKind() + ") nonce " + intent.getNonce()
                        + " was abandoned: " + reason + ". Hashes: " + intent.getBroadcastHashes(),
                AlertPriority.HIGH);
    }

    private void close(TransactionIntent intent, IntentState finalState, String txHash) {
        intent.transitionTo(finalState);
        tracked.remove(intent.getNonce());
        nonceSequencer.cancel(intent.getNonce());
        riskGovernor.recordFailure();
        outcomeRecorder.recordTip(intent, false);
        stats.recordResolved(new ExecutionReport(intent.getCycleId(), intent.getOpportunity().getId(),
                intent.getKind(), intent.getOpportunity().getExpectedProfitUsd(), ExecutionOutcome.TIMED_OUT, txHash,
                BigDecimal.ZERO, BigDecimal.ZERO));
    }

    /**
     * @return the new hash, or null when nothing was sent. A nonce conflict means
     * some transaction already took the nonce; the intent is then settled from
     * whichever of its hashes was mined, or dropped.
     */
    private String broadcast(TransactionIntent intent, TransactionIntent tx, String action, BigInteger block) {
        try {
            return gateway.sendRawTransaction(signer.sign(tx, TransactionSigner.EXECUTOR));
        } catch (SigningException e) {
            log.error("[NONCE] {} of nonce {} failed: {}", action, tx.getNonce(), e.getMessage());
            return null;
        } catch (RpcCallException e) {
            if (e.getKind() != RpcErrorKind.NONCE_CONFLICT) {
                log.error("[NONCE] {} of nonce {} failed: {}", action, tx.getNonce(), e.getMessage());
                return null;
            }
            log.warn("[NONCE] {} of nonce {} rejected, nonce already used: {}", action, tx.getNonce(),
                    e.getMessage());
            Optional<TransactionReceipt> receipt = findReceipt(intent);
            if (receipt.isPresent()) {
                settle(intent, receipt.get());
            } else {
                drop(intent, block, "nonce was taken by a transaction with none of the known hashes");
            }
            return null;
        }
    }
}
