package com.polygonmev.arb.core;

import com.polygonmev.arb.config.EngineProperties;
import com.polygonmev.arb.domain.ExecutionOutcome;
import com.polygonmev.arb.domain.ExecutionReport;
import com.polygonmev.arb.domain.FeeParameters;
import com.polygonmev.arb.domain.IntentState;
import com.polygonmev.arb.domain.Opportunity;
import com.polygonmev.arb.domain.TransactionIntent;
import com.polygonmev.arb.infra.rpc.ChainGateway;
import com.polygonmev.arb.infra.rpc.EndpointFailoverManager;
import com.polygonmev.arb.infra.rpc.RpcCallException;
import com.polygonmev.arb.infra.rpc.RpcErrorKind;
import com.polygonmev.arb.infra.signing.SigningException;
import com.polygonmev.arb.infra.signing.TransactionSigner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.web3j.protocol.core.methods.response.TransactionReceipt;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.util.Optional;

/**
 * Drives one selected opportunity through pre-checks, pricing, build, dry run,
 * submission and confirmation. Every step short-circuits into an
 * {@link ExecutionReport}; only {@link RiskTrippedException} and
 * {@link com.polygonmev.arb.infra.rpc.EndpointsExhaustedException} escape.
 */
@Slf4j
@Service
public class ExecutionEngine {

    private final RiskGovernor riskGovernor;
    private final EndpointFailoverManager failoverManager;
    private final GasPricer gasPricer;
    private final TransactionSimulator simulator;
    private final NonceSequencer nonceSequencer;
    private final TransactionSigner signer;
    private final ChainGateway gateway;
    private final ConfirmationTracker confirmationTracker;
    private final OutcomeRecorder outcomeRecorder;
    private final StuckTransactionResolver stuckTransactionResolver;
    private final Clock clock;
    private final boolean allowAmbiguousSimulation;

    public ExecutionEngine(RiskGovernor riskGovernor, EndpointFailoverManager failoverManager, GasPricer gasPricer,
                           TransactionSimulator simulator, NonceSequencer nonceSequencer, TransactionSigner signer,
                           ChainGateway gateway, ConfirmationTracker confirmationTracker,
                           OutcomeRecorder outcomeRecorder, StuckTransactionResolver stuckTransactionResolver,
                           Clock clock, EngineProperties properties) {
        this.riskGovernor = riskGovernor;
        this.failoverManager = failoverManager;
        this.gasPricer = gasPricer;
        this.simulator = simulator;
        this.nonceSequencer = nonceSequencer;
        this.signer = signer;
        this.gateway = gateway;
        this.confirmationTracker = confirmationTracker;
        this.outcomeRecorder = outcomeRecorder;
        this.stuckTransactionResolver = stuckTransactionResolver;
        this.clock = clock;
        this.allowAmbiguousSimulation = properties.execution().allowAmbiguousSimulation();
    }

    public ExecutionReport execute(long cycleId, Opportunity opp, StrategyProducer producer) {
        log.info("--- START EXECUTION cycle={} {} {} expected=${} ---", cycleId, opp.getKind(), opp.getId(),
                opp.getExpectedProfitUsd());
        ExecutionReport report = runPipeline(cycleId, opp, producer);
        log.info("[EXECUTION] cycle={} kind={} opportunity={} expected=${} outcome={} tx={} pnl=${} gas=${}",
                cycleId, report.kind(), report.opportunityId(), report.expectedProfitUsd(), report.outcome(),
                report.txHash(), report.realizedPnlUsd(), report.gasCostUsd());
        return report;
    }

    private ExecutionReport runPipeline(long cycleId, Opportunity opp, StrategyProducer producer) {
        // Step 1: pre-checks
        riskGovernor.ensureArmed();
        if (!failoverManager.isHealthy()) {
            log.warn("[EXECUTION] cycle={} active endpoint {} is not healthy", cycleId,
                    failoverManager.currentTier().getName());
            return ExecutionReport.notSubmitted(cycleId, opp, ExecutionOutcome.PRECHECK_FAILED);
        }

        // Step 2: pricing
        BigInteger baseFee = gasPricer.jitBaseFee();
        Optional<BigInteger> tip = gasPricer.tip(opp);
        if (tip.isEmpty()) {
            return ExecutionReport.notSubmitted(cycleId, opp, ExecutionOutcome.UNAFFORDABLE);
        }
        FeeParameters fees = gasPricer.feesFor(baseFee, tip.get());

        // Step 3: build
        TransactionIntent intent;
        try {
            intent = producer.buildIntent(opp, cycleId);
        } catch (RuntimeException e) {
            log.error("[EXECUTION] cycle={} {} producer failed to build the transaction", cycleId, opp.getKind(), e);
            return ExecutionReport.notSubmitted(cycleId, opp, ExecutionOutcome.BUILD_FAILED);
        }
        intent.setCycleId(cycleId);
        intent.setOpportunity(opp);
        intent.setFees(fees);
        if (intent.getGasLimit() == null) {
            intent.setGasLimit(gasPricer.gasLimit(opp));
        }
        log.info("[EXECUTION] State: {} | target={} gasLimit={} tip={} gwei maxFee={} gwei", intent.getState(),
                intent.getTarget(), intent.getGasLimit(), GasPricer.weiToGwei(fees.maxPriorityFeePerGas()),
                GasPricer.weiToGwei(fees.maxFeePerGas()));

        // Step 4: dry run
        SimulationVerdict verdict = simulator.simulate(intent, nonceSequencer.getAddress());
        if (verdict == SimulationVerdict.REJECTED
                || (verdict == SimulationVerdict.AMBIGUOUS && !allowAmbiguousSimulation)) {
            intent.transitionTo(IntentState.SIMULATION_REJECTED);
            return ExecutionReport.notSubmitted(cycleId, opp, ExecutionOutcome.SIMULATION_REJECTED);
        }
        if (verdict == SimulationVerdict.AMBIGUOUS) {
            log.warn("[EXECUTION] cycle={} proceeding despite ambiguous simulation", cycleId);
        }
        intent.transitionTo(IntentState.SIMULATION_PASSED);

        // Step 5: nonce, sign, submit
        if (!submit(intent)) {
            riskGovernor.recordFailure();
            outcomeRecorder.recordTip(intent, false);
            return ExecutionReport.notSubmitted(cycleId, opp, ExecutionOutcome.SUBMISSION_FAILED);
        }

        // Step 6: confirmation
        Optional<TransactionReceipt> receipt = confirmationTracker.awaitReceipt(intent.getTxHash());
        if (receipt.isEmpty()) {
            intent.transitionTo(IntentState.STUCK);
            stuckTransactionResolver.track(intent);
            return new ExecutionReport(cycleId, opp.getId(), opp.getKind(), opp.getExpectedProfitUsd(),
                    ExecutionOutcome.TIMED_OUT, intent.getTxHash(), BigDecimal.ZERO,
                    BigDecimal.ZERO);
        }

        // Step 7: accounting
        return outcomeRecorder.recordMined(intent, receipt.get());
    }

    private boolean submit(TransactionIntent intent) {
        BigInteger block;
        try {
            block = gateway.blockNumber();
        } catch (RpcCallException e) {
            log.warn("[EXECUTION] cycle={} could not read block number: {}", intent.getCycleId(), e.getMessage());
            intent.transitionTo(IntentState.FAILED);
            return false;
        }

        BigInteger nonce = nonceSequencer.allocate();
        intent.setNonce(nonce);
        try {
            String signed = signer.sign(intent, TransactionSigner.EXECUTOR);
            String txHash = gateway.sendRawTransaction(signed);
            intent.recordBroadcast(txHash, block, clock.instant());
            intent.transitionTo(IntentState.SUBMITTED);
            intent.transitionTo(IntentState.PENDING);
            nonceSequencer.markSubmitted(nonce, txHash, block);
            log.info("[EXECUTION] cycle={} submitted {} with nonce {}", intent.getCycleId(), txHash, nonce);
            return true;
        } catch (SigningException e) {
            log.error("[EXECUTION] cycle={} signing failed", intent.getCycleId(), e);
        } catch (RpcCallException e) {
            if (e.getKind() == RpcErrorKind.NONCE_CONFLICT) {
                log.warn("[EXECUTION] cycle={} nonce conflict on {}: {}", intent.getCycleId(), nonce, e.getMessage());
            } else {
                log.error("[EXECUTION] cycle={} submission failed ({}): {}", intent.getCycleId(), e.getKind(),
                        e.getMessage());
            }
        }

        intent.transitionTo(IntentState.FAILED);
        resyncQuietly();
        return false;
    }

    private void resyncQuietly() {
        try {
            nonceSequencer.resync();
        } catch (RpcCallException e) {
            log.error("[EXECUTION] Nonce resync failed, will retry on next failure: {}", e.getMessage());
        }
    }
}
