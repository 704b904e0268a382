package com.polygonmev.arb.core;

import com.polygonmev.arb.config.EngineProperties;
import com.polygonmev.arb.domain.FeeParameters;
import com.polygonmev.arb.domain.TransactionIntent;
import com.polygonmev.arb.infra.alert.AlertNotifier;
import com.polygonmev.arb.infra.alert.AlertPriority;
import com.polygonmev.arb.infra.multicall.BatchReadAggregator;
import com.polygonmev.arb.infra.rpc.ChainGateway;
import com.polygonmev.arb.infra.signing.TransactionSigner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fatal-condition path: halt new submissions, stop the feed, sweep profits out
 * of the executor contract to the admin wallet, alert and exit with code 2.
 * Runs at most once.
 */
@Slf4j
@Service
public class EmergencyShutdown {

    public static final int EXIT_CODE = 2;

    static final BigInteger WITHDRAW_GAS_LIMIT = BigInteger.valueOf(100_000);

    private final RiskGovernor riskGovernor;
    private final MempoolFeed mempoolFeed;
    private final BatchReadAggregator batchReadAggregator;
    private final NonceSequencer nonceSequencer;
    private final GasPricer gasPricer;
    private final TransactionSigner signer;
    private final ChainGateway gateway;
    private final AlertNotifier alertNotifier;
    private final EngineStats stats;
    private final ApplicationTerminator terminator;
    private final EngineProperties.Wallet wallet;
    private final boolean exitOnFatal;

    private final AtomicBoolean triggered = new AtomicBoolean();

    public EmergencyShutdown(RiskGovernor riskGovernor, MempoolFeed mempoolFeed,
                             BatchReadAggregator batchReadAggregator, NonceSequencer nonceSequencer,
                             GasPricer gasPricer, TransactionSigner signer, ChainGateway gateway,
                             AlertNotifier alertNotifier, EngineStats stats, ApplicationTerminator terminator,
                             EngineProperties properties) {
        this.riskGovernor = riskGovernor;
        this.mempoolFeed = mempoolFeed;
        this.batchReadAggregator = batchReadAggregator;
        this.nonceSequencer = nonceSequencer;
        this.gasPricer = gasPricer;
        this.signer = signer;
        this.gateway = gateway;
        this.alertNotifier = alertNotifier;
        this.stats = stats;
        this.terminator = terminator;
        this.wallet = properties.wallet();
        this.exitOnFatal = properties.execution().exitOnFatal();
    }

    public boolean isTriggered() {
        return triggered.get();
    }

    public void trigger(String reason) {
        if (!triggered.compareAndSet(false, true)) {
            return;
        }
        log.error("🚨 EMERGENCY SHUTDOWN INITIATED: {}", reason);

        riskGovernor.trip("Emergency shutdown: " + reason);
        mempoolFeed.stop();

        List<String> withdrawals = withdrawProfits();

        alertNotifier.notify("MEV engine emergency shutdown",
                "Reason: " + reason + "\nWithdrawals: " + withdrawals + "\nStats: " + stats.snapshot(),
                AlertPriority.CRITICAL);
        log.error("Shutdown complete. Stats: {}", stats.snapshot());

        if (exitOnFatal) {
            terminator.terminate(EXIT_CODE);
        }
    }

    /**
     * Sends {@code withdrawProfits(token, admin)} for every configured token the
     * executor contract holds a balance of.
     *
     * @return hashes of the withdrawal transactions that were broadcast
     */
    List<String> withdrawProfits() {
        if (wallet.executorContract() == null || wallet.adminAddress() == null || wallet.withdrawTokens().isEmpty()) {
            log.warn("[WITHDRAW] Executor contract, admin address or tokens not configured, skipping withdrawal");
            return Collections.emptyList();
        }

        List<Optional<BigInteger>> balances;
        try {
            balances = batchReadAggregator.balancesOf(wallet.withdrawTokens(), wallet.executorContract());
        } catch (RuntimeException e) {
            log.error("[WITHDRAW] Could not read contract balances", e);
            return Collections.emptyList();
        }

        String identity = signer.hasIdentity(TransactionSigner.ADMIN) ? TransactionSigner.ADMIN
                : TransactionSigner.EXECUTOR;
        List<String> hashes = new ArrayList<>();
        for (int i = 0; i < wallet.withdrawTokens().size(); i++) {
            String token = wallet.withdrawTokens().get(i);
            Optional<BigInteger> balance = balances.get(i);
            if (balance.isEmpty() || balance.get().signum() == 0) {
                continue;
            }
            try {
                String txHash = sendWithdrawal(token, identity);
                hashes.add(txHash);
                log.info("[WITHDRAW] {} of {} sent to {}: {}", balance.get(), token, wallet.adminAddress(), txHash);
            } catch (RuntimeException e) {
                log.error("[WITHDRAW] Withdrawal of {} failed", token, e);
            }
        }
        return hashes;
    }

    private String sendWithdrawal(String token, String identity) {
        Function function = new Function(
                "withdrawProfits",
                List.of(new Address(token), new Address(wallet.adminAddress())),
                Collections.emptyList());

        BigInteger baseFee = gasPricer.jitBaseFee();
        FeeParameters fees = gasPricer.feesFor(baseFee, GasPricer.gweiToWei(gasPricer.minTipGwei()));
        BigInteger nonce = TransactionSigner.EXECUTOR.equals(identity)
                ? nonceSequencer.allocate()
                : gateway.pendingTransactionCount(signer.address(identity));

        TransactionIntent intent = TransactionIntent.builder()
                .target(wallet.executorContract())
                .calldata(FunctionEncoder.encode(function))
                .gasLimit(WITHDRAW_GAS_LIMIT)
                .fees(fees)
                .nonce(nonce)
                .build();
        String txHash = gateway.sendRawTransaction(signer.sign(intent, identity));
        if (TransactionSigner.EXECUTOR.equals(identity)) {
            nonceSequencer.markSubmitted(nonce, txHash, gateway.blockNumber());
        }
        return txHash;
    }
}
