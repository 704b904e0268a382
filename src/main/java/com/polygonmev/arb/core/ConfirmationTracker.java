package com.polygonmev.arb.core;

import com.polygonmev.arb.config.EngineProperties;
import com.polygonmev.arb.infra.rpc.ChainGateway;
import com.polygonmev.arb.infra.rpc.RpcCallException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.web3j.protocol.core.methods.response.TransactionReceipt;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Polls for a receipt until it shows up or the timeout passes.
 */
@Slf4j
@Component
public class ConfirmationTracker {

    private final ChainGateway gateway;
    private final Clock clock;
    private final Duration timeout;
    private final Duration pollInterval;

    @Autowired
    public ConfirmationTracker(ChainGateway gateway, Clock clock, EngineProperties properties) {
        this(gateway, clock, properties.execution().confirmationTimeout(),
                properties.execution().receiptPollInterval());
    }

    public ConfirmationTracker(ChainGateway gateway, Clock clock, Duration timeout, Duration pollInterval) {
        this.gateway = gateway;
        this.clock = clock;
        this.timeout = timeout;
        this.pollInterval = pollInterval;
    }

    /**
     * @return the receipt, or empty on timeout or interruption
     */
    public Optional<TransactionReceipt> awaitReceipt(String txHash) {
        Instant deadline = clock.instant().plus(timeout);
        while (true) {
            try {
                Optional<TransactionReceipt> receipt = gateway.transactionReceipt(txHash);
                if (receipt.isPresent()) {
                    return receipt;
                }
            } catch (RpcCallException e) {
                log.debug("[EXECUTION] Receipt poll for {} failed: {}", txHash, e.getMessage());
            }

            if (!clock.instant().isBefore(deadline)) {
                log.warn("[EXECUTION] No receipt for {} after {}s", txHash, timeout.toSeconds());
                return Optional.empty();
            }
            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
        }
    }
}
