package com.polygonmev.arb.core;

import com.polygonmev.arb.domain.TransactionIntent;
import com.polygonmev.arb.infra.rpc.CallOutcome;
import com.polygonmev.arb.infra.rpc.ChainGateway;
import com.polygonmev.arb.infra.rpc.RpcCallException;
import com.polygonmev.arb.infra.rpc.RpcErrorKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Dry-runs an intent with {@code eth_call} against the latest block.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TransactionSimulator {

    private final ChainGateway gateway;

    public SimulationVerdict simulate(TransactionIntent intent, String from) {
        CallOutcome outcome;
        try {
            outcome = gateway.call(from, intent.getTarget(), intent.getCalldata(), intent.getValue());
        } catch (RpcCallException e) {
            log.warn("[SIMULATION] cycle={} dry run errored ({}): {}", intent.getCycleId(), e.getKind(),
                    e.getMessage());
            return SimulationVerdict.AMBIGUOUS;
        }

        if (outcome.success()) {
            log.debug("[SIMULATION] cycle={} passed", intent.getCycleId());
            return SimulationVerdict.PASSED;
        }
        if (outcome.errorKind() == RpcErrorKind.REVERTED || outcome.errorKind() == RpcErrorKind.REJECTED) {
            log.info("[SIMULATION] cycle={} rejected: {}", intent.getCycleId(), outcome.errorMessage());
            return SimulationVerdict.REJECTED;
        }
        log.warn("[SIMULATION] cycle={} ambiguous result ({}): {}", intent.getCycleId(), outcome.errorKind(),
                outcome.errorMessage());
        return SimulationVerdict.AMBIGUOUS;
    }
}
