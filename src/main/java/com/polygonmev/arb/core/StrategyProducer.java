package com.polygonmev.arb.core;

import com.polygonmev.arb.domain.Opportunity;
import com.polygonmev.arb.domain.StrategyKind;
import com.polygonmev.arb.domain.TransactionIntent;

import java.util.Optional;

/**
 * A profit-finding strategy. Registered as a Spring bean; the scheduler polls
 * every enabled producer once per cycle.
 */
public interface StrategyProducer {

    StrategyKind kind();

    /**
     * Best opportunity right now, if any. Must return within the scheduler's
     * producer budget; slower results are discarded.
     */
    Optional<Opportunity> findOpportunity();

    /**
     * Builds the transaction for an opportunity this producer found. Only target,
     * calldata and value are required; the engine fills in gas, fees and nonce.
     */
    TransactionIntent buildIntent(Opportunity opportunity, long cycleId);
}
