package com.polygonmev.arb.support;

import com.polygonmev.arb.domain.FeeParameters;
import com.polygonmev.arb.domain.IntentState;
import com.polygonmev.arb.domain.Opportunity;
import com.polygonmev.arb.domain.OpportunityPayload;
import com.polygonmev.arb.domain.TransactionIntent;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.utils.Numeric;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

/**
 * Shared domain objects for engine tests.
 */
public final class Fixtures {

    public static final String EXECUTOR = "0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266";
    public static final String ROUTER = "0xa5e0829caced8ffdd4de3c43696c57f7d7a678ff";
    public static final BigInteger GWEI = BigInteger.TEN.pow(9);
    public static final BigInteger SUBMITTED_BLOCK = BigInteger.valueOf(100);

    private Fixtures() {
    }

    public static Opportunity directOpportunity(String id, String profitUsd) {
        return Opportunity.builder()
                .id(id)
                .expectedProfitUsd(new BigDecimal(profitUsd))
                .confidence(0.9)
                .payload(new OpportunityPayload.DirectArbitrage(
                        "0x2791bca1f2de4661ed88a30c99a7a9449aa84174",
                        "0x0d500b1d8e8ef31e21c99d1db9a6444d3adf1270",
                        ROUTER, "0x1b02da8cb0d097eb8d57a175b88c7d8b47997506",
                        BigDecimal.ONE, new BigDecimal("1.02"), new BigDecimal("1000")))
                .build();
    }

    public static Opportunity sandwichOpportunity(String id, String profitUsd) {
        return Opportunity.builder()
                .id(id)
                .expectedProfitUsd(new BigDecimal(profitUsd))
                .confidence(0.9)
                .payload(new OpportunityPayload.Sandwich("0xvictim", GWEI.multiply(BigInteger.valueOf(40)), ROUTER,
                        List.of("0x2791bca1f2de4661ed88a30c99a7a9449aa84174"), BigInteger.TEN))
                .build();
    }

    /**
     * The unpriced intent a producer hands back from {@code buildIntent}.
     */
    public static TransactionIntent builtIntent(Opportunity opportunity, long cycleId) {
        return TransactionIntent.builder()
                .cycleId(cycleId)
                .opportunity(opportunity)
                .target(ROUTER)
                .calldata("0x38ed1739")
                .build();
    }

    /**
     * An intent that has been submitted and is waiting to be mined.
     */
    public static TransactionIntent pendingIntent(Opportunity opportunity, long cycleId, long nonce, String txHash) {
        TransactionIntent intent = builtIntent(opportunity, cycleId);
        intent.setGasLimit(BigInteger.valueOf(500_000));
        intent.setFees(new FeeParameters(GWEI.multiply(BigInteger.valueOf(100)), GWEI.multiply(BigInteger.valueOf(30)),
                GWEI.multiply(BigInteger.valueOf(230))));
        intent.setNonce(BigInteger.valueOf(nonce));
        intent.recordBroadcast(txHash, SUBMITTED_BLOCK, Instant.parse("2024-05-01T00:00:00Z"));
        intent.transitionTo(IntentState.SIMULATION_PASSED);
        intent.transitionTo(IntentState.SUBMITTED);
        intent.transitionTo(IntentState.PENDING);
        return intent;
    }

    public static TransactionReceipt receipt(String txHash, boolean success, long gasUsed, BigInteger effectiveGasPrice) {
        TransactionReceipt receipt = new TransactionReceipt();
        receipt.setTransactionHash(txHash);
        receipt.setStatus(success ? "0x1" : "0x0");
        receipt.setGasUsed(Numeric.encodeQuantity(BigInteger.valueOf(gasUsed)));
        receipt.setEffectiveGasPrice(Numeric.encodeQuantity(effectiveGasPrice));
        return receipt;
    }
}
