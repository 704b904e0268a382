package com.polygonmev.arb.domain;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

/**
 * Strategy-specific data attached to an {@link Opportunity}. The scheduler never
 * inspects it; only the producer that created it does.
 */
public sealed interface OpportunityPayload {

    StrategyKind kind();

    record DirectArbitrage(String tokenIn, String tokenOut, String buyRouter, String sellRouter,
                           BigDecimal buyPrice, BigDecimal sellPrice, BigDecimal tradeSizeUsd) implements OpportunityPayload {
        @Override
        public StrategyKind kind() {
            return StrategyKind.DIRECT;
        }
    }

    record TriangularArbitrage(String router, List<String> path, BigInteger amountIn,
                               BigInteger expectedAmountOut) implements OpportunityPayload {
        @Override
        public StrategyKind kind() {
            return StrategyKind.TRIANGULAR;
        }
    }

    record Flashloan(String lendingPool, String asset, BigInteger loanAmount, String buyRouter,
                     String sellRouter, BigDecimal premiumUsd) implements OpportunityPayload {
        @Override
        public StrategyKind kind() {
            return StrategyKind.FLASHLOAN;
        }
    }

    record Liquidation(String lendingPool, String borrower, String collateralAsset, String debtAsset,
                       BigInteger debtToCover, BigDecimal healthFactor) implements OpportunityPayload {
        @Override
        public StrategyKind kind() {
            return StrategyKind.LIQUIDATION;
        }
    }

    /**
     * @param victimTxHash      pending swap being bracketed
     * @param victimGasPriceWei fee the front-run has to beat
     */
    record Sandwich(String victimTxHash, BigInteger victimGasPriceWei, String router,
                    List<String> path, BigInteger frontRunAmountIn) implements OpportunityPayload {
        @Override
        public StrategyKind kind() {
            return StrategyKind.SANDWICH;
        }
    }
}
