package com.polygonmev.arb.domain;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * EIP-1559 fee fields, all in wei.
 */
public record FeeParameters(BigInteger baseFeePerGas, BigInteger maxPriorityFeePerGas, BigInteger maxFeePerGas) {

    public FeeParameters {
        if (baseFeePerGas.signum() < 0 || maxPriorityFeePerGas.signum() < 0 || maxFeePerGas.signum() < 0) {
            throw new IllegalArgumentException("fees must be non-negative");
        }
    }

    /**
     * Replacement fees: both fields scaled by {@code multiplier}, rounded up.
     */
    public FeeParameters bumped(BigDecimal multiplier) {
        return new FeeParameters(baseFeePerGas, scale(maxPriorityFeePerGas, multiplier), scale(maxFeePerGas, multiplier));
    }

    private static BigInteger scale(BigInteger value, BigDecimal multiplier) {
        return new BigDecimal(value).multiply(multiplier).setScale(0, RoundingMode.CEILING).toBigIntegerExact();
    }
}
