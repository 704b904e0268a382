package com.polygonmev.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/**
 * A pending transaction seen in the mempool that looks like a DEX swap.
 */
@Value
@Builder
public class PendingSwap {
    String hash;
    String from;
    String to;
    BigInteger value;
    String input;
    BigInteger gasPrice;
    BigInteger maxPriorityFeePerGas;
    Instant seenAt;

    public String selector() {
        return input != null && input.length() >= 10 ? input.substring(0, 10).toLowerCase() : "";
    }
}
