package com.polygonmev.arb.domain;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Ledger entry for an issued, not yet confirmed or cancelled nonce.
 * {@code submittedBlock} is null until the transaction has been broadcast.
 */
public record InFlightNonce(BigInteger nonce, String txHash, BigInteger submittedBlock, Instant submittedAt,
                            int replacements) {

    public static InFlightNonce allocated(BigInteger nonce) {
        return new InFlightNonce(nonce, null, null, null, 0);
    }

    public boolean isSubmitted() {
        return submittedBlock != null;
    }

    public InFlightNonce submitted(String hash, BigInteger block, Instant at) {
        return new InFlightNonce(nonce, hash, block, at, txHash == null ? replacements : replacements + 1);
    }
}
