package com.polygonmev.arb.infra.rpc;

/**
 * Structured classification of an upstream failure. Decided once, at the
 * network-client boundary.
 */
public enum RpcErrorKind {
    /** Upstream explicitly throttled us: move to the next tier. */
    RATE_LIMITED,
    /** Connection/IO level failure: retry on the same tier. */
    TRANSIENT,
    /** Execution reverted on-chain or in a dry run. */
    REVERTED,
    /** Nonce already used or replaced. */
    NONCE_CONFLICT,
    /** Node refused the request (insufficient funds, underpriced, malformed). */
    REJECTED,
    UNKNOWN;

    public boolean isRetryable() {
        return this == TRANSIENT;
    }
}
