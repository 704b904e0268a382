package com.polygonmev.arb.infra.rpc;

import org.junit.jupiter.api.Test;
import org.web3j.protocol.core.Response;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class RpcFailureClassifierTest {

    @Test
    void testRateLimitSignals() {
        assertEquals(RpcErrorKind.RATE_LIMITED, RpcFailureClassifier.classify(new Response.Error(-32005, "limit exceeded")));
        assertEquals(RpcErrorKind.RATE_LIMITED, RpcFailureClassifier.classify(new Response.Error(-32000, "Too Many Requests")));
        assertEquals(RpcErrorKind.RATE_LIMITED, RpcFailureClassifier.classify(new Response.Error(-32000, "daily request count exceeded, request capacity")));
        assertEquals(RpcErrorKind.RATE_LIMITED, RpcFailureClassifier.classify(new RateLimitedIOException("rpc.example", "1")));
    }

    @Test
    void testNodeErrors() {
        assertEquals(RpcErrorKind.REVERTED, RpcFailureClassifier.classify(new Response.Error(3, "execution reverted: K")));
        assertEquals(RpcErrorKind.NONCE_CONFLICT, RpcFailureClassifier.classify(new Response.Error(-32000, "nonce too low")));
        assertEquals(RpcErrorKind.NONCE_CONFLICT, RpcFailureClassifier.classify(new Response.Error(-32000, "replacement transaction underpriced")));
        assertEquals(RpcErrorKind.REJECTED, RpcFailureClassifier.classify(new Response.Error(-32000, "insufficient funds for gas * price + value")));
        assertEquals(RpcErrorKind.TRANSIENT, RpcFailureClassifier.classify(new Response.Error(-32603, "internal error")));
        assertEquals(RpcErrorKind.UNKNOWN, RpcFailureClassifier.classify(new Response.Error(-32601, "method not found")));
        assertEquals(RpcErrorKind.UNKNOWN, RpcFailureClassifier.classify((Response.Error) null));
    }

    @Test
    void testThrowables() {
        assertEquals(RpcErrorKind.TRANSIENT, RpcFailureClassifier.classify(new IOException("reset")));
        assertEquals(RpcErrorKind.UNKNOWN, RpcFailureClassifier.classify(new IllegalStateException("boom")));

        RpcCallException existing = new RpcCallException(RpcErrorKind.REJECTED, "eth_call", "bad");
        assertSame(existing, RpcFailureClassifier.toException("eth_call", existing));
    }

    @Test
    void testOnlyTransientIsRetryable() {
        for (RpcErrorKind kind : RpcErrorKind.values()) {
            assertEquals(kind == RpcErrorKind.TRANSIENT, kind.isRetryable(), kind.name());
        }
    }
}
