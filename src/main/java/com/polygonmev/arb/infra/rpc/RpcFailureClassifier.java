package com.polygonmev.arb.infra.rpc;

import org.web3j.protocol.core.Response;

import java.io.IOException;
import java.util.Locale;

/**
 * Maps raw web3j failures onto {@link RpcErrorKind}. This is the only place in
 * the engine that looks at node error codes and messages.
 */
public final class RpcFailureClassifier {

    // JSON-RPC codes used by geth/bor and the big hosted providers.
    private static final int EXECUTION_REVERTED = 3;
    private static final int LIMIT_EXCEEDED = -32005;
    private static final int INTERNAL_ERROR = -32603;
    private static final int HTTP_TOO_MANY_REQUESTS = 429;

    private RpcFailureClassifier() {
    }

    public static RpcErrorKind classify(Response.Error error) {
        if (error == null) {
            return RpcErrorKind.UNKNOWN;
        }
        int code = error.getCode();
        String message = error.getMessage() == null ? "" : error.getMessage().toLowerCase(Locale.ROOT);

        if (code == LIMIT_EXCEEDED || code == HTTP_TOO_MANY_REQUESTS
                || message.contains("rate limit") || message.contains("too many requests")
                || message.contains("exceeded") && message.contains("capacity")) {
            return RpcErrorKind.RATE_LIMITED;
        }
        if (code == EXECUTION_REVERTED || message.contains("revert")) {
            return RpcErrorKind.REVERTED;
        }
        if (message.contains("nonce too low") || message.contains("already known")
                || message.contains("replacement transaction underpriced")) {
            return RpcErrorKind.NONCE_CONFLICT;
        }
        if (message.contains("insufficient") || message.contains("underpriced")
                || message.contains("intrinsic gas") || message.contains("invalid")) {
            return RpcErrorKind.REJECTED;
        }
        if (code == INTERNAL_ERROR || message.contains("header not found") || message.contains("timeout")) {
            return RpcErrorKind.TRANSIENT;
        }
        return RpcErrorKind.UNKNOWN;
    }

    public static RpcErrorKind classify(Throwable failure) {
        if (failure instanceof RpcCallException rpc) {
            return rpc.getKind();
        }
        if (failure instanceof RateLimitedIOException) {
            return RpcErrorKind.RATE_LIMITED;
        }
        if (failure instanceof IOException) {
            return RpcErrorKind.TRANSIENT;
        }
        return RpcErrorKind.UNKNOWN;
    }

    public static RpcCallException toException(String operation, Response.Error error) {
        return new RpcCallException(classify(error), operation,
                "JSON-RPC error " + error.getCode() + " " + error.getMessage());
    }

    public static RpcCallException toException(String operation, Throwable failure) {
        if (failure instanceof RpcCallException rpc) {
            return rpc;
        }
        return new RpcCallException(classify(failure), operation, String.valueOf(failure.getMessage()), failure);
    }
}
