package com.polygonmev.arb.infra.rpc;

/**
 * Result of an {@code eth_call}: either return data, or a node-side error that
 * was not a network problem (those are thrown instead).
 */
public record CallOutcome(boolean success, String returnData, RpcErrorKind errorKind, String errorMessage) {

    public static CallOutcome ok(String returnData) {
        return new CallOutcome(true, returnData, null, null);
    }

    public static CallOutcome failed(RpcErrorKind kind, String message) {
        return new CallOutcome(false, null, kind, message);
    }
}
