package com.polygonmev.arb.infra.rpc;

import lombok.Getter;

/**
 * An expected network or node failure, already classified.
 */
@Getter
public class RpcCallException extends RuntimeException {

    private final RpcErrorKind kind;
    private final String operation;

    public RpcCallException(RpcErrorKind kind, String operation, String message) {
        super(operation + ": " + message);
        this.kind = kind;
        this.operation = operation;
    }

    public RpcCallException(RpcErrorKind kind, String operation, String message, Throwable cause) {
        super(operation + ": " + message, cause);
        this.kind = kind;
        this.operation = operation;
    }
}
