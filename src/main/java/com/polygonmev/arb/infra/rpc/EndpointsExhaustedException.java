package com.polygonmev.arb.infra.rpc;

import lombok.Getter;

/**
 * Every configured tier has been rate limited. Fatal: it is never retried and
 * ends in emergency shutdown.
 */
@Getter
public class EndpointsExhaustedException extends RuntimeException {

    private final String lastTier;

    public EndpointsExhaustedException(String lastTier, Throwable cause) {
        super("All RPC tiers exhausted (last tier: " + lastTier + ")", cause);
        this.lastTier = lastTier;
    }
}
