package com.polygonmev.arb.infra.rpc;

import java.io.IOException;

/**
 * Raised by {@link RateLimitInterceptor} on HTTP 429 so web3j surfaces it as a
 * distinct type instead of a generic connection error.
 */
public class RateLimitedIOException extends IOException {

    private final String retryAfter;

    public RateLimitedIOException(String host, String retryAfter) {
        super("HTTP 429 from " + host + (retryAfter != null ? " (Retry-After: " + retryAfter + ")" : ""));
        this.retryAfter = retryAfter;
    }

    public String getRetryAfter() {
        return retryAfter;
    }
}
