package com.polygonmev.arb.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Instant;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One upstream JSON-RPC access point. Counters are updated by every call that
 * goes through it.
 */
@Getter
@RequiredArgsConstructor
public class EndpointTier {

    private final String name;
    private final int priorityRank;
    private final String httpUrl;
    private final String wsUrl;
    private final Set<EndpointCapability> capabilities;

    private final AtomicLong requestCount = new AtomicLong();
    private final AtomicLong failureCount = new AtomicLong();
    private final AtomicReference<Instant> lastFailureTime = new AtomicReference<>();

    public void recordRequest() {
        requestCount.incrementAndGet();
    }

    public void recordFailure(Instant at) {
        failureCount.incrementAndGet();
        lastFailureTime.set(at);
    }

    public boolean supports(EndpointCapability capability) {
        return capabilities.contains(capability);
    }

    public boolean hasWebSocket() {
        return wsUrl != null && !wsUrl.isBlank() && supports(EndpointCapability.SUBSCRIBE);
    }

    public double successRate() {
        long total = requestCount.get();
        if (total == 0) {
            return 100.0;
        }
        return Math.max(0, total - failureCount.get()) * 100.0 / total;
    }

    public TierStatus status(boolean current) {
        return new TierStatus(name, priorityRank, requestCount.get(), failureCount.get(),
                successRate(), lastFailureTime.get(), current);
    }

    public record TierStatus(String name, int priorityRank, long requests, long failures,
                             double successRate, Instant lastFailure, boolean current) {
    }
}
