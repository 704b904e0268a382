package com.polygonmev.arb.infra.rpc;

import com.polygonmev.arb.config.EngineProperties;
import com.polygonmev.arb.domain.EndpointTier;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.methods.response.EthBlockNumber;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Multi-tier RPC access with rate-limit failover.
 *
 * <p>Tiers are walked in the configured fallback sequence. An explicit rate-limit
 * signal moves the process-wide current-tier pointer one step down; any other
 * retryable failure is retried on the same tier a bounded number of times and
 * then surfaced. The pointer never moves back up on its own: {@link #resetToPrimary()}
 * or {@link #force(String)} have to be called.
 *
 * <p>The pointer is a single atomic index, so reads are lock-free and a demotion
 * is visible to every subsequent call.
 */
@Slf4j
@Service
public class EndpointFailoverManager {

    private final List<EndpointTier> fallbackSequence;
    private final Map<String, EndpointTier> tiersByName;
    private final AtomicInteger currentIndex = new AtomicInteger();
    private final Map<String, Web3j> clients = new ConcurrentHashMap<>();

    private final TierClientFactory clientFactory;
    private final Clock clock;
    private final int maxAttemptsPerTier;
    private final Duration retryDelay;

    public EndpointFailoverManager(EngineProperties properties, TierClientFactory clientFactory, Clock clock) {
        this.clientFactory = clientFactory;
        this.clock = clock;
        this.maxAttemptsPerTier = properties.endpoints().maxAttemptsPerTier();
        this.retryDelay = properties.endpoints().retryDelay();

        Map<String, EndpointTier> byName = new LinkedHashMap<>();
        for (EngineProperties.Tier tier : properties.endpoints().tiers()) {
            byName.put(tier.name(), new EndpointTier(tier.name(), tier.priority(), tier.httpUrl(), tier.wsUrl(),
                    tier.capabilities()));
        }
        this.tiersByName = Map.copyOf(byName);

        List<EndpointTier> sequence = new ArrayList<>();
        for (String name : properties.endpoints().fallbackSequence()) {
            EndpointTier tier = byName.get(name);
            if (tier == null) {
                throw new IllegalArgumentException("Fallback sequence references unknown tier: " + name);
            }
            sequence.add(tier);
        }
        this.fallbackSequence = List.copyOf(sequence);

        log.info("RPC failover initialized with {} tiers, sequence {}", fallbackSequence.size(),
                fallbackSequence.stream().map(EndpointTier::getName).toList());
    }

    public boolean hasTiers() {
        return !fallbackSequence.isEmpty();
    }

    public EndpointTier currentTier() {
        if (fallbackSequence.isEmpty()) {
            throw new IllegalStateException("No RPC tiers configured");
        }
        return fallbackSequence.get(currentIndex.get());
    }

    public TierConnection acquire() {
        EndpointTier tier = currentTier();
        return new TierConnection(tier, client(tier));
    }

    /**
     * Runs {@code operation} against the current tier, retrying transient failures
     * on the same tier and following rate-limit failover.
     *
     * @throws RpcCallException            non-retryable failure or retries used up
     * @throws EndpointsExhaustedException rate limited on the last tier
     */
    public <T> T execute(String operation, RpcOperation<T> call) {
        while (true) {
            TierConnection connection = acquire();
            EndpointTier tier = connection.tier();

            for (int attempt = 1; ; attempt++) {
                tier.recordRequest();
                RpcCallException failure;
                try {
                    return call.call(connection.web3j());
                } catch (IOException | RpcCallException e) {
                    failure = RpcFailureClassifier.toException(operation, e);
                }

                if (failure.getKind() == RpcErrorKind.RATE_LIMITED) {
                    reportFailure(tier, failure);
                    break;
                }

                tier.recordFailure(clock.instant());
                if (!failure.getKind().isRetryable() || attempt >= maxAttemptsPerTier) {
                    throw failure;
                }
                log.debug("[FAILOVER] {} failed on {} (attempt {}/{}): {}", operation, tier.getName(), attempt,
                        maxAttemptsPerTier, failure.getMessage());
                pause(operation);
            }
        }
    }

    /**
     * Records a failed call. A rate-limit failure on the current tier advances the
     * pointer to the next tier in the sequence.
     *
     * @throws EndpointsExhaustedException when the failing tier is the last one
     */
    public void reportFailure(EndpointTier tier, RpcCallException error) {
        tier.recordFailure(clock.instant());
        if (error.getKind() != RpcErrorKind.RATE_LIMITED) {
            return;
        }

        int failedIndex = fallbackSequence.indexOf(tier);
        log.warn("[FAILOVER] Rate limit on {}: {}", tier.getName(), error.getMessage());

        if (failedIndex + 1 >= fallbackSequence.size()) {
            log.error("[FAILOVER] All RPC tiers exhausted!");
            throw new EndpointsExhaustedException(tier.getName(), error);
        }
        if (currentIndex.compareAndSet(failedIndex, failedIndex + 1)) {
            log.info("[FAILOVER] Falling back to {}", fallbackSequence.get(failedIndex + 1).getName());
        }
    }

    public void force(String tierName) {
        EndpointTier tier = tiersByName.get(tierName);
        int index = tier == null ? -1 : fallbackSequence.indexOf(tier);
        if (index < 0) {
            throw new IllegalArgumentException("Invalid tier: " + tierName);
        }
        currentIndex.set(index);
        log.info("[FAILOVER] Forced switch to {}", tierName);
    }

    public void resetToPrimary() {
        int previous = currentIndex.getAndSet(0);
        if (previous != 0) {
            log.info("[FAILOVER] Reset to primary tier {}", fallbackSequence.get(0).getName());
        }
    }

    public boolean isHealthy() {
        return hasTiers() && probe(currentTier());
    }

    /**
     * One cheap request against a specific tier, outside the failover path.
     */
    public boolean probe(EndpointTier tier) {
        tier.recordRequest();
        try {
            EthBlockNumber response = client(tier).ethBlockNumber().send();
            if (response.hasError()) {
                tier.recordFailure(clock.instant());
                return false;
            }
            return true;
        } catch (IOException | RuntimeException e) {
            tier.recordFailure(clock.instant());
            log.debug("[FAILOVER] Probe of {} failed: {}", tier.getName(), e.getMessage());
            return false;
        }
    }

    /**
     * The tier to open the pending-transaction subscription on: the current tier
     * if it can stream, otherwise the first streaming tier in the sequence.
     */
    public Optional<EndpointTier> subscriptionTier() {
        if (!hasTiers()) {
            return Optional.empty();
        }
        EndpointTier current = currentTier();
        if (current.hasWebSocket()) {
            return Optional.of(current);
        }
        return fallbackSequence.stream().filter(EndpointTier::hasWebSocket).findFirst();
    }

    public List<EndpointTier> fallbackSequence() {
        return fallbackSequence;
    }

    public EndpointTier primaryTier() {
        return fallbackSequence.get(0);
    }

    public List<EndpointTier.TierStatus> tierStatus() {
        EndpointTier current = hasTiers() ? currentTier() : null;
        return fallbackSequence.stream().map(t -> t.status(t == current)).toList();
    }

    private Web3j client(EndpointTier tier) {
        return clients.computeIfAbsent(tier.getName(), name -> clientFactory.create(tier));
    }

    private void pause(String operation) {
        try {
            Thread.sleep(retryDelay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcCallException(RpcErrorKind.TRANSIENT, operation, "interrupted while retrying", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        clients.values().forEach(Web3j::shutdown);
        clients.clear();
    }
}
