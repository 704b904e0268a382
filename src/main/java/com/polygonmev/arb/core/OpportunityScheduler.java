package com.polygonmev.arb.core;

import com.polygonmev.arb.config.EngineProperties;
import com.polygonmev.arb.domain.ExecutionReport;
import com.polygonmev.arb.domain.Opportunity;
import com.polygonmev.arb.infra.rpc.EndpointsExhaustedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The decision loop. Each cycle polls every enabled producer, scores what came
 * back, picks one winner and hands it to the {@link ExecutionEngine}.
 *
 * <p>A failed cycle is logged and the loop carries on. Exhausted endpoints and a
 * tripped kill switch end the loop and go to {@link EmergencyShutdown}.
 */
@Slf4j
@Service
public class OpportunityScheduler {

    private final List<StrategyProducer> producers;
    private final ConfidenceScorer confidenceScorer;
    private final ExecutionEngine executionEngine;
    private final EngineStats stats;
    private final EmergencyShutdown emergencyShutdown;
    private final EngineProperties.Scheduler config;
    private final Clock clock;
    private final OpportunityRanker ranker;
    private final ExecutorService pollPool;
    private final AtomicLong cycleCounter = new AtomicLong();

    private volatile boolean running;

    public OpportunityScheduler(ObjectProvider<StrategyProducer> producers, ConfidenceScorer confidenceScorer,
                                ExecutionEngine executionEngine, EngineStats stats,
                                EmergencyShutdown emergencyShutdown, Clock clock, EngineProperties properties) {
        this(producers.orderedStream().toList(), confidenceScorer, executionEngine, stats, emergencyShutdown, clock,
                properties.scheduler());
    }

    OpportunityScheduler(List<StrategyProducer> producers, ConfidenceScorer confidenceScorer,
                         ExecutionEngine executionEngine, EngineStats stats, EmergencyShutdown emergencyShutdown,
                         Clock clock, EngineProperties.Scheduler config) {
        this.producers = producers.stream()
                .filter(p -> !config.disabledStrategies().contains(p.kind()))
                .toList();
        this.confidenceScorer = confidenceScorer;
        this.executionEngine = executionEngine;
        this.stats = stats;
        this.emergencyShutdown = emergencyShutdown;
        this.config = config;
        this.clock = clock;
        this.ranker = new OpportunityRanker(config.minConfidence(), config.similarityBandUsd());

        if (config.sequentialPolling() || this.producers.isEmpty()) {
            this.pollPool = null;
        } else {
            CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("strategy-poll-");
            threadFactory.setDaemon(true);
            this.pollPool = Executors.newFixedThreadPool(this.producers.size(), threadFactory);
        }

        if (this.producers.isEmpty()) {
            log.warn("No strategy producers enabled; the engine will idle");
        } else {
            log.info("Strategies enabled: {}", this.producers.stream().map(StrategyProducer::kind).toList());
        }
    }

    /**
     * Runs cycles until {@link #stop()} or a fatal condition.
     */
    public void run() {
        running = true;
        log.info("Decision loop started (min confidence {}, band ${})", config.minConfidence(),
                config.similarityBandUsd());
        while (running) {
            try {
                runCycle();
            } catch (EndpointsExhaustedException e) {
                log.error("All RPC endpoints exhausted", e);
                running = false;
                emergencyShutdown.trigger(e.getMessage());
                break;
            } catch (RiskTrippedException e) {
                log.error("[KILL-SWITCH] Execution halted: {}", e.getTripReason());
                running = false;
                emergencyShutdown.trigger(e.getMessage());
                break;
            } catch (RuntimeException e) {
                log.error("Cycle {} failed", cycleCounter.get(), e);
            }

            try {
                Thread.sleep(config.cycleDelay().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.info("Decision loop stopped. Stats: {}", stats.snapshot());
    }

    public void stop() {
        running = false;
        if (pollPool != null) {
            pollPool.shutdownNow();
        }
    }

    public boolean isRunning() {
        return running;
    }

    public Optional<ExecutionReport> runCycle() {
        long cycleId = cycleCounter.incrementAndGet();
        List<Candidate> candidates = poll(cycleId);

        Optional<Opportunity> winner = ranker.select(candidates.stream().map(Candidate::opportunity).toList());
        stats.recordCycle(winner.isPresent());
        if (winner.isEmpty()) {
            if (!candidates.isEmpty()) {
                log.debug("Cycle {}: {} opportunities, none above confidence {}", cycleId, candidates.size(),
                        config.minConfidence());
            }
            return Optional.empty();
        }

        Opportunity selected = winner.get();
        StrategyProducer producer = candidates.stream()
                .filter(c -> c.opportunity() == selected)
                .map(Candidate::producer)
                .findFirst()
                .orElseThrow();
        log.info("Cycle {}: selected {} {} (expected ${}, confidence {}) from {} candidates", cycleId,
                selected.getKind(), selected.getId(), selected.getExpectedProfitUsd(), selected.getConfidence(),
                candidates.size());

        ExecutionReport report = executionEngine.execute(cycleId, selected, producer);
        stats.record(report);
        return Optional.of(report);
    }

    private List<Candidate> poll(long cycleId) {
        List<Candidate> found = new ArrayList<>();
        if (pollPool == null) {
            for (StrategyProducer producer : producers) {
                try {
                    producer.findOpportunity().ifPresent(o -> found.add(scored(producer, o)));
                } catch (RuntimeException e) {
                    log.warn("Cycle {}: {} producer failed: {}", cycleId, producer.kind(), e.getMessage());
                }
            }
            return found;
        }

        List<Callable<Optional<Opportunity>>> tasks = producers.stream()
                .<Callable<Optional<Opportunity>>>map(p -> p::findOpportunity)
                .toList();
        List<Future<Optional<Opportunity>>> futures;
        try {
            futures = pollPool.invokeAll(tasks, config.producerTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return found;
        }

        for (int i = 0; i < futures.size(); i++) {
            StrategyProducer producer = producers.get(i);
            try {
                futures.get(i).get().ifPresent(o -> found.add(scored(producer, o)));
            } catch (CancellationException e) {
                log.warn("Cycle {}: {} producer exceeded its {}ms budget", cycleId, producer.kind(),
                        config.producerTimeout().toMillis());
            } catch (ExecutionException e) {
                log.warn("Cycle {}: {} producer failed: {}", cycleId, producer.kind(), e.getCause().getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        return found;
    }

    private Candidate scored(StrategyProducer producer, Opportunity opportunity) {
        if (opportunity.getDetectedAt() == null) {
            opportunity = opportunity.withDetectedAt(clock.instant());
        }
        if (opportunity.isScored()) {
            return new Candidate(producer, opportunity);
        }
        double confidence = confidenceScorer.score(opportunity.getExpectedProfitUsd(), opportunity.getKind());
        return new Candidate(producer, opportunity.withConfidence(confidence));
    }

    private record Candidate(StrategyProducer producer, Opportunity opportunity) {
    }
}
