package com.polygonmev.arb.core;

import com.polygonmev.arb.domain.EndpointTier;
import com.polygonmev.arb.infra.rpc.EndpointFailoverManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Owns the long-lived worker threads: the decision loop and the mempool feed.
 * Started once the context is refreshed; on stop both loops are signalled and
 * joined.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EngineRunner implements SmartLifecycle {

    private static final long JOIN_TIMEOUT_MS = 10_000;

    private final OpportunityScheduler scheduler;
    private final MempoolFeed mempoolFeed;
    private final EndpointFailoverManager failoverManager;
    private final EngineStats stats;

    private final CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("engine-");
    private final List<Thread> workers = new ArrayList<>();
    private volatile boolean running;

    @Override
    public synchronized void start() {
        verifyEndpoints();

        workers.add(threadFactory.newThread(scheduler::run));
        if (mempoolFeed.isEnabled()) {
            workers.add(threadFactory.newThread(mempoolFeed::run));
        } else {
            log.info("[MEMPOOL] Feed disabled");
        }
        workers.forEach(Thread::start);
        running = true;
        log.info("🚀 Engine started with {} workers on tier {}", workers.size(),
                failoverManager.currentTier().getName());
    }

    @Override
    public synchronized void stop() {
        log.info("Stopping engine...");
        scheduler.stop();
        mempoolFeed.stop();
        for (Thread worker : workers) {
            if (worker == Thread.currentThread()) {
                continue;
            }
            try {
                worker.join(JOIN_TIMEOUT_MS);
                if (worker.isAlive()) {
                    log.warn("Worker {} did not stop in time, interrupting", worker.getName());
                    worker.interrupt();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        workers.clear();
        running = false;
        log.info("Engine stopped. Stats: {}", stats.snapshot());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Fails startup unless at least one configured tier answers.
     */
    private void verifyEndpoints() {
        if (!failoverManager.hasTiers()) {
            throw new IllegalStateException("No RPC endpoint tiers configured (engine.endpoints.tiers)");
        }
        for (EndpointTier tier : failoverManager.fallbackSequence()) {
            if (failoverManager.probe(tier)) {
                if (tier != failoverManager.currentTier()) {
                    failoverManager.force(tier.getName());
                }
                return;
            }
            log.warn("[FAILOVER] Tier {} is not reachable", tier.getName());
        }
        throw new IllegalStateException("No RPC endpoint tier is reachable");
    }
}
