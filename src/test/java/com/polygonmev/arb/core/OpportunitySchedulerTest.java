package com.polygonmev.arb.core;

import com.polygonmev.arb.config.EngineProperties;
import com.polygonmev.arb.domain.ExecutionOutcome;
import com.polygonmev.arb.domain.ExecutionReport;
import com.polygonmev.arb.domain.Opportunity;
import com.polygonmev.arb.domain.StrategyKind;
import com.polygonmev.arb.infra.rpc.EndpointsExhaustedException;
import com.polygonmev.arb.support.Fixtures;
import com.polygonmev.arb.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class OpportunitySchedulerTest {

    private final ExecutionEngine executionEngine = mock(ExecutionEngine.class);
    private final EmergencyShutdown emergencyShutdown = mock(EmergencyShutdown.class);
    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T00:00:00Z"));
    private final EngineStats stats = new EngineStats(clock);
    private final ConfidenceScorer scorer = new HeuristicConfidenceScorer();
    private OpportunityScheduler scheduler;

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    @Test
    void testPriorityWinsNearTieAndGoesToItsProducer() {
        StrategyProducer direct = producer(StrategyKind.DIRECT, Fixtures.directOpportunity("B", "51").withConfidence(0.9));
        StrategyProducer sandwich = producer(StrategyKind.SANDWICH, Fixtures.sandwichOpportunity("A", "50").withConfidence(0.8));
        when(executionEngine.execute(anyLong(), any(), any())).thenAnswer(inv -> report(inv.getArgument(1), ExecutionOutcome.SUCCESS));
        scheduler = scheduler(List.of(direct, sandwich), config(false, null));

        ExecutionReport report = scheduler.runCycle().orElseThrow();

        assertEquals("A", report.opportunityId());
        verify(executionEngine).execute(eq(1L), argThat(o -> o.getId().equals("A")), same(sandwich));
        assertEquals(1, stats.snapshot().successfulTrades());
    }

    @Test
    void testDetectionTimeComesFromEngineClock() {
        Instant seen = Instant.parse("2024-04-30T23:59:58Z");
        StrategyProducer stamped = producer(StrategyKind.DIRECT, Fixtures.directOpportunity("stamped", "30").withDetectedAt(seen));
        StrategyProducer unstamped = producer(StrategyKind.SANDWICH, Fixtures.sandwichOpportunity("unstamped", "80"));
        when(executionEngine.execute(anyLong(), any(), any())).thenAnswer(inv -> report(inv.getArgument(1), ExecutionOutcome.SUCCESS));
        scheduler = scheduler(List.of(stamped, unstamped), config(true, null));
        clock.advance(Duration.ofSeconds(7));

        scheduler.runCycle();

        verify(executionEngine).execute(anyLong(),
                argThat(o -> o.getId().equals("unstamped") && o.getDetectedAt().equals(clock.instant())), same(unstamped));
        assertNull(Fixtures.sandwichOpportunity("x", "1").getDetectedAt(), "no wall-clock default");

        scheduler.stop();
        scheduler = scheduler(List.of(stamped), config(true, null));
        scheduler.runCycle();
        verify(executionEngine).execute(anyLong(), argThat(o -> seen.equals(o.getDetectedAt())), same(stamped));
    }

    @Test
    void testUnscoredOpportunitiesAreScored() {
        StrategyProducer low = producer(StrategyKind.DIRECT, Fixtures.directOpportunity("low", "5").withConfidence(null));
        scheduler = scheduler(List.of(low), config(true, null));

        assertTrue(scheduler.runCycle().isEmpty(), "heuristic 0.5 is under the 0.75 threshold");

        StrategyProducer mid = producer(StrategyKind.DIRECT, Fixtures.directOpportunity("mid", "15").withConfidence(null));
        when(executionEngine.execute(anyLong(), any(), any())).thenAnswer(inv -> report(inv.getArgument(1), ExecutionOutcome.SUCCESS));
        scheduler = scheduler(List.of(mid), config(true, null));

        assertTrue(scheduler.runCycle().isEmpty(), "heuristic 0.7 is still under the threshold");
        verifyNoInteractions(executionEngine);
        assertEquals(2, stats.snapshot().cycles());
        assertEquals(0, stats.snapshot().opportunitiesSelected());
    }

    @Test
    void testSlowProducerIsDroppedFromCycle() {
        CountDownLatch release = new CountDownLatch(1);
        StrategyProducer slow = mock(StrategyProducer.class);
        when(slow.kind()).thenReturn(StrategyKind.SANDWICH);
        when(slow.findOpportunity()).thenAnswer(inv -> {
            release.await(5, TimeUnit.SECONDS);
            return Optional.of(Fixtures.sandwichOpportunity("slow", "1000"));
        });
        StrategyProducer fast = producer(StrategyKind.DIRECT, Fixtures.directOpportunity("fast", "20"));
        when(executionEngine.execute(anyLong(), any(), any())).thenAnswer(inv -> report(inv.getArgument(1), ExecutionOutcome.SUCCESS));
        scheduler = scheduler(List.of(slow, fast), config(false, null));

        ExecutionReport report = scheduler.runCycle().orElseThrow();
        release.countDown();

        assertEquals("fast", report.opportunityId());
    }

    @Test
    void testFailingProducerDoesNotSpoilCycle() {
        StrategyProducer broken = mock(StrategyProducer.class);
        when(broken.kind()).thenReturn(StrategyKind.FLASHLOAN);
        when(broken.findOpportunity()).thenThrow(new IllegalStateException("reserves unavailable"));
        StrategyProducer fine = producer(StrategyKind.DIRECT, Fixtures.directOpportunity("fine", "20"));
        when(executionEngine.execute(anyLong(), any(), any())).thenAnswer(inv -> report(inv.getArgument(1), ExecutionOutcome.SUCCESS));

        scheduler = scheduler(List.of(broken, fine), config(true, null));
        assertEquals("fine", scheduler.runCycle().orElseThrow().opportunityId());

        scheduler = scheduler(List.of(broken, fine), config(false, null));
        assertEquals("fine", scheduler.runCycle().orElseThrow().opportunityId());
    }

    @Test
    void testDisabledStrategyIsNeverPolled() {
        StrategyProducer sandwich = producer(StrategyKind.SANDWICH, Fixtures.sandwichOpportunity("A", "50"));
        scheduler = scheduler(List.of(sandwich), config(true, Set.of(StrategyKind.SANDWICH)));

        assertTrue(scheduler.runCycle().isEmpty());
        verify(sandwich, never()).findOpportunity();
    }

    @Test
    void testTrippedRiskEndsLoopWithEmergencyShutdown() {
        StrategyProducer direct = producer(StrategyKind.DIRECT, Fixtures.directOpportunity("B", "20"));
        when(executionEngine.execute(anyLong(), any(), any())).thenThrow(new RiskTrippedException("Daily loss limit exceeded: $120"));
        scheduler = scheduler(List.of(direct), config(true, null));

        scheduler.run();

        assertFalse(scheduler.isRunning());
        verify(emergencyShutdown, times(1)).trigger(contains("Daily loss limit exceeded"));
    }

    @Test
    void testExhaustedEndpointsEndLoopWithEmergencyShutdown() {
        StrategyProducer direct = mock(StrategyProducer.class);
        when(direct.kind()).thenReturn(StrategyKind.DIRECT);
        when(direct.findOpportunity()).thenReturn(Optional.of(Fixtures.directOpportunity("B", "20")));
        when(executionEngine.execute(anyLong(), any(), any()))
                .thenThrow(new IllegalStateException("one bad cycle"))
                .thenThrow(new EndpointsExhaustedException("tier3", null));
        scheduler = scheduler(List.of(direct), config(true, null));

        scheduler.run();

        verify(executionEngine, times(2)).execute(anyLong(), any(), any());
        verify(emergencyShutdown).trigger(contains("tier3"));
    }

    private OpportunityScheduler scheduler(List<StrategyProducer> producers, EngineProperties.Scheduler config) {
        return new OpportunityScheduler(producers, scorer, executionEngine, stats, emergencyShutdown, clock, config);
    }

    private static EngineProperties.Scheduler config(boolean sequential, Set<StrategyKind> disabled) {
        return new EngineProperties.Scheduler(0.75, new BigDecimal("2"), Duration.ofMillis(1),
                Duration.ofMillis(200), sequential, disabled);
    }

    private static StrategyProducer producer(StrategyKind kind, Opportunity opportunity) {
        StrategyProducer producer = mock(StrategyProducer.class);
        when(producer.kind()).thenReturn(kind);
        when(producer.findOpportunity()).thenReturn(Optional.of(opportunity));
        return producer;
    }

    private static ExecutionReport report(Opportunity opportunity, ExecutionOutcome outcome) {
        return new ExecutionReport(1, opportunity.getId(), opportunity.getKind(), opportunity.getExpectedProfitUsd(),
                outcome, "0xhash", BigDecimal.ONE, BigDecimal.ZERO);
    }
}
