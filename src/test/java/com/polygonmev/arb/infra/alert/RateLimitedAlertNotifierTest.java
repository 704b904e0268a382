package com.polygonmev.arb.infra.alert;

import com.polygonmev.arb.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RateLimitedAlertNotifierTest {

    private final AlertNotifier delegate = mock(AlertNotifier.class);
    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T00:00:00Z"));
    private final RateLimitedAlertNotifier notifier = new RateLimitedAlertNotifier(delegate, Duration.ofMinutes(5), clock);

    @Test
    void testRepeatsInsideIntervalAreSuppressed() {
        notifier.notify("RPC degraded", "tier2", AlertPriority.HIGH);
        clock.advance(Duration.ofMinutes(1));
        notifier.notify("RPC degraded", "tier3", AlertPriority.HIGH);
        notifier.notify("Other", "x", AlertPriority.NORMAL);

        verify(delegate).notify("RPC degraded", "tier2", AlertPriority.HIGH);
        verify(delegate, never()).notify("RPC degraded", "tier3", AlertPriority.HIGH);
        verify(delegate).notify("Other", "x", AlertPriority.NORMAL);

        clock.advance(Duration.ofMinutes(4));
        notifier.notify("RPC degraded", "tier3", AlertPriority.HIGH);
        verify(delegate).notify("RPC degraded", "tier3", AlertPriority.HIGH);
    }

    @Test
    void testCriticalAlwaysPasses() {
        notifier.notify("KILL SWITCH ACTIVATED", "a", AlertPriority.CRITICAL);
        notifier.notify("KILL SWITCH ACTIVATED", "b", AlertPriority.CRITICAL);

        verify(delegate, times(2)).notify(eq("KILL SWITCH ACTIVATED"), anyString(), eq(AlertPriority.CRITICAL));
    }

    @Test
    void testDelegateFailureIsContained() {
        doThrow(new IllegalStateException("smtp down")).when(delegate).notify(anyString(), anyString(), any());

        assertDoesNotThrow(() -> notifier.notify("subject", "body", AlertPriority.CRITICAL));
    }
}
