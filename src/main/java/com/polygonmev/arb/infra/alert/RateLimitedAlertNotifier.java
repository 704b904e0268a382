package com.polygonmev.arb.infra.alert;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Drops repeats of the same subject inside {@code minInterval}. Critical alerts
 * always go through.
 */
@Slf4j
public class RateLimitedAlertNotifier implements AlertNotifier {

    private final AlertNotifier delegate;
    private final Duration minInterval;
    private final Clock clock;
    private final Map<String, Instant> lastSent = new ConcurrentHashMap<>();

    public RateLimitedAlertNotifier(AlertNotifier delegate, Duration minInterval, Clock clock) {
        this.delegate = delegate;
        this.minInterval = minInterval;
        this.clock = clock;
    }

    @Override
    public void notify(String subject, String body, AlertPriority priority) {
        Instant now = clock.instant();
        if (priority != AlertPriority.CRITICAL) {
            boolean[] allowed = {false};
            lastSent.compute(subject, (key, previous) -> {
                if (previous == null || !now.isBefore(previous.plus(minInterval))) {
                    allowed[0] = true;
                    return now;
                }
                return previous;
            });
            if (!allowed[0]) {
                log.debug("[ALERT] Suppressed repeated alert '{}'", subject);
                return;
            }
        } else {
            lastSent.put(subject, now);
        }

        try {
            delegate.notify(subject, body, priority);
        } catch (RuntimeException e) {
            log.error("[ALERT] Notifier failed for '{}'", subject, e);
        }
    }
}
