package com.polygonmev.arb.infra.rpc;

import com.polygonmev.arb.config.EngineProperties;
import com.polygonmev.arb.domain.EndpointTier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Periodically checks whether the primary tier answers again and, after a
 * cool-down since its last failure, moves the failover pointer back to it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EndpointHealthProbe {

    private final EndpointFailoverManager failoverManager;
    private final EngineProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${engine.endpoints.health-check.interval:PT60S}",
            initialDelayString = "${engine.endpoints.health-check.interval:PT60S}")
    public void probePrimary() {
        EngineProperties.HealthCheck healthCheck = properties.endpoints().healthCheck();
        if (!healthCheck.enabled() || !failoverManager.hasTiers()) {
            return;
        }

        EndpointTier primary = failoverManager.primaryTier();
        if (failoverManager.currentTier() == primary) {
            return;
        }

        Instant lastFailure = primary.getLastFailureTime().get();
        if (lastFailure != null && lastFailure.plus(healthCheck.primaryCooldown()).isAfter(clock.instant())) {
            log.debug("[FAILOVER] Primary tier {} still cooling down", primary.getName());
            return;
        }

        if (failoverManager.probe(primary)) {
            failoverManager.resetToPrimary();
        } else {
            log.info("[FAILOVER] Primary tier {} still unhealthy, staying on {}", primary.getName(),
                    failoverManager.currentTier().getName());
        }
        failoverManager.tierStatus().forEach(status -> log.debug("[FAILOVER] {}", status));
    }
}
