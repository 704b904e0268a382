package com.polygonmev.arb.infra.alert;

import lombok.extern.slf4j.Slf4j;

/**
 * Used when no webhook is configured.
 */
@Slf4j
public class LoggingAlertNotifier implements AlertNotifier {

    @Override
    public void notify(String subject, String body, AlertPriority priority) {
        if (priority == AlertPriority.NORMAL) {
            log.info("[ALERT] {} | {}", subject, body);
        } else {
            log.warn("[ALERT][{}] {} | {}", priority, subject, body);
        }
    }
}
