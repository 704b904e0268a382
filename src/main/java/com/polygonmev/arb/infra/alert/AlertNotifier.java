package com.polygonmev.arb.infra.alert;

/**
 * Fire-and-forget operator notification. Implementations must not throw.
 */
public interface AlertNotifier {

    void notify(String subject, String body, AlertPriority priority);
}
