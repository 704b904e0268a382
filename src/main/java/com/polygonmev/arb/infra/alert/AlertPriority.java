package com.polygonmev.arb.infra.alert;

public enum AlertPriority {
    NORMAL,
    HIGH,
    /**
     * Never rate limited.
     */
    CRITICAL
}
