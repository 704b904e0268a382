package com.polygonmev.arb.domain;

/**
 * Strategy families the engine can execute. The priority is fixed per kind and
 * is only consulted when two opportunities have near-identical profit.
 */
public enum StrategyKind {
    SANDWICH(5, true),
    FLASHLOAN(4, false),
    LIQUIDATION(4, false),
    TRIANGULAR(3, false),
    DIRECT(2, false);

    private final int priority;
    private final boolean timeCritical;

    StrategyKind(int priority, boolean timeCritical) {
        this.priority = priority;
        this.timeCritical = timeCritical;
    }

    public int priority() {
        return priority;
    }

    /**
     * Time-critical kinds compete with a reference transaction for ordering and
     * must outbid its fee.
     */
    public boolean isTimeCritical() {
        return timeCritical;
    }
}
