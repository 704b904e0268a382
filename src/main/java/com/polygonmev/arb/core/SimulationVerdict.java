package com.polygonmev.arb.core;

public enum SimulationVerdict {
    PASSED,
    /**
     * The dry run reverted or the node refused the transaction outright.
     */
    REJECTED,
    /**
     * The dry run failed for a reason that says nothing about the trade itself.
     */
    AMBIGUOUS
}
