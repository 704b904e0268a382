package com.polygonmev.arb.domain;

/**
 * Final result of one cycle's execution attempt.
 */
public enum ExecutionOutcome {
    SUCCESS,
    REVERTED,
    TIMED_OUT,
    SIMULATION_REJECTED,
    PRECHECK_FAILED,
    UNAFFORDABLE,
    BUILD_FAILED,
    SUBMISSION_FAILED;

    /**
     * Whether a signed transaction reached the network.
     */
    public boolean wasSubmitted() {
        return this == SUCCESS || this == REVERTED || this == TIMED_OUT;
    }
}
