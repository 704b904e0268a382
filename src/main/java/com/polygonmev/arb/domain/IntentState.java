package com.polygonmev.arb.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a {@link TransactionIntent}.
 */
public enum IntentState {
    BUILT,
    SIMULATION_PASSED,
    SIMULATION_REJECTED,
    SUBMITTED,
    PENDING,
    CONFIRMED_SUCCESS,
    CONFIRMED_REVERTED,
    STUCK,
    SPED_UP,
    CANCELLED,
    DROPPED,
    FAILED;

    public Set<IntentState> successors() {
        return switch (this) {
            case BUILT -> EnumSet.of(SIMULATION_PASSED, SIMULATION_REJECTED, FAILED);
            case SIMULATION_PASSED -> EnumSet.of(SUBMITTED, FAILED);
            case SUBMITTED -> EnumSet.of(PENDING, FAILED);
            case PENDING -> EnumSet.of(CONFIRMED_SUCCESS, CONFIRMED_REVERTED, STUCK);
            case STUCK -> EnumSet.of(SPED_UP, CANCELLED, DROPPED, CONFIRMED_SUCCESS, CONFIRMED_REVERTED);
            case SPED_UP -> EnumSet.of(PENDING, STUCK, CONFIRMED_SUCCESS, CONFIRMED_REVERTED);
            default -> EnumSet.noneOf(IntentState.class);
        };
    }

    public boolean isTerminal() {
        return successors().isEmpty();
    }
}
