package com.polygonmev.arb.core;

import lombok.Getter;

/**
 * Raised when an execution is attempted while the kill switch is tripped.
 */
@Getter
public class RiskTrippedException extends RuntimeException {

    private final String tripReason;

    public RiskTrippedException(String tripReason) {
        super("Kill switch is active: " + tripReason);
        this.tripReason = tripReason;
    }
}
