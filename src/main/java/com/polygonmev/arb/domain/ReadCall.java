package com.polygonmev.arb.domain;

/**
 * One read in a batch: the contract to call and the ABI-encoded call data.
 */
public record ReadCall(String target, String callData) {
}
