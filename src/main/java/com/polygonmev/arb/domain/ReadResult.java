package com.polygonmev.arb.domain;

/**
 * Result of one batched read. {@code returnData} is hex ("0x...") and empty on failure.
 */
public record ReadResult(boolean success, String returnData) {

    public static final ReadResult FAILED = new ReadResult(false, "0x");

    public static ReadResult ok(String returnData) {
        return new ReadResult(true, returnData);
    }
}
