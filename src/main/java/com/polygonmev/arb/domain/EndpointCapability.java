package com.polygonmev.arb.domain;

public enum EndpointCapability {
    READ,
    WRITE,
    SUBSCRIBE
}
