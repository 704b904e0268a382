package com.polygonmev.arb.infra.rpc;

import com.polygonmev.arb.domain.EndpointTier;
import org.web3j.protocol.Web3j;

@FunctionalInterface
public interface TierClientFactory {

    Web3j create(EndpointTier tier);
}
