package com.polygonmev.arb.infra.rpc;

import com.polygonmev.arb.domain.EndpointTier;
import org.web3j.protocol.Web3j;

/**
 * A client bound to one tier. Handles are cheap; the underlying client is
 * shared per tier.
 */
public record TierConnection(EndpointTier tier, Web3j web3j) {
}
