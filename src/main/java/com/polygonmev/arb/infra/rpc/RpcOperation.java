package com.polygonmev.arb.infra.rpc;

import org.web3j.protocol.Web3j;

import java.io.IOException;

@FunctionalInterface
public interface RpcOperation<T> {

    T call(Web3j web3j) throws IOException;
}
