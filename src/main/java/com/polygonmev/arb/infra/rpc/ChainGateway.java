package com.polygonmev.arb.infra.rpc;

import org.web3j.protocol.core.methods.response.Transaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;

import java.math.BigInteger;
import java.util.Optional;

/**
 * The JSON-RPC operations the engine needs, routed through the active tier.
 * Failures surface as {@link RpcCallException} or {@link EndpointsExhaustedException}.
 */
public interface ChainGateway {

    /**
     * Confirmed plus pending transaction count of {@code address}.
     */
    BigInteger pendingTransactionCount(String address);

    BigInteger blockNumber();

    BigInteger gasPrice();

    /**
     * Base fee of the latest block; empty on pre-London chains.
     */
    Optional<BigInteger> latestBaseFee();

    CallOutcome call(String from, String to, String data, BigInteger value);

    /**
     * @return transaction hash
     */
    String sendRawTransaction(String signedTransactionHex);

    Optional<TransactionReceipt> transactionReceipt(String txHash);

    Optional<Transaction> transaction(String txHash);
}
