package com.polygonmev.arb.infra.rpc;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.response.EthBlock;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthGetTransactionReceipt;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.EthTransaction;
import org.web3j.protocol.core.methods.response.Transaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;

import java.math.BigInteger;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class Web3jChainGateway implements ChainGateway {

    private final EndpointFailoverManager failoverManager;

    @Override
    public BigInteger pendingTransactionCount(String address) {
        return failoverManager.execute("eth_getTransactionCount", web3j ->
                checked("eth_getTransactionCount",
                        web3j.ethGetTransactionCount(address, DefaultBlockParameterName.PENDING).send())
                        .getTransactionCount());
    }

    @Override
    public BigInteger blockNumber() {
        return failoverManager.execute("eth_blockNumber", web3j ->
                checked("eth_blockNumber", web3j.ethBlockNumber().send()).getBlockNumber());
    }

    @Override
    public BigInteger gasPrice() {
        return failoverManager.execute("eth_gasPrice", web3j ->
                checked("eth_gasPrice", web3j.ethGasPrice().send()).getGasPrice());
    }

    @Override
    public Optional<BigInteger> latestBaseFee() {
        return failoverManager.execute("eth_getBlockByNumber", web3j -> {
            EthBlock response = checked("eth_getBlockByNumber",
                    web3j.ethGetBlockByNumber(DefaultBlockParameterName.LATEST, false).send());
            EthBlock.Block block = response.getBlock();
            if (block == null || block.getBaseFeePerGasRaw() == null) {
                return Optional.empty();
            }
            return Optional.of(block.getBaseFeePerGas());
        });
    }

    @Override
    public CallOutcome call(String from, String to, String data, BigInteger value) {
        return failoverManager.execute("eth_call", web3j -> {
            org.web3j.protocol.core.methods.request.Transaction request =
                    org.web3j.protocol.core.methods.request.Transaction.createFunctionCallTransaction(
                            from, null, null, null, to, value, data);
            EthCall response = web3j.ethCall(request, DefaultBlockParameterName.LATEST).send();
            if (!response.hasError()) {
                return CallOutcome.ok(response.getValue());
            }
            RpcErrorKind kind = RpcFailureClassifier.classify(response.getError());
            if (kind == RpcErrorKind.RATE_LIMITED || kind == RpcErrorKind.TRANSIENT) {
                throw RpcFailureClassifier.toException("eth_call", response.getError());
            }
            return CallOutcome.failed(kind, response.getError().getMessage());
        });
    }

    @Override
    public String sendRawTransaction(String signedTransactionHex) {
        return failoverManager.execute("eth_sendRawTransaction", web3j -> {
            EthSendTransaction response = checked("eth_sendRawTransaction",
                    web3j.ethSendRawTransaction(signedTransactionHex).send());
            return response.getTransactionHash();
        });
    }

    @Override
    public Optional<TransactionReceipt> transactionReceipt(String txHash) {
        return failoverManager.execute("eth_getTransactionReceipt", web3j -> {
            EthGetTransactionReceipt response = checked("eth_getTransactionReceipt",
                    web3j.ethGetTransactionReceipt(txHash).send());
            return response.getTransactionReceipt();
        });
    }

    @Override
    public Optional<Transaction> transaction(String txHash) {
        return failoverManager.execute("eth_getTransactionByHash", web3j -> {
            EthTransaction response = checked("eth_getTransactionByHash",
                    web3j.ethGetTransactionByHash(txHash).send());
            return response.getTransaction();
        });
    }

    private static <R extends Response<?>> R checked(String operation, R response) {
        if (response.hasError()) {
            throw RpcFailureClassifier.toException(operation, response.getError());
        }
        return response;
    }
}
