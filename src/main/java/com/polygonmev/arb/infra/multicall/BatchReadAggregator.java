package com.polygonmev.arb.infra.multicall;

import com.polygonmev.arb.config.EngineProperties;
import com.polygonmev.arb.domain.ReadCall;
import com.polygonmev.arb.domain.ReadResult;
import com.polygonmev.arb.infra.rpc.CallOutcome;
import com.polygonmev.arb.infra.rpc.ChainGateway;
import com.polygonmev.arb.infra.rpc.RpcCallException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint112;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint32;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Collapses independent reads into Multicall3 round-trips.
 *
 * <p>Results come back in input order and one per call. A failing call only
 * fails its own entry; a failing round-trip fails the entries of that chunk.
 */
@Slf4j
@Service
public class BatchReadAggregator {

    private static final Function GET_RESERVES = new Function(
            "getReserves",
            List.of(),
            List.of(new TypeReference<Uint112>() {
            }, new TypeReference<Uint112>() {
            }, new TypeReference<Uint32>() {
            }));

    private final ChainGateway gateway;
    private final String multicallAddress;
    private final int chunkSize;

    @Autowired
    public BatchReadAggregator(ChainGateway gateway, EngineProperties properties) {
        this(gateway, properties.multicall().address(), properties.multicall().chunkSize());
    }

    public BatchReadAggregator(ChainGateway gateway, String multicallAddress, int chunkSize) {
        this.gateway = gateway;
        this.multicallAddress = multicallAddress;
        this.chunkSize = chunkSize;
    }

    public List<ReadResult> aggregate(List<ReadCall> calls) {
        if (calls.isEmpty()) {
            return List.of();
        }
        List<ReadResult> results = new ArrayList<>(calls.size());
        for (int from = 0; from < calls.size(); from += chunkSize) {
            List<ReadCall> chunk = calls.subList(from, Math.min(from + chunkSize, calls.size()));
            results.addAll(executeChunk(chunk, from));
        }
        return results;
    }

    /**
     * ERC-20 {@code balanceOf(owner)} for each token; empty where the read failed.
     */
    public List<Optional<BigInteger>> balancesOf(List<String> tokens, String owner) {
        Function balanceOf = new Function(
                "balanceOf",
                List.of(new Address(owner)),
                List.of(new TypeReference<Uint256>() {
                }));
        String callData = FunctionEncoder.encode(balanceOf);
        List<ReadCall> calls = tokens.stream().map(token -> new ReadCall(token, callData)).toList();
        return aggregate(calls).stream()
                .map(result -> decodeOutputs(result, balanceOf).map(values -> values.get(0)))
                .toList();
    }

    /**
     * Uniswap V2 style {@code getReserves()} for each pair; empty where the read failed.
     */
    public List<Optional<Reserves>> reserves(List<String> pairs) {
        String callData = FunctionEncoder.encode(GET_RESERVES);
        List<ReadCall> calls = pairs.stream().map(pair -> new ReadCall(pair, callData)).toList();
        return aggregate(calls).stream()
                .map(result -> decodeOutputs(result, GET_RESERVES)
                        .map(values -> new Reserves(values.get(0), values.get(1), values.get(2).longValue())))
                .toList();
    }

    public record Reserves(BigInteger reserve0, BigInteger reserve1, long blockTimestampLast) {
    }

    private List<ReadResult> executeChunk(List<ReadCall> chunk, int offset) {
        String data = Multicall3Codec.encodeAggregate3(chunk);
        try {
            CallOutcome outcome = gateway.call(null, multicallAddress, data, BigInteger.ZERO);
            if (!outcome.success()) {
                log.warn("[MULTICALL] Chunk at {} ({} calls) failed: {}", offset, chunk.size(),
                        outcome.errorMessage());
                return failedChunk(chunk.size());
            }
            List<ReadResult> decoded = Multicall3Codec.decodeAggregate3(outcome.returnData());
            if (decoded.size() != chunk.size()) {
                log.warn("[MULTICALL] Chunk at {} returned {} results for {} calls", offset, decoded.size(),
                        chunk.size());
                return failedChunk(chunk.size());
            }
            return decoded;
        } catch (RpcCallException | IllegalArgumentException e) {
            log.warn("[MULTICALL] Chunk at {} ({} calls) failed: {}", offset, chunk.size(), e.getMessage());
            return failedChunk(chunk.size());
        }
    }

    private static List<ReadResult> failedChunk(int size) {
        return Collections.nCopies(size, ReadResult.FAILED);
    }

    private static Optional<List<BigInteger>> decodeOutputs(ReadResult result, Function function) {
        if (!result.success()) {
            return Optional.empty();
        }
        try {
            List<Type> decoded = FunctionReturnDecoder.decode(result.returnData(), function.getOutputParameters());
            if (decoded.size() != function.getOutputParameters().size()) {
                return Optional.empty();
            }
            return Optional.of(decoded.stream().map(value -> (BigInteger) value.getValue()).toList());
        } catch (RuntimeException e) {
            log.debug("[MULTICALL] Undecodable {} result {}: {}", function.getName(), result.returnData(),
                    e.getMessage());
            return Optional.empty();
        }
    }
}
