package com.polygonmev.arb.infra.multicall;

import com.polygonmev.arb.domain.ReadCall;
import com.polygonmev.arb.domain.ReadResult;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.Utils;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.DynamicStruct;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.utils.Numeric;

import java.util.List;

/**
 * ABI codec for Multicall3 {@code aggregate3((address,bool,bytes)[])}. Every call
 * is sent with {@code allowFailure = true}.
 */
public final class Multicall3Codec {

    // keccak256("aggregate3((address,bool,bytes)[])")[0:4]
    public static final String AGGREGATE3_SELECTOR = "0x82ad56cb";

    private static final List<TypeReference<?>> AGGREGATE3_OUTPUTS = List.of(
            new TypeReference<DynamicArray<Result>>() {
            });

    /**
     * {@code Multicall3.Call3}.
     */
    public static class Call3 extends DynamicStruct {

        public Call3(Address target, Bool allowFailure, DynamicBytes callData) {
            super(target, allowFailure, callData);
        }

        public Call3(ReadCall call) {
            this(new Address(call.target()), new Bool(true),
                    new DynamicBytes(Numeric.hexStringToByteArray(call.callData())));
        }
    }

    /**
     * {@code Multicall3.Result}.
     */
    public static class Result extends DynamicStruct {

        private final boolean success;
        private final byte[] returnData;

        public Result(Bool success, DynamicBytes returnData) {
            super(success, returnData);
            this.success = success.getValue();
            this.returnData = returnData.getValue();
        }

        public Result(boolean success, byte[] returnData) {
            this(new Bool(success), new DynamicBytes(returnData));
        }

        ReadResult toReadResult() {
            return success ? ReadResult.ok(Numeric.toHexString(returnData)) : ReadResult.FAILED;
        }
    }

    private Multicall3Codec() {
    }

    public static String encodeAggregate3(List<ReadCall> calls) {
        return FunctionEncoder.encode(aggregate3(calls));
    }

    /**
     * Decodes the {@code (bool success, bytes returnData)[]} return value.
     *
     * @throws IllegalArgumentException on malformed return data
     */
    @SuppressWarnings("unchecked")
    public static List<ReadResult> decodeAggregate3(String returnData) {
        List<Type> decoded;
        try {
            decoded = FunctionReturnDecoder.decode(returnData, Utils.convert(AGGREGATE3_OUTPUTS));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Malformed aggregate3 return data", e);
        }
        if (decoded.isEmpty()) {
            throw new IllegalArgumentException("Empty aggregate3 return data");
        }
        List<Result> results = ((DynamicArray<Result>) decoded.get(0)).getValue();
        return results.stream().map(Result::toReadResult).toList();
    }

    private static Function aggregate3(List<ReadCall> calls) {
        List<Call3> call3s = calls.stream().map(Call3::new).toList();
        return new Function("aggregate3", List.of(new DynamicArray<>(Call3.class, call3s)), AGGREGATE3_OUTPUTS);
    }
}
