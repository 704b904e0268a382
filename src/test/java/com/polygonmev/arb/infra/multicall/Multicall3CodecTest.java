package com.polygonmev.arb.infra.multicall;

import com.polygonmev.arb.domain.ReadCall;
import com.polygonmev.arb.domain.ReadResult;
import org.junit.jupiter.api.Test;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class Multicall3CodecTest {

    private static final String TOKEN = "0x2791bca1f2de4661ed88a30c99a7a9449aa84174";

    @Test
    void testEncodeSingleCallLayout() {
        String encoded = Multicall3Codec.encodeAggregate3(List.of(new ReadCall(TOKEN, "0x0902f1ac")));
        String body = encoded.substring(10);

        assertTrue(encoded.startsWith(Multicall3Codec.AGGREGATE3_SELECTOR));
        assertEquals(8 * 64, body.length());
        assertEquals(BigInteger.valueOf(32), word(body, 0), "array offset");
        assertEquals(BigInteger.ONE, word(body, 1), "array length");
        assertEquals(BigInteger.valueOf(32), word(body, 2), "first tuple offset");
        assertEquals(Numeric.toBigInt(TOKEN), word(body, 3), "target");
        assertEquals(BigInteger.ONE, word(body, 4), "allowFailure");
        assertEquals(BigInteger.valueOf(96), word(body, 5), "bytes offset");
        assertEquals(BigInteger.valueOf(4), word(body, 6), "bytes length");
        assertTrue(body.substring(7 * 64).startsWith("0902f1ac00000000"));
    }

    @Test
    void testEncodeOffsetsAccountForDataLength() {
        String longData = "0x70a08231" + "00".repeat(32);
        String encoded = Multicall3Codec.encodeAggregate3(List.of(
                new ReadCall(TOKEN, longData), new ReadCall(TOKEN, "0x18160ddd")));
        String body = encoded.substring(10);

        assertEquals(BigInteger.valueOf(64), word(body, 2));
        // first tuple: four words plus 36 bytes of data padded to 64
        assertEquals(BigInteger.valueOf(64 + 4 * 32 + 64), word(body, 3));
    }

    @Test
    void testDecodeMixedResults() {
        String response = Aggregate3Responses.encode(List.of(
                Aggregate3Responses.ok(Aggregate3Responses.uint(7)),
                Aggregate3Responses.failed(),
                Aggregate3Responses.ok("0x")));

        List<ReadResult> results = Multicall3Codec.decodeAggregate3(response);

        assertEquals(3, results.size());
        assertTrue(results.get(0).success());
        assertEquals(BigInteger.valueOf(7), Numeric.toBigInt(results.get(0).returnData()));
        assertFalse(results.get(1).success());
        assertTrue(results.get(2).success());
        assertEquals("0x", results.get(2).returnData());
    }

    @Test
    void testDecodeRejectsTruncatedPayload() {
        String response = Aggregate3Responses.encode(List.of(Aggregate3Responses.ok(Aggregate3Responses.uint(7))));
        String truncated = response.substring(0, response.length() - 64);

        assertThrows(IllegalArgumentException.class, () -> Multicall3Codec.decodeAggregate3(truncated));
        assertThrows(IllegalArgumentException.class, () -> Multicall3Codec.decodeAggregate3("0x"));
    }

    private static BigInteger word(String body, int index) {
        return new BigInteger(body.substring(index * 64, (index + 1) * 64), 16);
    }
}
