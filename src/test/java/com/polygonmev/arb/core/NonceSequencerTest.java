package com.polygonmev.arb.core;

import com.polygonmev.arb.domain.InFlightNonce;
import com.polygonmev.arb.infra.rpc.ChainGateway;
import com.polygonmev.arb.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class NonceSequencerTest {

    private static final String ADDRESS = "0x1111111111111111111111111111111111111111";

    private final ChainGateway gateway = mock(ChainGateway.class);
    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T00:00:00Z"));

    @Test
    void testConcurrentAllocationIsContiguousAndUnique() throws Exception {
        when(gateway.pendingTransactionCount(ADDRESS)).thenReturn(BigInteger.valueOf(42));
        NonceSequencer sequencer = new NonceSequencer(gateway, ADDRESS, 10, clock);

        int callers = 50;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<BigInteger>> futures = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                return sequencer.allocate();
            }));
        }
        start.countDown();

        List<BigInteger> nonces = Collections.synchronizedList(new ArrayList<>());
        for (Future<BigInteger> future : futures) {
            nonces.add(future.get(5, TimeUnit.SECONDS));
        }
        pool.shutdown();

        TreeSet<BigInteger> unique = new TreeSet<>(nonces);
        assertEquals(callers, unique.size(), "no nonce handed out twice");
        assertEquals(BigInteger.valueOf(42), unique.first());
        assertEquals(BigInteger.valueOf(42 + callers - 1), unique.last());
        assertEquals(callers, sequencer.pendingCount());
        verify(gateway, atMost(8)).pendingTransactionCount(ADDRESS);
    }

    @Test
    void testConfirmRemovesFromInFlight() {
        when(gateway.pendingTransactionCount(ADDRESS)).thenReturn(BigInteger.ZERO);
        NonceSequencer sequencer = new NonceSequencer(gateway, ADDRESS, 10, clock);

        BigInteger first = sequencer.allocate();
        BigInteger second = sequencer.allocate();
        sequencer.confirm(first);

        assertEquals(1, sequencer.pendingCount());
        assertEquals(second, sequencer.inFlight().get(0).nonce());
        assertEquals(BigInteger.TWO, sequencer.allocate(), "confirming never rewinds the counter");
    }

    @Test
    void testResyncAdoptsNetworkCount() {
        when(gateway.pendingTransactionCount(ADDRESS)).thenReturn(BigInteger.valueOf(5), BigInteger.valueOf(7));
        NonceSequencer sequencer = new NonceSequencer(gateway, ADDRESS, 10, clock);

        sequencer.allocate();
        sequencer.allocate();
        sequencer.allocate();
        sequencer.resync();

        assertEquals(0, sequencer.pendingCount());
        assertEquals(BigInteger.valueOf(7), sequencer.allocate());
    }

    @Test
    void testResyncKeepsBroadcastNoncesTheNetworkHolds() {
        when(gateway.pendingTransactionCount(ADDRESS)).thenReturn(BigInteger.valueOf(5), BigInteger.valueOf(6));
        NonceSequencer sequencer = new NonceSequencer(gateway, ADDRESS, 10, clock);

        BigInteger pending = sequencer.allocate();
        BigInteger unsent = sequencer.allocate();
        sequencer.markSubmitted(pending, "0xabc", BigInteger.valueOf(100));
        sequencer.resync();

        assertTrue(sequencer.isInFlight(pending));
        assertFalse(sequencer.isInFlight(unsent));
        assertEquals(BigInteger.valueOf(6), sequencer.allocate());
    }

    @Test
    void testStuckNoncesUseBlockThreshold() {
        when(gateway.pendingTransactionCount(ADDRESS)).thenReturn(BigInteger.valueOf(3));
        NonceSequencer sequencer = new NonceSequencer(gateway, ADDRESS, 10, clock);

        BigInteger submitted = sequencer.allocate();
        sequencer.allocate(); // allocated but never submitted
        sequencer.markSubmitted(submitted, "0xabc", BigInteger.valueOf(100));

        assertTrue(sequencer.stuckNonces(BigInteger.valueOf(110)).isEmpty(), "exactly at threshold is not stuck");

        List<InFlightNonce> stuck = sequencer.stuckNonces(BigInteger.valueOf(111));
        assertEquals(1, stuck.size());
        assertEquals(submitted, stuck.get(0).nonce());
        assertEquals("0xabc", stuck.get(0).txHash());
    }

    @Test
    void testReplacementCountsResubmissions() {
        when(gateway.pendingTransactionCount(ADDRESS)).thenReturn(BigInteger.ZERO);
        NonceSequencer sequencer = new NonceSequencer(gateway, ADDRESS, 10, clock);

        BigInteger nonce = sequencer.allocate();
        sequencer.markSubmitted(nonce, "0x01", BigInteger.ONE);
        sequencer.markSubmitted(nonce, "0x02", BigInteger.TEN);

        InFlightNonce entry = sequencer.inFlight().get(0);
        assertEquals("0x02", entry.txHash());
        assertEquals(BigInteger.TEN, entry.submittedBlock());
        assertEquals(1, entry.replacements());
    }

    @Test
    void testCancelDropsNonce() {
        when(gateway.pendingTransactionCount(ADDRESS)).thenReturn(BigInteger.ZERO);
        NonceSequencer sequencer = new NonceSequencer(gateway, ADDRESS, 10, clock);

        BigInteger nonce = sequencer.allocate();
        sequencer.cancel(nonce);

        assertEquals(0, sequencer.pendingCount());
    }
}
