package com.polygonmev.arb.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polygonmev.arb.config.EngineProperties;
import com.polygonmev.arb.domain.EndpointCapability;
import com.polygonmev.arb.domain.EndpointTier;
import com.polygonmev.arb.domain.PendingSwap;
import com.polygonmev.arb.infra.rpc.ChainGateway;
import com.polygonmev.arb.infra.rpc.EndpointFailoverManager;
import com.polygonmev.arb.support.MutableClock;
import com.polygonmev.arb.support.TestProperties;
import okhttp3.OkHttpClient;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.web3j.protocol.core.methods.response.Transaction;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class MempoolFeedTest {

    private static final BigInteger ONE_NATIVE = BigInteger.TEN.pow(18);
    private static final String SWAP_INPUT = "0x38ed1739" + "00".repeat(64);

    private final EndpointFailoverManager failoverManager = mock(EndpointFailoverManager.class);
    private final ChainGateway gateway = mock(ChainGateway.class);
    private final GasPricer gasPricer = mock(GasPricer.class);
    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T00:00:00Z"));

    private MempoolFeed feed;

    @BeforeEach
    void setUp() {
        when(gasPricer.nativeTokenUsd()).thenReturn(new BigDecimal("0.80"));
        feed = new MempoolFeed(failoverManager, gateway, gasPricer, new OkHttpClient(), new ObjectMapper(), clock,
                TestProperties.defaults());
    }

    @AfterEach
    void tearDown() {
        feed.stop();
    }

    @Test
    void testEvaluateKeepsLargeSwapsOnly() {
        Optional<PendingSwap> swap = feed.evaluate(tx("0xbig", ONE_NATIVE.multiply(BigInteger.valueOf(2_000)), SWAP_INPUT));
        assertTrue(swap.isPresent());
        assertEquals("0x38ed1739", swap.get().selector());
        assertEquals(clock.instant(), swap.get().getSeenAt());

        assertTrue(feed.evaluate(tx("0xsmall", ONE_NATIVE.multiply(BigInteger.valueOf(1_000)), SWAP_INPUT)).isEmpty(),
                "$800 is under the $1000 threshold");
        assertTrue(feed.evaluate(tx("0xtransfer", ONE_NATIVE.multiply(BigInteger.valueOf(5_000)), "0xa9059cbb" + "00".repeat(64))).isEmpty());
        assertTrue(feed.evaluate(tx("0xplain", ONE_NATIVE.multiply(BigInteger.valueOf(5_000)), "0x")).isEmpty());
    }

    @Test
    void testSubscriptionReplySetsState() {
        feed.handleMessage("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0xsub\"}");

        assertEquals(MempoolFeed.FeedState.SUBSCRIBED, feed.state());
    }

    @Test
    void testSubscriptionErrorDisconnects() {
        feed.handleMessage("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0xsub\"}");
        feed.handleMessage("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32601,\"message\":\"not supported\"}}");

        assertEquals(MempoolFeed.FeedState.DISCONNECTED, feed.state());
    }

    @Test
    void testNotificationIsEnrichedIntoCandidate() {
        when(gateway.transaction("0xabc")).thenReturn(Optional.of(tx("0xabc", ONE_NATIVE.multiply(BigInteger.valueOf(2_000)), SWAP_INPUT)));

        feed.handleMessage("{\"jsonrpc\":\"2.0\",\"method\":\"eth_subscription\",\"params\":{\"subscription\":\"0xsub\",\"result\":\"0xabc\"}}");
        feed.handleMessage("not json");

        verify(gateway, timeout(2_000)).transaction("0xabc");
        awaitTrue(() -> feed.candidate("0xabc").isPresent());
        assertEquals(1, feed.candidates().size());
    }

    @Test
    void testCandidatesExpire() {
        feed.enrich("0xabc");
        when(gateway.transaction("0xdef")).thenReturn(Optional.of(tx("0xdef", ONE_NATIVE.multiply(BigInteger.valueOf(2_000)), SWAP_INPUT)));
        feed.enrich("0xdef");
        assertTrue(feed.candidate("0xdef").isPresent());

        clock.advance(Duration.ofSeconds(61));
        feed.evictExpiredCandidates();

        assertTrue(feed.candidates().isEmpty());
    }

    @Test
    void testStreamsFromWebSocket() throws IOException {
        CopyOnWriteArrayList<String> received = new CopyOnWriteArrayList<>();
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().withWebSocketUpgrade(subscriptionServer(received)));
            server.start();
            streamFrom(server);

            Thread loop = new Thread(feed::run, "mempool-test");
            loop.start();

            awaitTrue(() -> feed.candidate("0xabc").isPresent());
            assertEquals(MempoolFeed.FeedState.SUBSCRIBED, feed.state());
            assertTrue(received.get(0).contains("newPendingTransactions"));

            feed.stop();
            assertDoesNotThrow(() -> loop.join(5_000));
            assertFalse(loop.isAlive());
        }
    }

    @Test
    void testReconnectsAfterFailedConnection() throws IOException {
        feed.stop();
        feed = new MempoolFeed(failoverManager, gateway, gasPricer, new OkHttpClient(), new ObjectMapper(), clock,
                TestProperties.withMempool(new EngineProperties.Mempool(null, null, null, null,
                        Duration.ofMillis(50), null, null, null)));
        CopyOnWriteArrayList<String> received = new CopyOnWriteArrayList<>();
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().setResponseCode(503));
            server.enqueue(new MockResponse().withWebSocketUpgrade(subscriptionServer(received)));
            server.start();
            streamFrom(server);

            Thread loop = new Thread(feed::run, "mempool-test");
            loop.start();

            awaitTrue(() -> feed.state() == MempoolFeed.FeedState.SUBSCRIBED);
            assertEquals(2, server.getRequestCount());
            assertEquals(1, received.size(), "only the second connection subscribed");

            feed.stop();
            assertDoesNotThrow(() -> loop.join(5_000));
            assertFalse(loop.isAlive());
        }
    }

    @Test
    void testFailureBeforeConnectReturnsIsNotLost() {
        OkHttpClient client = mock(OkHttpClient.class);
        when(client.newWebSocket(any(), any())).thenAnswer(inv -> {
            WebSocketListener listener = inv.getArgument(1);
            WebSocket webSocket = mock(WebSocket.class);
            listener.onFailure(webSocket, new IOException("connection refused"), null);
            return webSocket;
        });
        when(failoverManager.subscriptionTier()).thenReturn(Optional.of(new EndpointTier("tier1", 1,
                "http://localhost:1", "ws://localhost:1", Set.of(EndpointCapability.READ, EndpointCapability.SUBSCRIBE))));
        feed.stop();
        feed = new MempoolFeed(failoverManager, gateway, gasPricer, client, new ObjectMapper(), clock,
                TestProperties.defaults());

        feed.connect();

        assertEquals(MempoolFeed.FeedState.DISCONNECTED, feed.state());
    }

    private void streamFrom(MockWebServer server) {
        when(failoverManager.subscriptionTier()).thenReturn(Optional.of(new EndpointTier("tier1", 1,
                server.url("/").toString(), server.url("/").toString(),
                Set.of(EndpointCapability.READ, EndpointCapability.SUBSCRIBE))));
        when(gateway.transaction("0xabc")).thenReturn(Optional.of(tx("0xabc", ONE_NATIVE.multiply(BigInteger.valueOf(2_000)), SWAP_INPUT)));
    }

    /**
     * Node side: answers the subscribe request, announces one hash and
     * completes the close handshake.
     */
    private static WebSocketListener subscriptionServer(CopyOnWriteArrayList<String> received) {
        return new WebSocketListener() {
            @Override
            public void onMessage(WebSocket webSocket, String text) {
                received.add(text);
                webSocket.send("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0xsub\"}");
                webSocket.send("{\"jsonrpc\":\"2.0\",\"method\":\"eth_subscription\","
                        + "\"params\":{\"subscription\":\"0xsub\",\"result\":\"0xabc\"}}");
            }

            @Override
            public void onClosing(WebSocket webSocket, int code, String reason) {
                webSocket.close(1000, null);
            }
        };
    }

    private static Transaction tx(String hash, BigInteger value, String input) {
        Transaction tx = new Transaction();
        tx.setHash(hash);
        tx.setFrom("0x00000000000000000000000000000000000000aa");
        tx.setTo("0xa5e0829caced8ffdd4de3c43696c57f7d7a678ff");
        tx.setValue(Numeric.encodeQuantity(value));
        tx.setInput(input);
        tx.setGasPrice(Numeric.encodeQuantity(BigInteger.valueOf(40_000_000_000L)));
        return tx;
    }

    private static void awaitTrue(BooleanSupplier condition) {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("condition not met within 5s");
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("interrupted");
            }
        }
    }
}
