package com.polygonmev.arb.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polygonmev.arb.config.EngineProperties;
import com.polygonmev.arb.domain.EndpointTier;
import com.polygonmev.arb.domain.PendingSwap;
import com.polygonmev.arb.infra.rpc.ChainGateway;
import com.polygonmev.arb.infra.rpc.EndpointFailoverManager;
import com.polygonmev.arb.infra.rpc.RpcCallException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;
import org.web3j.protocol.core.methods.response.Transaction;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Pending-transaction stream over the active tier's WebSocket.
 *
 * <p>Each announced hash is looked up on a bounded worker pool; transactions
 * above the value threshold whose selector matches a known swap function are kept
 * as sandwich candidates for the candidate TTL. Any socket failure drops the feed
 * back to {@link FeedState#DISCONNECTED} and {@link #run()} reconnects after the
 * configured delay until {@link #stop()}.
 */
@Slf4j
@Service
public class MempoolFeed {

    public enum FeedState {
        DISCONNECTED,
        CONNECTING,
        SUBSCRIBED
    }

    private static final BigDecimal WEI_PER_NATIVE = BigDecimal.TEN.pow(18);
    private static final int SUBSCRIBE_REQUEST_ID = 1;

    private final EndpointFailoverManager failoverManager;
    private final ChainGateway gateway;
    private final GasPricer gasPricer;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final EngineProperties.Mempool config;
    private final Set<String> swapSelectors;

    private final TtlCache<String, PendingSwap> candidates;
    private final ThreadPoolExecutor enrichmentPool;
    private final AtomicReference<FeedState> state = new AtomicReference<>(FeedState.DISCONNECTED);
    private final Semaphore disconnected = new Semaphore(0);
    private final AtomicLong droppedHashes = new AtomicLong();

    private final AtomicReference<Listener> activeListener = new AtomicReference<>();

    private volatile boolean running;
    private volatile WebSocket socket;

    public MempoolFeed(EndpointFailoverManager failoverManager, ChainGateway gateway, GasPricer gasPricer,
                       OkHttpClient httpClient, ObjectMapper objectMapper, Clock clock,
                       EngineProperties properties) {
        this.failoverManager = failoverManager;
        this.gateway = gateway;
        this.gasPricer = gasPricer;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.config = properties.mempool();
        this.swapSelectors = config.swapSelectors().stream().map(String::toLowerCase).collect(Collectors.toSet());
        this.candidates = new TtlCache<>(clock, config.candidateTtl(), config.maxCandidates());

        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("mempool-enrich-");
        threadFactory.setDaemon(true);
        this.enrichmentPool = new ThreadPoolExecutor(config.enrichmentThreads(), config.enrichmentThreads(),
                0L, TimeUnit.MILLISECONDS, new ArrayBlockingQueue<>(config.enrichmentQueueSize()), threadFactory,
                new ThreadPoolExecutor.AbortPolicy());
    }

    public boolean isEnabled() {
        return config.enabled();
    }

    /**
     * Connect-and-reconnect loop; blocks the calling thread until {@link #stop()}.
     */
    public void run() {
        running = true;
        log.info("[MEMPOOL] Feed started");
        while (running) {
            connect();
            try {
                disconnected.acquire();
                if (!running) {
                    break;
                }
                log.info("[MEMPOOL] Reconnecting in {}s", config.reconnectDelay().toSeconds());
                Thread.sleep(config.reconnectDelay().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        closeSocket();
        log.info("[MEMPOOL] Feed stopped");
    }

    public void stop() {
        running = false;
        closeSocket();
        disconnected.release();
        enrichmentPool.shutdownNow();
    }

    public FeedState state() {
        return state.get();
    }

    /**
     * Live candidates, oldest first.
     */
    public List<PendingSwap> candidates() {
        return List.copyOf(candidates.snapshot().values());
    }

    public Optional<PendingSwap> candidate(String txHash) {
        return candidates.get(txHash);
    }

    public long droppedHashes() {
        return droppedHashes.get();
    }

    @Scheduled(fixedDelayString = "${engine.mempool.candidate-ttl:PT60S}")
    public void evictExpiredCandidates() {
        int evicted = candidates.evictExpired();
        if (evicted > 0) {
            log.debug("[MEMPOOL] Evicted {} expired candidates, {} left", evicted, candidates.size());
        }
    }

    void connect() {
        Optional<EndpointTier> tier = failoverManager.subscriptionTier();
        if (tier.isEmpty()) {
            log.warn("[MEMPOOL] No tier with a WebSocket URL configured");
            markDisconnected(null);
            return;
        }
        state.set(FeedState.CONNECTING);
        log.info("[MEMPOOL] Connecting to {} ({})", tier.get().getName(), tier.get().getWsUrl());
        Request request = new Request.Builder().url(tier.get().getWsUrl()).build();
        Listener listener = new Listener();
        activeListener.set(listener);
        socket = httpClient.newWebSocket(request, listener);
    }

    void handleMessage(String text) {
        JsonNode message;
        try {
            message = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.debug("[MEMPOOL] Unparseable message: {}", e.getMessage());
            return;
        }

        if (message.path("id").asInt(-1) == SUBSCRIBE_REQUEST_ID) {
            if (message.has("error")) {
                log.error("[MEMPOOL] Subscription refused: {}", message.path("error").path("message").asText());
                closeSocket();
                markDisconnected(null);
                return;
            }
            state.set(FeedState.SUBSCRIBED);
            log.info("[MEMPOOL] Subscribed to pending transactions ({})", message.path("result").asText());
            return;
        }

        if ("eth_subscription".equals(message.path("method").asText())) {
            JsonNode result = message.path("params").path("result");
            if (result.isTextual()) {
                submitEnrichment(result.asText());
            }
        }
    }

    void submitEnrichment(String txHash) {
        try {
            enrichmentPool.execute(() -> enrich(txHash));
        } catch (RejectedExecutionException e) {
            long dropped = droppedHashes.incrementAndGet();
            if (dropped % 100 == 1) {
                log.warn("[MEMPOOL] Enrichment queue full, {} hashes dropped so far", dropped);
            }
        }
    }

    void enrich(String txHash) {
        try {
            gateway.transaction(txHash).flatMap(this::evaluate).ifPresent(swap -> {
                candidates.put(swap.getHash(), swap);
                log.debug("[MEMPOOL] Potential sandwich target: {}", swap.getHash());
            });
        } catch (RpcCallException e) {
            log.debug("[MEMPOOL] Lookup of {} failed: {}", txHash, e.getMessage());
        }
    }

    /**
     * Swap candidate for a pending transaction, or empty when it is too small or
     * not a known swap call.
     */
    Optional<PendingSwap> evaluate(Transaction tx) {
        BigInteger value = tx.getValue() == null ? BigInteger.ZERO : tx.getValue();
        BigDecimal valueUsd = new BigDecimal(value).divide(WEI_PER_NATIVE, MathContext.DECIMAL64)
                .multiply(gasPricer.nativeTokenUsd());
        if (valueUsd.compareTo(config.minValueUsd()) < 0) {
            return Optional.empty();
        }

        String input = tx.getInput();
        if (input == null || input.length() < 10 || !swapSelectors.contains(input.substring(0, 10).toLowerCase())) {
            return Optional.empty();
        }

        return Optional.of(PendingSwap.builder()
                .hash(tx.getHash())
                .from(tx.getFrom())
                .to(tx.getTo())
                .value(value)
                .input(input)
                .gasPrice(tx.getGasPriceRaw() == null ? BigInteger.ZERO : tx.getGasPrice())
                .maxPriorityFeePerGas(tx.getMaxPriorityFeePerGasRaw() == null ? null : tx.getMaxPriorityFeePerGas())
                .seenAt(clock.instant())
                .build());
    }

    /**
     * Each connection reports at most one disconnect.
     *
     * @param source listener of the connection that ended; events from
     *               connections that were already replaced or closed are ignored
     */
    private void markDisconnected(Listener source) {
        if (source == null) {
            activeListener.set(null);
        } else if (!activeListener.compareAndSet(source, null)) {
            return;
        }
        state.set(FeedState.DISCONNECTED);
        disconnected.release();
    }

    private void closeSocket() {
        activeListener.set(null);
        WebSocket current = socket;
        socket = null;
        if (current != null) {
            current.close(1000, "shutdown");
        }
    }

    private final class Listener extends WebSocketListener {

        @Override
        public void onOpen(WebSocket webSocket, Response response) {
            String subscribe = "{\"jsonrpc\":\"2.0\",\"id\":" + SUBSCRIBE_REQUEST_ID
                    + ",\"method\":\"eth_subscribe\",\"params\":[\"newPendingTransactions\"]}";
            webSocket.send(subscribe);
        }

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            handleMessage(text);
        }

        @Override
        public void onClosing(WebSocket webSocket, int code, String reason) {
            log.warn("[MEMPOOL] Server is closing the socket ({}): {}", code, reason);
            webSocket.close(1000, null);
            markDisconnected(this);
        }

        @Override
        public void onClosed(WebSocket webSocket, int code, String reason) {
            log.warn("[MEMPOOL] Socket closed ({}): {}", code, reason);
            markDisconnected(this);
        }

        @Override
        public void onFailure(WebSocket webSocket, Throwable t, Response response) {
            log.warn("[MEMPOOL] Socket failure: {}", t.getMessage());
            markDisconnected(this);
        }
    }
}
