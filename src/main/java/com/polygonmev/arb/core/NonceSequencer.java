package com.polygonmev.arb.core;

import com.polygonmev.arb.config.EngineProperties;
import com.polygonmev.arb.domain.InFlightNonce;
import com.polygonmev.arb.infra.rpc.ChainGateway;
import com.polygonmev.arb.infra.signing.TransactionSigner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Issues transaction nonces for the executor identity.
 *
 * <p>Read-increment-record happens under one lock, so concurrent callers get
 * strictly increasing, pairwise distinct nonces. Network reads (initial sync and
 * {@link #resync()}) are done before the lock is taken. The sequencer only
 * reports stuck nonces; replacing or cancelling them is up to the caller.
 */
@Slf4j
@Service
public class NonceSequencer {

    private final ChainGateway gateway;
    private final String address;
    private final long stuckBlockThreshold;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private BigInteger nextNonce;
    private final NavigableMap<BigInteger, InFlightNonce> inFlight = new TreeMap<>();

    @Autowired
    public NonceSequencer(ChainGateway gateway, TransactionSigner signer, EngineProperties properties,
                          Clock clock) {
        this(gateway, signer.address(TransactionSigner.EXECUTOR), properties.nonce().stuckBlockThreshold(), clock);
    }

    public NonceSequencer(ChainGateway gateway, String address, long stuckBlockThreshold, Clock clock) {
        this.gateway = gateway;
        this.address = address;
        this.stuckBlockThreshold = stuckBlockThreshold;
        this.clock = clock;
    }

    public BigInteger allocate() {
        ensureInitialized();
        lock.lock();
        try {
            BigInteger nonce = nextNonce;
            nextNonce = nextNonce.add(BigInteger.ONE);
            inFlight.put(nonce, InFlightNonce.allocated(nonce));
            log.debug("Allocated nonce: {}", nonce);
            return nonce;
        } finally {
            lock.unlock();
        }
    }

    public void markSubmitted(BigInteger nonce, String txHash, BigInteger blockNumber) {
        lock.lock();
        try {
            InFlightNonce entry = inFlight.get(nonce);
            if (entry == null) {
                log.warn("Submission recorded for unknown nonce {} ({})", nonce, txHash);
                return;
            }
            inFlight.put(nonce, entry.submitted(txHash, blockNumber, clock.instant()));
        } finally {
            lock.unlock();
        }
    }

    public void confirm(BigInteger nonce) {
        lock.lock();
        try {
            if (inFlight.remove(nonce) != null) {
                log.debug("Confirmed nonce: {}", nonce);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops a nonce whose slot was filled by a cancellation transaction.
     */
    public void cancel(BigInteger nonce) {
        lock.lock();
        try {
            if (inFlight.remove(nonce) != null) {
                log.warn("Cancelled nonce: {}", nonce);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Restarts the counter from the network's confirmed + pending count. Entries
     * that were broadcast below that count are still held by the network and
     * stay in the ledger; everything else is discarded.
     */
    public void resync() {
        BigInteger networkCount = gateway.pendingTransactionCount(address);
        lock.lock();
        try {
            BigInteger previous = nextNonce;
            nextNonce = networkCount;
            int before = inFlight.size();
            inFlight.values().removeIf(entry -> !entry.isSubmitted() || entry.nonce().compareTo(networkCount) >= 0);
            log.warn("Nonce resynced: {} -> {} (kept {} of {} in-flight)", previous, networkCount, inFlight.size(),
                    before);
        } finally {
            lock.unlock();
        }
    }

    public boolean isInFlight(BigInteger nonce) {
        lock.lock();
        try {
            return inFlight.containsKey(nonce);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whether a transaction broadcast at {@code submittedBlock} has waited more
     * than the configured number of blocks.
     */
    public boolean isStuck(BigInteger submittedBlock, BigInteger currentBlock) {
        return submittedBlock != null
                && currentBlock.subtract(submittedBlock).compareTo(BigInteger.valueOf(stuckBlockThreshold)) > 0;
    }

    public int pendingCount() {
        lock.lock();
        try {
            return inFlight.size();
        } finally {
            lock.unlock();
        }
    }

    public List<InFlightNonce> inFlight() {
        lock.lock();
        try {
            return new ArrayList<>(inFlight.values());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Submitted nonces that have been pending for more than the configured number
     * of blocks at {@code currentBlock}.
     */
    public List<InFlightNonce> stuckNonces(BigInteger currentBlock) {
        List<InFlightNonce> stuck = new ArrayList<>();
        lock.lock();
        try {
            for (InFlightNonce entry : inFlight.values()) {
                if (isStuck(entry.submittedBlock(), currentBlock)) {
                    stuck.add(entry);
                }
            }
        } finally {
            lock.unlock();
        }
        if (!stuck.isEmpty()) {
            log.warn("Found {} stuck transactions", stuck.size());
        }
        return stuck;
    }

    public String getAddress() {
        return address;
    }

    private void ensureInitialized() {
        lock.lock();
        try {
            if (nextNonce != null) {
                return;
            }
        } finally {
            lock.unlock();
        }

        BigInteger networkCount = gateway.pendingTransactionCount(address);
        lock.lock();
        try {
            if (nextNonce == null) {
                nextNonce = networkCount;
                log.info("Nonce sequencer initialized for {} at nonce {}", address, networkCount);
            }
        } finally {
            lock.unlock();
        }
    }
}
