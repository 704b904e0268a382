package com.polygonmev.arb.domain;

import lombok.Builder;
import lombok.Data;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A transaction built from a selected opportunity. Owned by the execution path
 * that built it; mutated only along {@link IntentState#successors()}.
 */
@Data
@Builder(toBuilder = true)
public class TransactionIntent {

    private long cycleId;
    private Opportunity opportunity;

    private String target;
    private String calldata;
    @Builder.Default
    private BigInteger value = BigInteger.ZERO;
    private BigInteger gasLimit;

    private FeeParameters fees;
    private BigInteger nonce;

    private String txHash;
    private Instant submittedAt;
    private BigInteger submittedBlock;
    /**
     * Every hash broadcast for this nonce, oldest first. Any of them may be the one that gets mined.
     */
    @Builder.Default
    private List<String> broadcastHashes = new ArrayList<>();
    private int replacements;

    @Builder.Default
    private IntentState state = IntentState.BUILT;

    public void transitionTo(IntentState next) {
        if (!state.successors().contains(next)) {
            throw new IllegalStateException("Illegal intent transition " + state + " -> " + next
                    + " (cycle " + cycleId + ")");
        }
        this.state = next;
    }

    public void recordBroadcast(String hash, BigInteger block, Instant at) {
        this.txHash = hash;
        this.submittedBlock = block;
        this.submittedAt = at;
        broadcastHashes.add(hash);
    }

    public StrategyKind getKind() {
        return opportunity.getKind();
    }
}
