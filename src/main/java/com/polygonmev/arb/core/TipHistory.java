package com.polygonmev.arb.core;

import com.polygonmev.arb.config.EngineProperties;
import com.polygonmev.arb.domain.StrategyKind;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded per-kind record of tips paid and whether the transaction landed
 * successfully. Feeds the learned part of the tip.
 */
@Component
public class TipHistory {

    public record Sample(BigDecimal tipGwei, BigDecimal expectedProfitUsd, boolean success) {
    }

    private final int historySize;
    private final int minSamples;
    private final Map<StrategyKind, Deque<Sample>> samples = new EnumMap<>(StrategyKind.class);

    public TipHistory(EngineProperties properties) {
        this(properties.tip().historySize(), properties.tip().minSamples());
    }

    TipHistory(int historySize, int minSamples) {
        this.historySize = historySize;
        this.minSamples = minSamples;
    }

    public synchronized void record(StrategyKind kind, BigDecimal tipGwei, BigDecimal expectedProfitUsd,
                                    boolean success) {
        Deque<Sample> window = samples.computeIfAbsent(kind, k -> new ArrayDeque<>());
        window.addLast(new Sample(tipGwei, expectedProfitUsd, success));
        while (window.size() > historySize) {
            window.removeFirst();
        }
    }

    public synchronized int sampleCount(StrategyKind kind) {
        Deque<Sample> window = samples.get(kind);
        return window == null ? 0 : window.size();
    }

    /**
     * Recency-weighted mean of successful tips for {@code kind}: the newest sample
     * weighs {@code n}, the oldest {@code 1}. Empty until {@code minSamples}
     * samples exist or when none of them succeeded.
     */
    public synchronized Optional<BigDecimal> learnedTipGwei(StrategyKind kind) {
        Deque<Sample> window = samples.get(kind);
        if (window == null || window.size() < minSamples) {
            return Optional.empty();
        }

        BigDecimal weightedSum = BigDecimal.ZERO;
        long totalWeight = 0;
        long weight = 1;
        for (Iterator<Sample> it = window.iterator(); it.hasNext(); weight++) {
            Sample sample = it.next();
            if (sample.success()) {
                weightedSum = weightedSum.add(sample.tipGwei().multiply(BigDecimal.valueOf(weight)));
                totalWeight += weight;
            }
        }
        if (totalWeight == 0) {
            return Optional.empty();
        }
        return Optional.of(weightedSum.divide(BigDecimal.valueOf(totalWeight), MathContext.DECIMAL64));
    }
}
