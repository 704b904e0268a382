package com.polygonmev.arb.config;

import com.polygonmev.arb.domain.EndpointCapability;
import com.polygonmev.arb.domain.StrategyKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Validated
@ConfigurationProperties(prefix = "engine")
public record EngineProperties(
        /**
         * EIP-155 chain id used for signing (Polygon mainnet by default).
         */
        @NotNull @Min(1) Long chainId,
        @Valid Scheduler scheduler,
        @Valid Endpoints endpoints,
        @Valid Gas gas,
        @Valid Tip tip,
        @Valid Risk risk,
        @Valid Mempool mempool,
        @Valid Multicall multicall,
        @Valid Nonce nonce,
        @Valid Execution execution,
        @Valid Wallet wallet,
        @Valid Alerts alerts
) {
    public EngineProperties {
        if (chainId == null) {
            chainId = 137L;
        }
        if (scheduler == null) {
            scheduler = new Scheduler(null, null, null, null, null, null);
        }
        if (endpoints == null) {
            endpoints = new Endpoints(null, null, null, null, null);
        }
        if (gas == null) {
            gas = new Gas(null, null, null, null, null);
        }
        if (tip == null) {
            tip = new Tip(null, null, null, null, null, null, null, null, null, null, null);
        }
        if (risk == null) {
            risk = new Risk(null, null, null);
        }
        if (mempool == null) {
            mempool = new Mempool(null, null, null, null, null, null, null, null);
        }
        if (multicall == null) {
            multicall = new Multicall(null, null);
        }
        if (nonce == null) {
            nonce = new Nonce(null, null, null, null, null);
        }
        if (execution == null) {
            execution = new Execution(null, null, null, null);
        }
        if (wallet == null) {
            wallet = new Wallet(null, null, null, null, null);
        }
        if (alerts == null) {
            alerts = new Alerts(null, null);
        }
    }

    public record Scheduler(
            @NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double minConfidence,
            /**
             * Opportunities whose profit is within this many USD of the best one are
             * ranked by strategy priority instead.
             */
            @NotNull @DecimalMin("0.0") BigDecimal similarityBandUsd,
            @NotNull Duration cycleDelay,
            @NotNull Duration producerTimeout,
            @NotNull Boolean sequentialPolling,
            Set<StrategyKind> disabledStrategies
    ) {
        public Scheduler {
            if (minConfidence == null) {
                minConfidence = 0.75;
            }
            if (similarityBandUsd == null) {
                similarityBandUsd = new BigDecimal("2.0");
            }
            if (cycleDelay == null || cycleDelay.isZero() || cycleDelay.isNegative()) {
                cycleDelay = Duration.ofMillis(100);
            }
            if (producerTimeout == null) {
                producerTimeout = Duration.ofSeconds(2);
            }
            if (sequentialPolling == null) {
                sequentialPolling = false;
            }
            if (disabledStrategies == null) {
                disabledStrategies = Set.of();
            }
        }
    }

    public record Endpoints(
            @Valid List<Tier> tiers,
            /**
             * Tier names in failover order. Defaults to the tiers sorted by priority.
             */
            List<String> fallbackSequence,
            /**
             * Attempts on the same tier for non rate-limit errors.
             */
            @NotNull @Min(1) Integer maxAttemptsPerTier,
            @NotNull Duration retryDelay,
            @Valid HealthCheck healthCheck
    ) {
        public Endpoints {
            if (tiers == null) {
                tiers = List.of();
            }
            if (fallbackSequence == null || fallbackSequence.isEmpty()) {
                fallbackSequence = tiers.stream()
                        .sorted((a, b) -> Integer.compare(a.priority(), b.priority()))
                        .map(Tier::name)
                        .toList();
            }
            if (maxAttemptsPerTier == null) {
                maxAttemptsPerTier = 3;
            }
            if (retryDelay == null) {
                retryDelay = Duration.ofSeconds(1);
            }
            if (healthCheck == null) {
                healthCheck = new HealthCheck(null, null, null);
            }
        }
    }

    public record Tier(
            @NotBlank String name,
            @NotBlank String httpUrl,
            String wsUrl,
            @NotNull @Min(1) Integer priority,
            Set<EndpointCapability> capabilities
    ) {
        public Tier {
            if (priority == null) {
                priority = 1;
            }
            if (capabilities == null || capabilities.isEmpty()) {
                capabilities = wsUrl == null || wsUrl.isBlank()
                        ? Set.of(EndpointCapability.READ, EndpointCapability.WRITE)
                        : Set.of(EndpointCapability.READ, EndpointCapability.WRITE, EndpointCapability.SUBSCRIBE);
            }
        }
    }

    public record HealthCheck(
            @NotNull Boolean enabled,
            @NotNull Duration interval,
            /**
             * Minimum time since the primary tier's last failure before it is probed again.
             */
            @NotNull Duration primaryCooldown
    ) {
        public HealthCheck {
            if (enabled == null) {
                enabled = true;
            }
            if (interval == null) {
                interval = Duration.ofSeconds(60);
            }
            if (primaryCooldown == null) {
                primaryCooldown = Duration.ofMinutes(5);
            }
        }
    }

    public record Gas(
            @NotNull @DecimalMin("0.0") BigDecimal maxGasPriceGwei,
            /**
             * Multiplier applied to the freshly read base fee.
             */
            @NotNull @DecimalMin("1.0") BigDecimal baseFeeBuffer,
            @NotNull @DecimalMin("0.0") BigDecimal fallbackGasPriceGwei,
            @NotNull @DecimalMin("0.0") BigDecimal nativeTokenUsd,
            Map<StrategyKind, Long> gasLimits
    ) {
        public Gas {
            if (maxGasPriceGwei == null) {
                maxGasPriceGwei = new BigDecimal("500");
            }
            if (baseFeeBuffer == null) {
                baseFeeBuffer = new BigDecimal("1.05");
            }
            if (fallbackGasPriceGwei == null) {
                fallbackGasPriceGwei = new BigDecimal("50");
            }
            if (nativeTokenUsd == null) {
                nativeTokenUsd = new BigDecimal("0.80");
            }
            Map<StrategyKind, Long> limits = new EnumMap<>(StrategyKind.class);
            limits.put(StrategyKind.DIRECT, 500_000L);
            limits.put(StrategyKind.TRIANGULAR, 600_000L);
            limits.put(StrategyKind.FLASHLOAN, 800_000L);
            limits.put(StrategyKind.LIQUIDATION, 700_000L);
            limits.put(StrategyKind.SANDWICH, 350_000L);
            if (gasLimits != null) {
                limits.putAll(gasLimits);
            }
            gasLimits = Map.copyOf(limits);
        }

        public long gasLimit(StrategyKind kind) {
            return gasLimits.get(kind);
        }
    }

    public record Tip(
            @NotNull @DecimalMin("0.0") BigDecimal minTipGwei,
            @NotNull @DecimalMin("0.0") BigDecimal maxTipGwei,
            /**
             * Share of expected profit the tip may consume at most.
             */
            @NotNull @DecimalMin("0.0") @DecimalMax("1.0") BigDecimal maxProfitFraction,
            @NotNull BigDecimal highProfitUsd,
            @NotNull BigDecimal highProfitMultiplier,
            @NotNull BigDecimal veryHighProfitUsd,
            @NotNull BigDecimal veryHighProfitMultiplier,
            /**
             * Margin a time-critical tip must exceed the reference transaction's fee by.
             */
            @NotNull @DecimalMin("0.0") BigDecimal replacementMargin,
            @NotNull @DecimalMin("0.0") @DecimalMax("1.0") BigDecimal learnedWeight,
            @NotNull @Min(1) Integer minSamples,
            @NotNull @Min(1) Integer historySize
    ) {
        public Tip {
            if (minTipGwei == null) {
                minTipGwei = new BigDecimal("30");
            }
            if (maxTipGwei == null) {
                maxTipGwei = new BigDecimal("200");
            }
            if (maxProfitFraction == null) {
                maxProfitFraction = new BigDecimal("0.10");
            }
            if (highProfitUsd == null) {
                highProfitUsd = new BigDecimal("50");
            }
            if (highProfitMultiplier == null) {
                highProfitMultiplier = new BigDecimal("1.5");
            }
            if (veryHighProfitUsd == null) {
                veryHighProfitUsd = new BigDecimal("100");
            }
            if (veryHighProfitMultiplier == null) {
                veryHighProfitMultiplier = new BigDecimal("2.0");
            }
            if (replacementMargin == null) {
                replacementMargin = new BigDecimal("0.125");
            }
            if (learnedWeight == null) {
                learnedWeight = new BigDecimal("0.4");
            }
            if (minSamples == null) {
                minSamples = 10;
            }
            if (historySize == null) {
                historySize = 100;
            }
        }
    }

    public record Risk(
            @NotNull @DecimalMin("0.0") BigDecimal maxDailyLossUsd,
            /**
             * Failed submissions per day that raise an alert. Never trips the switch on its own.
             */
            @NotNull @Min(1) Integer maxFailedTxBeforeAlert,
            @NotNull Boolean autoKillEnabled
    ) {
        public Risk {
            if (maxDailyLossUsd == null) {
                maxDailyLossUsd = new BigDecimal("100");
            }
            if (maxFailedTxBeforeAlert == null) {
                maxFailedTxBeforeAlert = 5;
            }
            if (autoKillEnabled == null) {
                autoKillEnabled = true;
            }
        }
    }

    public record Mempool(
            @NotNull Boolean enabled,
            @NotNull @DecimalMin("0.0") BigDecimal minValueUsd,
            @NotNull Duration candidateTtl,
            @NotNull @Min(1) Integer maxCandidates,
            @NotNull Duration reconnectDelay,
            @NotNull @Min(1) Integer enrichmentThreads,
            @NotNull @Min(1) Integer enrichmentQueueSize,
            List<String> swapSelectors
    ) {
        public Mempool {
            if (enabled == null) {
                enabled = true;
            }
            if (minValueUsd == null) {
                minValueUsd = new BigDecimal("1000");
            }
            if (candidateTtl == null) {
                candidateTtl = Duration.ofSeconds(60);
            }
            if (maxCandidates == null) {
                maxCandidates = 1000;
            }
            if (reconnectDelay == null) {
                reconnectDelay = Duration.ofSeconds(5);
            }
            if (enrichmentThreads == null) {
                enrichmentThreads = 4;
            }
            if (enrichmentQueueSize == null) {
                enrichmentQueueSize = 512;
            }
            if (swapSelectors == null || swapSelectors.isEmpty()) {
                swapSelectors = List.of(
                        "0x38ed1739", // swapExactTokensForTokens
                        "0x8803dbee", // swapTokensForExactTokens
                        "0x7ff36ab5", // swapExactETHForTokens
                        "0x4a25d94a", // swapTokensForExactETH
                        "0x18cbafe5", // swapExactTokensForETH
                        "0xfb3bdb41"  // swapETHForExactTokens
                );
            }
        }
    }

    public record Multicall(
            @NotBlank String address,
            @NotNull @Min(1) Integer chunkSize
    ) {
        public Multicall {
            if (address == null || address.isBlank()) {
                // Multicall3, same address on every supported chain.
                address = "0xcA11bde05977b3631167028862bE2a173976CA11";
            }
            if (chunkSize == null) {
                chunkSize = 50;
            }
        }
    }

    public record Nonce(
            /**
             * Blocks a submission may stay unmined before its nonce counts as stuck.
             */
            @NotNull @Min(1) Long stuckBlockThreshold,
            /**
             * Fee multiplier for replacements; at least the common 12.5% minimum bump.
             */
            @NotNull @DecimalMin("1.125") BigDecimal replacementFeeMultiplier,
            @NotNull @Min(0) Integer maxSpeedUps,
            @NotNull Duration sweepInterval,
            @NotNull Boolean resolverEnabled
    ) {
        public Nonce {
            if (stuckBlockThreshold == null) {
                stuckBlockThreshold = 10L;
            }
            if (replacementFeeMultiplier == null) {
                replacementFeeMultiplier = new BigDecimal("1.125");
            }
            if (maxSpeedUps == null) {
                maxSpeedUps = 2;
            }
            if (sweepInterval == null) {
                sweepInterval = Duration.ofSeconds(15);
            }
            if (resolverEnabled == null) {
                resolverEnabled = true;
            }
        }
    }

    public record Execution(
            @NotNull Duration confirmationTimeout,
            @NotNull Duration receiptPollInterval,
            /**
             * Let execution proceed when the dry run fails for a reason that is not a revert.
             */
            @NotNull Boolean allowAmbiguousSimulation,
            @NotNull Boolean exitOnFatal
    ) {
        public Execution {
            if (confirmationTimeout == null) {
                confirmationTimeout = Duration.ofSeconds(60);
            }
            if (receiptPollInterval == null) {
                receiptPollInterval = Duration.ofSeconds(2);
            }
            if (allowAmbiguousSimulation == null) {
                allowAmbiguousSimulation = true;
            }
            if (exitOnFatal == null) {
                exitOnFatal = true;
            }
        }
    }

    public record Wallet(
            String executorPrivateKey,
            /**
             * Optional; signs profit withdrawals when set, otherwise the executor does.
             */
            String adminPrivateKey,
            String adminAddress,
            /**
             * Executor contract holding trading profits.
             */
            String executorContract,
            List<String> withdrawTokens
    ) {
        public Wallet {
            if (withdrawTokens == null) {
                withdrawTokens = List.of();
            }
        }
    }

    public record Alerts(
            String webhookUrl,
            @NotNull Duration minIntervalPerSubject
    ) {
        public Alerts {
            if (minIntervalPerSubject == null) {
                minIntervalPerSubject = Duration.ofMinutes(5);
            }
        }
    }
}
