package com.polygonmev.arb.core;

import com.polygonmev.arb.config.EngineProperties;
import com.polygonmev.arb.domain.FeeParameters;
import com.polygonmev.arb.domain.Opportunity;
import com.polygonmev.arb.domain.OpportunityPayload;
import com.polygonmev.arb.infra.rpc.ChainGateway;
import com.polygonmev.arb.infra.rpc.RpcCallException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Just-in-time base fee and strategy-aware priority tip.
 *
 * <p>The returned tip always satisfies {@code min <= tip <= max} and never costs
 * more than the configured fraction of expected profit. When those bounds cannot
 * all hold, no tip is returned.
 */
@Slf4j
@Service
public class GasPricer {

    private static final BigDecimal WEI_PER_GWEI = BigDecimal.TEN.pow(9);
    private static final BigDecimal WEI_PER_NATIVE = BigDecimal.TEN.pow(18);

    private final ChainGateway gateway;
    private final TipHistory tipHistory;
    private final EngineProperties.Gas gas;
    private final EngineProperties.Tip tipConfig;
    private final AtomicReference<BigDecimal> nativeTokenUsd;

    public GasPricer(ChainGateway gateway, TipHistory tipHistory, EngineProperties properties) {
        this.gateway = gateway;
        this.tipHistory = tipHistory;
        this.gas = properties.gas();
        this.tipConfig = properties.tip();
        this.nativeTokenUsd = new AtomicReference<>(gas.nativeTokenUsd());
    }

    /**
     * Base fee read from the network at the moment of the call: latest block base
     * fee (or {@code eth_gasPrice}), plus the buffer, capped at the maximum gas
     * price. Falls back to the configured default when the read fails.
     */
    public BigInteger jitBaseFee() {
        BigInteger raw;
        try {
            raw = gateway.latestBaseFee().orElseGet(gateway::gasPrice);
        } catch (RpcCallException e) {
            BigInteger fallback = gweiToWei(gas.fallbackGasPriceGwei());
            log.warn("[GAS] Base fee read failed ({}), using fallback {} gwei", e.getKind(),
                    gas.fallbackGasPriceGwei());
            return fallback;
        }

        BigInteger buffered = new BigDecimal(raw).multiply(gas.baseFeeBuffer())
                .setScale(0, RoundingMode.CEILING).toBigIntegerExact();
        BigInteger cap = gweiToWei(gas.maxGasPriceGwei());
        if (buffered.compareTo(cap) > 0) {
            log.warn("[GAS] Base fee {} gwei capped at {} gwei", weiToGwei(buffered), gas.maxGasPriceGwei());
            return cap;
        }
        return buffered;
    }

    /**
     * @return tip in wei, or empty when the profit cap is below the minimum tip
     */
    public Optional<BigInteger> tip(Opportunity opportunity) {
        BigDecimal profit = opportunity.getExpectedProfitUsd();
        BigDecimal tipGwei = tipConfig.minTipGwei();

        if (profit.compareTo(tipConfig.veryHighProfitUsd()) > 0) {
            tipGwei = tipGwei.multiply(tipConfig.veryHighProfitMultiplier());
        } else if (profit.compareTo(tipConfig.highProfitUsd()) > 0) {
            tipGwei = tipGwei.multiply(tipConfig.highProfitMultiplier());
        }

        if (opportunity.getKind().isTimeCritical()
                && opportunity.getPayload() instanceof OpportunityPayload.Sandwich sandwich) {
            BigDecimal toBeat = weiToGwei(sandwich.victimGasPriceWei())
                    .multiply(BigDecimal.ONE.add(tipConfig.replacementMargin()));
            tipGwei = tipGwei.max(toBeat);
        }

        Optional<BigDecimal> learned = tipHistory.learnedTipGwei(opportunity.getKind());
        if (learned.isPresent()) {
            BigDecimal learnedWeight = tipConfig.learnedWeight();
            tipGwei = tipGwei.multiply(BigDecimal.ONE.subtract(learnedWeight))
                    .add(learned.get().multiply(learnedWeight));
        }

        tipGwei = tipGwei.max(tipConfig.minTipGwei()).min(tipConfig.maxTipGwei());

        BigDecimal profitCapGwei = profitCapGwei(opportunity);
        if (profitCapGwei.compareTo(tipConfig.minTipGwei()) < 0) {
            log.info("[GAS] Opportunity {} cannot afford the minimum tip (cap {} gwei)", opportunity.getId(),
                    profitCapGwei.setScale(2, RoundingMode.DOWN));
            return Optional.empty();
        }
        tipGwei = tipGwei.min(profitCapGwei);

        log.debug("[GAS] Tip for {} ({}): {} gwei", opportunity.getId(), opportunity.getKind(), tipGwei);
        return Optional.of(gweiToWei(tipGwei));
    }

    /**
     * maxFee = 2 x base + tip, capped at the maximum gas price but never below the tip.
     */
    public FeeParameters feesFor(BigInteger baseFee, BigInteger tip) {
        BigInteger maxFee = baseFee.shiftLeft(1).add(tip).min(gweiToWei(gas.maxGasPriceGwei())).max(tip);
        return new FeeParameters(baseFee, tip, maxFee);
    }

    public BigInteger gasLimit(Opportunity opportunity) {
        return BigInteger.valueOf(gas.gasLimit(opportunity.getKind()));
    }

    public BigDecimal gasCostUsd(BigInteger gasUsed, BigInteger effectiveGasPriceWei) {
        BigDecimal nativeCost = new BigDecimal(gasUsed.multiply(effectiveGasPriceWei))
                .divide(WEI_PER_NATIVE, MathContext.DECIMAL64);
        return nativeCost.multiply(nativeTokenUsd.get()).setScale(6, RoundingMode.HALF_UP);
    }

    public void updateNativeTokenPrice(BigDecimal usd) {
        if (usd.signum() <= 0) {
            throw new IllegalArgumentException("Native token price must be positive: " + usd);
        }
        BigDecimal previous = nativeTokenUsd.getAndSet(usd);
        log.debug("[GAS] Native token price {} -> {}", previous, usd);
    }

    public BigDecimal minTipGwei() {
        return tipConfig.minTipGwei();
    }

    public BigDecimal nativeTokenUsd() {
        return nativeTokenUsd.get();
    }

    private BigDecimal profitCapGwei(Opportunity opportunity) {
        BigDecimal capUsd = opportunity.getExpectedProfitUsd().multiply(tipConfig.maxProfitFraction());
        if (capUsd.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        // USD cost of one gwei of tip over the whole gas limit
        BigDecimal usdPerGwei = BigDecimal.valueOf(gas.gasLimit(opportunity.getKind()))
                .multiply(nativeTokenUsd.get())
                .divide(WEI_PER_GWEI, MathContext.DECIMAL64);
        return capUsd.divide(usdPerGwei, MathContext.DECIMAL64);
    }

    public static BigInteger gweiToWei(BigDecimal gwei) {
        return gwei.multiply(WEI_PER_GWEI).setScale(0, RoundingMode.DOWN).toBigIntegerExact();
    }

    public static BigDecimal weiToGwei(BigInteger wei) {
        return new BigDecimal(wei).divide(WEI_PER_GWEI, MathContext.DECIMAL64);
    }
}
