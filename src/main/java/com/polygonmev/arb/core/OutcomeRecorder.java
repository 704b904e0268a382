package com.polygonmev.arb.core;

import com.polygonmev.arb.domain.ExecutionOutcome;
import com.polygonmev.arb.domain.ExecutionReport;
import com.polygonmev.arb.domain.IntentState;
import com.polygonmev.arb.domain.TransactionIntent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.utils.Numeric;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Books a mined transaction: intent state, nonce confirmation, realized PnL into
 * the risk governor and the paid tip into the tip history.
 */
@Component
@RequiredArgsConstructor
public class OutcomeRecorder {

    private final NonceSequencer nonceSequencer;
    private final RiskGovernor riskGovernor;
    private final TipHistory tipHistory;
    private final GasPricer gasPricer;

    public ExecutionReport recordMined(TransactionIntent intent, TransactionReceipt receipt) {
        boolean success = receipt.isStatusOK();
        if (intent.getState() == IntentState.SUBMITTED) {
            intent.transitionTo(IntentState.PENDING);
        }
        intent.transitionTo(success ? IntentState.CONFIRMED_SUCCESS : IntentState.CONFIRMED_REVERTED);
        nonceSequencer.confirm(intent.getNonce());

        BigInteger gasPrice = receipt.getEffectiveGasPrice() != null
                ? Numeric.decodeQuantity(receipt.getEffectiveGasPrice())
                : intent.getFees().maxFeePerGas();
        BigDecimal gasCostUsd = gasPricer.gasCostUsd(receipt.getGasUsed(), gasPrice);
        BigDecimal expected = intent.getOpportunity().getExpectedProfitUsd();
        BigDecimal pnl = success ? expected.subtract(gasCostUsd) : gasCostUsd.negate();

        riskGovernor.recordOutcome(pnl);
        if (!success) {
            riskGovernor.recordFailure();
        }
        recordTip(intent, success);

        return new ExecutionReport(intent.getCycleId(), intent.getOpportunity().getId(), intent.getKind(), expected,
                success ? ExecutionOutcome.SUCCESS : ExecutionOutcome.REVERTED, receipt.getTransactionHash(), pnl,
                gasCostUsd);
    }

    public void recordTip(TransactionIntent intent, boolean success) {
        tipHistory.record(intent.getKind(), GasPricer.weiToGwei(intent.getFees().maxPriorityFeePerGas()),
                intent.getOpportunity().getExpectedProfitUsd(), success);
    }
}
