package com.polygonmev.arb.domain;

import com.polygonmev.arb.support.Fixtures;
import org.junit.jupiter.api.Test;


import static org.junit.jupiter.api.Assertions.*;

class TransactionIntentTest {

    @Test
    void testHappyPathToConfirmation() {
        TransactionIntent intent = Fixtures.builtIntent(Fixtures.directOpportunity("a", "20"), 1);

        intent.transitionTo(IntentState.SIMULATION_PASSED);
        intent.transitionTo(IntentState.SUBMITTED);
        intent.transitionTo(IntentState.PENDING);
        intent.transitionTo(IntentState.CONFIRMED_SUCCESS);

        assertTrue(intent.getState().isTerminal());
    }

    @Test
    void testStuckIntentCanBeSpedUpThenCancelled() {
        TransactionIntent intent = Fixtures.builtIntent(Fixtures.directOpportunity("a", "20"), 1);
        intent.setState(IntentState.PENDING);

        intent.transitionTo(IntentState.STUCK);
        intent.transitionTo(IntentState.SPED_UP);
        intent.transitionTo(IntentState.STUCK);
        intent.transitionTo(IntentState.CANCELLED);

        assertEquals(IntentState.CANCELLED, intent.getState());
    }

    @Test
    void testRejectsSkippingSimulation() {
        TransactionIntent intent = Fixtures.builtIntent(Fixtures.directOpportunity("a", "20"), 7);

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> intent.transitionTo(IntentState.SUBMITTED));

        assertTrue(e.getMessage().contains("cycle 7"));
        assertEquals(IntentState.BUILT, intent.getState());
    }

    @Test
    void testTerminalStatesHaveNoSuccessors() {
        assertTrue(IntentState.SIMULATION_REJECTED.isTerminal());
        assertTrue(IntentState.CONFIRMED_REVERTED.isTerminal());
        assertTrue(IntentState.FAILED.isTerminal());
        assertTrue(IntentState.DROPPED.isTerminal());
        assertFalse(IntentState.STUCK.isTerminal());
    }

    @Test
    void testOnlySandwichIsTimeCritical() {
        for (StrategyKind kind : StrategyKind.values()) {
            assertEquals(kind == StrategyKind.SANDWICH, kind.isTimeCritical());
        }
        assertTrue(StrategyKind.SANDWICH.priority() > StrategyKind.FLASHLOAN.priority());
        assertEquals(StrategyKind.FLASHLOAN.priority(), StrategyKind.LIQUIDATION.priority());
    }
}
