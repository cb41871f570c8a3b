package me.golemcore.support.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TurnStateTest {

    @Test
    void happyPathTransitionsAreAllowed() {
        TurnState state = TurnState.RECEIVED
                .transitionTo(TurnState.ROUTED)
                .transitionTo(TurnState.PROCESSING)
                .transitionTo(TurnState.COMPLETED);

        assertEquals(TurnState.COMPLETED, state);
        assertTrue(state.isTerminal());
    }

    @Test
    void escalatedIsReachableFromRoutedAndProcessing() {
        assertTrue(TurnState.ROUTED.canTransitionTo(TurnState.ESCALATED));
        assertTrue(TurnState.PROCESSING.canTransitionTo(TurnState.ESCALATED));
        assertFalse(TurnState.RECEIVED.canTransitionTo(TurnState.ESCALATED));
    }

    @Test
    void processingCanFail() {
        assertEquals(TurnState.FAILED, TurnState.PROCESSING.transitionTo(TurnState.FAILED));
    }

    @Test
    void transitionTo_rejectsSkippingStates() {
        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> TurnState.RECEIVED.transitionTo(TurnState.COMPLETED));
        assertTrue(error.getMessage().contains("RECEIVED -> COMPLETED"));
    }

    @Test
    void terminalStatesHaveNoExits() {
        for (TurnState terminal : new TurnState[] { TurnState.COMPLETED, TurnState.ESCALATED, TurnState.FAILED }) {
            for (TurnState next : TurnState.values()) {
                assertFalse(terminal.canTransitionTo(next), terminal + " -> " + next);
            }
        }
        assertFalse(TurnState.PROCESSING.isTerminal());
    }
}
