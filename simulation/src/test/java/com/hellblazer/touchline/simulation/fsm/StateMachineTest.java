package com.hellblazer.touchline.simulation.fsm;

import com.hellblazer.touchline.simulation.messaging.MessageKind;
import com.hellblazer.touchline.simulation.messaging.Telegram;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * @author hal.hildebrand
 */
class StateMachineTest {

    private String              owner;
    private StateMachine<String> machine;
    private State<String>       first;
    private State<String>       second;
    private State<String>       global;

    @SuppressWarnings("unchecked")
    @BeforeEach
    void setUp() {
        owner = "agent";
        machine = new StateMachine<>(owner);
        first = mock(State.class);
        second = mock(State.class);
        global = mock(State.class);
    }

    @Test
    void testChangeStateExitsBeforeEntering() {
        machine.setCurrentState(first);
        machine.changeState(second);

        var order = inOrder(first, second);
        order.verify(first).exit(owner);
        order.verify(second).enter(owner);
        verify(first, times(1)).exit(owner);
        verify(second, times(1)).enter(owner);
        verify(first, never()).enter(any());

        assertSame(second, machine.getCurrentState());
        assertSame(first, machine.getPreviousState());
        assertTrue(machine.isInState(second));
        assertFalse(machine.isInState(first));
    }

    @Test
    void testRevertToPreviousState() {
        machine.setCurrentState(first);
        machine.changeState(second);
        machine.revertToPreviousState();

        assertSame(first, machine.getCurrentState());
        assertSame(second, machine.getPreviousState());
        verify(second).exit(owner);
        verify(first).enter(owner);
    }

    @Test
    void testRevertWithoutHistoryFails() {
        machine.setCurrentState(first);
        assertThrows(IllegalStateException.class, () -> machine.revertToPreviousState());
    }

    @Test
    void testChangeToNullStateFails() {
        assertThrows(NullPointerException.class, () -> machine.changeState(null));
    }

    @Test
    void testUpdateRunsGlobalThenCurrent() {
        machine.setGlobalState(global);
        machine.setCurrentState(first);
        machine.update();

        var order = inOrder(global, first);
        order.verify(global).execute(owner);
        order.verify(first).execute(owner);
    }

    @Test
    void testUpdateWithoutStatesDoesNothing() {
        assertDoesNotThrow(() -> machine.update());
    }

    @Test
    void testGlobalStateConsumesMessageFirst() {
        var telegram = new Telegram(1, 2, MessageKind.GO_HOME);
        machine.setGlobalState(global);
        machine.setCurrentState(first);
        when(global.onMessage(owner, telegram)).thenReturn(true);

        assertTrue(machine.handleMessage(telegram));
        verify(first, never()).onMessage(any(), any());
    }

    @Test
    void testCurrentStateGetsUnconsumedMessage() {
        var telegram = new Telegram(1, 2, MessageKind.SUPPORT_ATTACKER);
        machine.setGlobalState(global);
        machine.setCurrentState(first);
        when(first.onMessage(owner, telegram)).thenReturn(true);

        assertTrue(machine.handleMessage(telegram));
        verify(global).onMessage(owner, telegram);
    }

    @Test
    void testUnhandledMessageIsDropped() {
        machine.setCurrentState(first);
        assertFalse(machine.handleMessage(new Telegram(1, 2, MessageKind.PASS_TO_ME)));
    }

    @Test
    void testNestedChangeFromEnter() {
        var bounce = new State<String>() {
            @Override
            public void enter(String entity) {
                machine.changeState(second);
            }

            @Override
            public void execute(String entity) {
            }
        };
        machine.setCurrentState(first);
        machine.changeState(bounce);

        assertSame(second, machine.getCurrentState());
        assertSame(bounce, machine.getPreviousState());
        verify(second).enter(owner);
    }
}
