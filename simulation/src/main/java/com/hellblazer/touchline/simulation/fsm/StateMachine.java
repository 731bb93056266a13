/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.touchline.simulation.fsm;

import com.hellblazer.touchline.simulation.messaging.Telegram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Finite state machine holding a current, previous and optional global state for its owner. The global state runs
 * before the current state on every update.
 *
 * @param <E> the owner type
 * @author hal.hildebrand
 */
public class StateMachine<E> {
    private static final Logger log = LoggerFactory.getLogger(StateMachine.class);

    private final E        owner;
    private       State<E> currentState;
    private       State<E> previousState;
    private       State<E> globalState;

    public StateMachine(E owner) {
        this.owner = Objects.requireNonNull(owner, "owner cannot be null");
    }

    /**
     * Transition to a new state: exit the current state, then enter the new one, remembering the old state as the
     * previous state.
     *
     * @param newState the state to enter
     */
    public void changeState(State<E> newState) {
        Objects.requireNonNull(newState, "Cannot change to a null state");
        previousState = currentState;
        if (currentState != null) {
            currentState.exit(owner);
        }
        log.debug("{}: {} -> {}", owner, currentState, newState);
        currentState = newState;
        currentState.enter(owner);
    }

    public State<E> getCurrentState() {
        return currentState;
    }

    public State<E> getGlobalState() {
        return globalState;
    }

    public E getOwner() {
        return owner;
    }

    public State<E> getPreviousState() {
        return previousState;
    }

    /**
     * Offer the telegram to the global state first, then to the current state
     *
     * @return true if either state consumed the telegram
     */
    public boolean handleMessage(Telegram telegram) {
        if (globalState != null && globalState.onMessage(owner, telegram)) {
            return true;
        }
        return currentState != null && currentState.onMessage(owner, telegram);
    }

    public boolean isInState(State<E> state) {
        return currentState == state;
    }

    /**
     * Transition back to the previous state
     */
    public void revertToPreviousState() {
        if (previousState == null) {
            throw new IllegalStateException("No previous state to revert to for " + owner);
        }
        changeState(previousState);
    }

    /**
     * Set the initial current state without running any enter or exit hooks
     */
    public void setCurrentState(State<E> state) {
        currentState = state;
    }

    public void setGlobalState(State<E> state) {
        globalState = state;
    }

    public void setPreviousState(State<E> state) {
        previousState = state;
    }

    /**
     * Execute the global state, then the current state
     */
    public void update() {
        if (globalState != null) {
            globalState.execute(owner);
        }
        if (currentState != null) {
            currentState.execute(owner);
        }
    }

    @Override
    public String toString() {
        return String.format("StateMachine{owner=%s, current=%s, previous=%s, global=%s}", owner, currentState,
                             previousState, globalState);
    }
}
