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

/**
 * A stateless state of an entity's finite state machine. Implementations hold no per-entity data, so a single
 * instance, typically an enum constant, is shared by every machine that enters it.
 *
 * @param <E> the type of entity driven by the state
 * @author hal.hildebrand
 */
public interface State<E> {

    /**
     * Called once when the machine enters this state
     */
    default void enter(E entity) {
    }

    /**
     * Called on every update while this state is current (or global)
     */
    void execute(E entity);

    /**
     * Called once when the machine leaves this state
     */
    default void exit(E entity) {
    }

    /**
     * @return true if the telegram was consumed
     */
    default boolean onMessage(E entity, Telegram telegram) {
        return false;
    }
}
