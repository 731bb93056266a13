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
package com.hellblazer.touchline.simulation.soccer;

import com.hellblazer.touchline.common.Regulator;
import com.hellblazer.touchline.simulation.fsm.State;
import com.hellblazer.touchline.simulation.fsm.StateMachine;

/**
 * An attacker or defender. Decisions are made by {@link FieldPlayerStates}; a player without steering force brakes.
 *
 * @author hal.hildebrand
 */
public class FieldPlayer extends PlayerBase {
    private final StateMachine<FieldPlayer> stateMachine;
    private final Regulator                 kickLimiter;

    public FieldPlayer(int id, Team team, int homeRegionId, State<FieldPlayer> startState, PlayerRole role) {
        super(id, team, homeRegionId, role);
        if (role == PlayerRole.GOAL_KEEPER) {
            throw new IllegalArgumentException("A field player cannot keep goal");
        }
        kickLimiter = pitch.createRegulator(config.kickFrequency());

        stateMachine = new StateMachine<>(this);
        stateMachine.setCurrentState(startState);
        stateMachine.setPreviousState(startState);
        stateMachine.setGlobalState(FieldPlayerStates.GLOBAL);
        startState.enter(this);

        position.set(getHomeRegion().getCenter());
        steering.setTarget(position);
    }

    @Override
    public StateMachine<FieldPlayer> getStateMachine() {
        return stateMachine;
    }

    /**
     * The kick limiter opens at most {@link SoccerConfiguration#kickFrequency()} times per second
     */
    public boolean isReadyForNextKick() {
        return kickLimiter.isReady();
    }

    @Override
    public void update(float delta) {
        stateMachine.update();
        var force = steering.calculate(delta);
        if (force.lengthSquared() == 0) {
            velocity.scale(config.brakingRate());
        }
        move(force, delta);
    }
}
