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

import com.hellblazer.touchline.simulation.fsm.State;
import com.hellblazer.touchline.simulation.fsm.StateMachine;

import javax.vecmath.Point3f;

/**
 * The keeper guards the goal mouth, intercepts balls that come close and puts them back into play.
 *
 * @author hal.hildebrand
 */
public class GoalKeeper extends PlayerBase {
    private final StateMachine<GoalKeeper> stateMachine;

    public GoalKeeper(int id, Team team, int homeRegionId, State<GoalKeeper> startState) {
        super(id, team, homeRegionId, PlayerRole.GOAL_KEEPER);
        stateMachine = new StateMachine<>(this);
        stateMachine.setCurrentState(startState);
        stateMachine.setPreviousState(startState);
        stateMachine.setGlobalState(GoalKeeperStates.GLOBAL);
        startState.enter(this);

        position.set(getHomeRegion().getCenter());
        steering.setTarget(position);
    }

    /**
     * The point on the goal line the keeper guards. It slides along the mouth in proportion to the ball's offset from
     * the pitch center line.
     */
    public Point3f getRearInterposeTarget() {
        var goal = team.getHomeGoal();
        var z = ball.getPosition().z * goal.getWidth() / pitch.getPlayingArea().getHeight();
        return new Point3f(goal.getCenter().x, 0, z);
    }

    @Override
    public StateMachine<GoalKeeper> getStateMachine() {
        return stateMachine;
    }

    public boolean isBallWithinRangeForIntercept() {
        var range = config.keeperInterceptRange();
        return team.getHomeGoal().getCenter().distanceSquared(ball.getPosition()) <= range * range;
    }

    public boolean isTooFarFromGoalMouth() {
        var range = config.keeperInterceptRange();
        return position.distanceSquared(getRearInterposeTarget()) > range * range;
    }

    @Override
    public void update(float delta) {
        stateMachine.update();
        move(steering.calculate(delta), delta);
    }
}
