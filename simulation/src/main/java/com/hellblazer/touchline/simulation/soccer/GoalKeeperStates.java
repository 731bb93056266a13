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

import com.hellblazer.touchline.geometry.Vectors;
import com.hellblazer.touchline.simulation.fsm.State;
import com.hellblazer.touchline.simulation.messaging.MessageKind;
import com.hellblazer.touchline.simulation.messaging.Telegram;

/**
 * @author hal.hildebrand
 */
public enum GoalKeeperStates implements State<GoalKeeper> {
    GLOBAL {
        @Override
        public void execute(GoalKeeper keeper) {
        }

        @Override
        public boolean onMessage(GoalKeeper keeper, Telegram telegram) {
            switch (telegram.kind()) {
                case GO_HOME:
                    keeper.setDefaultHomeRegion();
                    keeper.getStateMachine().changeState(RETURN_HOME);
                    return true;
                case RECEIVE_BALL:
                    keeper.getStateMachine().changeState(INTERCEPT_BALL);
                    return true;
                default:
                    return false;
            }
        }
    },
    /**
     * Stay between the ball and the goal mouth. Trap the ball in range, go for it when it comes near the goal and the
     * team is not in control.
     */
    TEND_GOAL {
        @Override
        public void enter(GoalKeeper keeper) {
            keeper.getSteering().interposeOn(keeper.getConfiguration().keeperTendingDistance());
            keeper.getSteering().setTarget(keeper.getRearInterposeTarget());
        }

        @Override
        public void execute(GoalKeeper keeper) {
            keeper.getSteering().setTarget(keeper.getRearInterposeTarget());
            if (keeper.isBallWithinKeeperRange()) {
                takePossession(keeper);
                return;
            }
            var team = keeper.getTeam();
            if (keeper.isTooFarFromGoalMouth() && team.isInControl()) {
                keeper.getStateMachine().changeState(RETURN_HOME);
                return;
            }
            if (keeper.isBallWithinRangeForIntercept() && !team.isInControl()) {
                keeper.getStateMachine().changeState(INTERCEPT_BALL);
            }
        }

        @Override
        public void exit(GoalKeeper keeper) {
            keeper.getSteering().interposeOff();
        }
    },
    RETURN_HOME {
        @Override
        public void enter(GoalKeeper keeper) {
            keeper.getSteering().arriveOn();
        }

        @Override
        public void execute(GoalKeeper keeper) {
            keeper.getSteering().setTarget(keeper.getHomeRegion().getCenter());
            if (keeper.isInHomeRegion() || !keeper.getTeam().isInControl()) {
                keeper.getStateMachine().changeState(TEND_GOAL);
            }
        }

        @Override
        public void exit(GoalKeeper keeper) {
            keeper.getSteering().arriveOff();
        }
    },
    /**
     * Pursue the ball, unless the keeper strays too far from goal while someone else is closer to the ball
     */
    INTERCEPT_BALL {
        @Override
        public void enter(GoalKeeper keeper) {
            keeper.getSteering().pursuitOn();
        }

        @Override
        public void execute(GoalKeeper keeper) {
            if (keeper.isTooFarFromGoalMouth() && !keeper.isClosestPlayerOnPitchToBall()) {
                keeper.getStateMachine().changeState(RETURN_HOME);
                return;
            }
            if (keeper.isBallWithinKeeperRange()) {
                takePossession(keeper);
            }
        }

        @Override
        public void exit(GoalKeeper keeper) {
            keeper.getSteering().pursuitOff();
        }
    },
    /**
     * Hold the ball until a teammate further up the pitch can be passed to
     */
    PUT_BALL_BACK_IN_PLAY {
        @Override
        public void enter(GoalKeeper keeper) {
            var team = keeper.getTeam();
            team.setControllingPlayer(keeper);
            team.returnAllFieldPlayersToHome(false);
            team.getOpponents().returnAllFieldPlayersToHome(false);
        }

        @Override
        public void execute(GoalKeeper keeper) {
            var config = keeper.getConfiguration();
            var ball = keeper.getBall();
            var pass = keeper.getTeam().isPassPossible(keeper, config.maxPassingForce(), config.keeperMinPassDistance());
            if (pass.isPresent()) {
                ball.kick(Vectors.between(ball.getPosition(), pass.get().target()), config.maxPassingForce());
                keeper.getPitch().setGoalKeeperInBallPossession(false);
                keeper.send(pass.get().receiver(), MessageKind.RECEIVE_BALL, pass.get().target());
                keeper.getStateMachine().changeState(TEND_GOAL);
                return;
            }
            keeper.stop();
        }
    };

    private static void takePossession(GoalKeeper keeper) {
        keeper.getBall().trap();
        keeper.getPitch().setGoalKeeperInBallPossession(true);
        keeper.getStateMachine().changeState(PUT_BALL_BACK_IN_PLAY);
    }
}
