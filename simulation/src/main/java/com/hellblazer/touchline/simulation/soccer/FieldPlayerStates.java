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

import com.hellblazer.touchline.geometry.Rotations;
import com.hellblazer.touchline.geometry.Vectors;
import com.hellblazer.touchline.simulation.fsm.State;
import com.hellblazer.touchline.simulation.messaging.MessageKind;
import com.hellblazer.touchline.simulation.messaging.Telegram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3f;
import java.util.Optional;

/**
 * Decision making of attackers and defenders.
 *
 * @author hal.hildebrand
 */
public enum FieldPlayerStates implements State<FieldPlayer> {
    /**
     * Slows a player down while it has the ball at its feet and reacts to the messages of teammates
     */
    GLOBAL {
        @Override
        public void execute(FieldPlayer player) {
            var config = player.getConfiguration();
            if (player.isBallWithinReceivingRange() && player.isControllingPlayer()) {
                player.setMaxSpeed(config.maxSpeedWithBall());
            } else {
                player.setMaxSpeed(config.maxSpeedWithoutBall());
            }
        }

        @Override
        public boolean onMessage(FieldPlayer player, Telegram telegram) {
            var fsm = player.getStateMachine();
            switch (telegram.kind()) {
                case RECEIVE_BALL:
                    player.getSteering().setTarget(telegram.payload(Point3f.class));
                    fsm.changeState(RECEIVE_BALL);
                    return true;
                case SUPPORT_ATTACKER:
                    if (fsm.isInState(SUPPORT_ATTACKER)) {
                        return true;
                    }
                    player.getSteering().setTarget(player.getTeam().getSupportSpot());
                    fsm.changeState(SUPPORT_ATTACKER);
                    return true;
                case GO_HOME:
                    player.setDefaultHomeRegion();
                    fsm.changeState(RETURN_TO_HOME_REGION);
                    return true;
                case PASS_TO_ME:
                    passTo(player, telegram.payload(PlayerBase.class));
                    return true;
                default:
                    return false;
            }
        }

        private void passTo(FieldPlayer player, PlayerBase requester) {
            if (player.getTeam().getReceivingPlayer() != null || !player.isBallWithinKickingRange()) {
                return;
            }
            var ball = player.getBall();
            var target = requester.getPosition();
            ball.kick(Vectors.between(ball.getPosition(), target), player.getConfiguration().maxPassingForce());
            log.debug("{} passes to {} on request", player, requester);
            player.send(requester, MessageKind.RECEIVE_BALL, target);
            player.getStateMachine().changeState(WAIT);
            player.findSupport();
        }
    },
    /**
     * Seek the ball while this player is the team's closest to it
     */
    CHASE_BALL {
        @Override
        public void enter(FieldPlayer player) {
            player.getSteering().seekOn();
        }

        @Override
        public void execute(FieldPlayer player) {
            if (player.isBallWithinKickingRange()) {
                player.getStateMachine().changeState(KICK_BALL);
                return;
            }
            if (player.isClosestTeamMemberToBall()) {
                player.getSteering().setTarget(player.getBall().getPosition());
                return;
            }
            player.getStateMachine().changeState(RETURN_TO_HOME_REGION);
        }

        @Override
        public void exit(FieldPlayer player) {
            player.getSteering().seekOff();
        }
    },
    /**
     * Run to the best supporting spot and ask for the ball from there
     */
    SUPPORT_ATTACKER {
        @Override
        public void enter(FieldPlayer player) {
            player.getSteering().arriveOn();
            player.getSteering().setTarget(player.getTeam().getSupportSpot());
        }

        @Override
        public void execute(FieldPlayer player) {
            var team = player.getTeam();
            var steering = player.getSteering();
            if (!team.isInControl()) {
                player.getStateMachine().changeState(RETURN_TO_HOME_REGION);
                return;
            }
            var spot = team.getSupportSpot();
            if (!spot.equals(steering.getTarget())) {
                steering.setTarget(spot);
                steering.arriveOn();
            }
            var config = player.getConfiguration();
            if (team.isShootPossible(player.getPosition(), config.maxShootingForce()).isPresent()) {
                team.requestPass(player);
            }
            if (player.isAtTarget()) {
                steering.arriveOff();
                player.trackBall();
                player.stop();
                if (!player.isThreatened()) {
                    team.requestPass(player);
                }
            }
        }

        @Override
        public void exit(FieldPlayer player) {
            player.getTeam().setSupportingPlayer(null);
            player.getSteering().arriveOff();
        }
    },
    RETURN_TO_HOME_REGION {
        @Override
        public void enter(FieldPlayer player) {
            player.getSteering().arriveOn();
            if (!player.getHomeRegion().isInside(player.getSteering().getTarget(), true)) {
                player.getSteering().setTarget(player.getHomeRegion().getCenter());
            }
        }

        @Override
        public void execute(FieldPlayer player) {
            var pitch = player.getPitch();
            if (pitch.isGameOn() && shouldChase(player)) {
                player.getStateMachine().changeState(CHASE_BALL);
                return;
            }
            if (pitch.isGameOn() && player.isInHomeRegion()) {
                player.getSteering().setTarget(player.getPosition());
                player.getStateMachine().changeState(WAIT);
            } else if (!pitch.isGameOn() && player.isAtTarget()) {
                player.getStateMachine().changeState(WAIT);
            }
        }

        @Override
        public void exit(FieldPlayer player) {
            player.getSteering().arriveOff();
        }
    },
    /**
     * Hold position facing the ball. Players further upfield than the attacker ask for the ball.
     */
    WAIT {
        @Override
        public void enter(FieldPlayer player) {
            if (!player.getPitch().isGameOn()) {
                player.getSteering().setTarget(player.getHomeRegion().getCenter());
            }
        }

        @Override
        public void execute(FieldPlayer player) {
            var steering = player.getSteering();
            if (!player.isAtTarget()) {
                steering.arriveOn();
            } else {
                steering.arriveOff();
                player.stop();
                player.trackBall();
            }
            var team = player.getTeam();
            if (team.isInControl() && !player.isControllingPlayer() && player.isAheadOfAttacker()) {
                team.requestPass(player);
                return;
            }
            if (player.getPitch().isGameOn() && shouldChase(player)) {
                player.getStateMachine().changeState(CHASE_BALL);
            }
        }
    },
    /**
     * Shoot if a goal is possible, pass when threatened, dribble otherwise
     */
    KICK_BALL {
        @Override
        public void enter(FieldPlayer player) {
            player.getTeam().setControllingPlayer(player);
            if (!player.isReadyForNextKick()) {
                player.getStateMachine().changeState(CHASE_BALL);
            }
        }

        @Override
        public void execute(FieldPlayer player) {
            var ball = player.getBall();
            var team = player.getTeam();
            var config = player.getConfiguration();
            var toBall = Vectors.normalized(Vectors.between(player.getPosition(), ball.getPosition()));
            var dot = toBall.dot(player.getDirection());

            if (player.getPitch().isGoalKeeperInBallPossession() || dot < 0 || team.getReceivingPlayer() != null) {
                player.getStateMachine().changeState(CHASE_BALL);
                return;
            }

            var random = player.getPitch().getRandom();
            var power = config.maxShootingForce() * dot;
            var shot = team.isShootPossible(ball.getPosition(), power);
            if (shot.isPresent() || random.nextFloat() < config.chanceOfPotShot()) {
                var target = ball.addNoiseToKick(shot.orElseGet(team.getOpponentsGoal()::getCenter), random);
                ball.kick(Vectors.between(ball.getPosition(), target), power);
                log.debug("{} shoots at {} with power {}", player, target, power);
                player.getStateMachine().changeState(WAIT);
                player.findSupport();
                return;
            }

            power = config.maxPassingForce() * dot;
            var pass = player.isThreatened() ? team.isPassPossible(player, power, config.minPassDistance())
                                             : Optional.<Team.Pass>empty();
            if (pass.isPresent()) {
                var target = ball.addNoiseToKick(pass.get().target(), random);
                ball.kick(Vectors.between(ball.getPosition(), target), power);
                log.debug("{} passes to {}", player, pass.get().receiver());
                player.send(pass.get().receiver(), MessageKind.RECEIVE_BALL, target);
                player.getStateMachine().changeState(WAIT);
                player.findSupport();
            } else {
                player.findSupport();
                player.getStateMachine().changeState(DRIBBLE);
            }
        }
    },
    /**
     * Knock the ball towards the opponents' goal. A player facing its own goal turns with the ball in small steps.
     */
    DRIBBLE {
        @Override
        public void enter(FieldPlayer player) {
            player.getTeam().setControllingPlayer(player);
        }

        @Override
        public void execute(FieldPlayer player) {
            var config = player.getConfiguration();
            var direction = player.getDirection();
            var facing = player.getTeam().getHomeGoal().getFacing();
            if (direction.dot(facing) < 0) {
                var sign = direction.x * facing.z < direction.z * facing.x ? 1 : -1;
                var turned = Rotations.rotateY(direction, QUARTER_PI * sign);
                player.getBall().kick(turned, config.maxDribbleAndTurnForce());
            } else {
                player.getBall().kick(facing, config.maxDribbleForce());
            }
            player.getStateMachine().changeState(CHASE_BALL);
        }
    },
    /**
     * Wait for a pass at the target, or pursue the ball when opponents are near and the player is not in the hot
     * region
     */
    RECEIVE_BALL {
        @Override
        public void enter(FieldPlayer player) {
            var team = player.getTeam();
            var config = player.getConfiguration();
            team.setReceivingPlayer(player);
            team.setControllingPlayer(player);

            var arrive = player.isInHotRegion()
            || player.getPitch().getRandom().nextFloat() < config.chanceOfUsingArriveToReceive();
            if (arrive && !team.isOpponentWithinRadius(player.getPosition(), config.passThreatRadius())) {
                player.getSteering().arriveOn();
            } else {
                player.getSteering().pursuitOn();
            }
        }

        @Override
        public void execute(FieldPlayer player) {
            var steering = player.getSteering();
            if (player.isBallWithinReceivingRange() || !player.getTeam().isInControl()) {
                player.getStateMachine().changeState(CHASE_BALL);
                return;
            }
            if (steering.isPursuitOn()) {
                steering.setTarget(player.getBall().getPosition());
            }
            if (player.isAtTarget()) {
                steering.arriveOff();
                steering.pursuitOff();
                player.trackBall();
                player.stop();
            }
        }

        @Override
        public void exit(FieldPlayer player) {
            player.getSteering().arriveOff();
            player.getSteering().pursuitOff();
            player.getTeam().setReceivingPlayer(null);
        }
    };

    private static final Logger log        = LoggerFactory.getLogger(FieldPlayerStates.class);
    private static final float  QUARTER_PI = (float) (Math.PI * 0.25);

    /**
     * Closest to the ball, nobody is waiting for a pass and no keeper holds the ball
     */
    private static boolean shouldChase(FieldPlayer player) {
        return player.isClosestTeamMemberToBall() && player.getTeam().getReceivingPlayer() == null
        && !player.getPitch().isGoalKeeperInBallPossession();
    }
}
