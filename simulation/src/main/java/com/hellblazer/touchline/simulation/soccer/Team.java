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

import com.hellblazer.touchline.geometry.LocalFrame;
import com.hellblazer.touchline.geometry.Rotations;
import com.hellblazer.touchline.geometry.Vectors;
import com.hellblazer.touchline.simulation.entity.GameEntity;
import com.hellblazer.touchline.simulation.fsm.StateMachine;
import com.hellblazer.touchline.simulation.messaging.MessageKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * One side of the match: a keeper and four field players, the key player references that are rederived every tick
 * and the tactical queries the players base their decisions on.
 *
 * @author hal.hildebrand
 */
public class Team extends GameEntity {
    /** Fraction of the receiver's running range used to place alternative pass targets */
    public static final float INTERCEPT_SCALING_FACTOR = 0.3f;

    private static final Logger log = LoggerFactory.getLogger(Team.class);

    private final Pitch                 pitch;
    private final TeamColor             color;
    private final Goal                  homeGoal;
    private final Goal                  opponentsGoal;
    private final List<PlayerBase>      players = new ArrayList<>();
    private final StateMachine<Team>    stateMachine;
    private final SupportSpotCalculator supportSpotCalculator;
    private       Team                  opponents;
    private       PlayerBase            controllingPlayer;
    private       PlayerBase            supportingPlayer;
    private       PlayerBase            receivingPlayer;
    private       PlayerBase            playerClosestToBall;
    private       float                 distanceSqToBallOfClosestPlayer = Float.MAX_VALUE;

    public Team(int id, Pitch pitch, TeamColor color, Goal homeGoal, Goal opponentsGoal) {
        super(id, 0);
        this.pitch = pitch;
        this.color = color;
        this.homeGoal = homeGoal;
        this.opponentsGoal = opponentsGoal;
        rotation.set(Rotations.lookAlong(homeGoal.getFacing()));

        stateMachine = new StateMachine<>(this);
        stateMachine.setCurrentState(TeamStates.DEFENDING);
        stateMachine.setPreviousState(TeamStates.DEFENDING);

        createPlayers();
        supportSpotCalculator = new SupportSpotCalculator(this, pitch.createRegulator(
        pitch.getConfiguration().supportSpotUpdateFrequency()));
        pitch.getDispatcher().register(this);
    }

    /**
     * The two tangent points on a circle as seen from a point outside it
     *
     * @param center the circle center
     * @param radius the circle radius
     * @param point  the viewpoint
     * @return the tangent points, or empty if the point lies inside or on the circle
     */
    public static Optional<TangentPoints> getTangentPoints(Point3f center, float radius, Point3f point) {
        var toPoint = Vectors.between(center, point);
        var lengthSq = toPoint.x * toPoint.x + toPoint.z * toPoint.z;
        var radiusSq = radius * radius;
        if (lengthSq <= radiusSq) {
            return Optional.empty();
        }
        var lengthSqInv = 1 / lengthSq;
        var root = (float) Math.sqrt(lengthSq - radiusSq);
        var first = new Point3f(center.x + radius * (radius * toPoint.x - toPoint.z * root) * lengthSqInv, 0,
                                center.z + radius * (radius * toPoint.z + toPoint.x * root) * lengthSqInv);
        var second = new Point3f(center.x + radius * (radius * toPoint.x + toPoint.z * root) * lengthSqInv, 0,
                                 center.z + radius * (radius * toPoint.z - toPoint.x * root) * lengthSqInv);
        return Optional.of(new TangentPoints(first, second));
    }

    private static LocalFrame passFrame(Point3f start, Point3f target) {
        var heading = Vectors.between(start, target);
        if (heading.x == 0 && heading.z == 0) {
            heading = new Vector3f(Rotations.FORWARD);
        }
        return LocalFrame.of(start, heading);
    }

    /**
     * The attacker, other than the controlling player, closest to the best supporting spot
     */
    public PlayerBase calculateBestSupportingAttacker() {
        var closestSoFar = Float.MAX_VALUE;
        PlayerBase best = null;
        var spot = supportSpotCalculator.getBestSupportingSpot();
        for (var player : players) {
            if (player.getRole() == PlayerRole.ATTACKER && player != controllingPlayer) {
                var distance = player.getPosition().distanceSquared(spot);
                if (distance < closestSoFar) {
                    closestSoFar = distance;
                    best = player;
                }
            }
        }
        return best;
    }

    public Point3f calculateBestSupportingPosition() {
        return supportSpotCalculator.calculateBestSupportingPosition();
    }

    public TeamColor getColor() {
        return color;
    }

    public PlayerBase getControllingPlayer() {
        return controllingPlayer;
    }

    /**
     * Make the player the one in control of the ball. The opponents lose control.
     */
    public void setControllingPlayer(PlayerBase player) {
        controllingPlayer = player;
        if (opponents != null) {
            opponents.lostControl();
        }
    }

    public float getDistanceSqToBallOfClosestPlayer() {
        return distanceSqToBallOfClosestPlayer;
    }

    public Goal getHomeGoal() {
        return homeGoal;
    }

    public Team getOpponents() {
        return opponents;
    }

    void setOpponents(Team opponents) {
        this.opponents = opponents;
    }

    public Goal getOpponentsGoal() {
        return opponentsGoal;
    }

    public Pitch getPitch() {
        return pitch;
    }

    public PlayerBase getPlayerClosestToBall() {
        return playerClosestToBall;
    }

    void setPlayerClosestToBall(PlayerBase player) {
        playerClosestToBall = player;
    }

    /**
     * @return the keeper followed by the field players, in creation order
     */
    public List<PlayerBase> getPlayers() {
        return Collections.unmodifiableList(players);
    }

    public PlayerBase getReceivingPlayer() {
        return receivingPlayer;
    }

    public void setReceivingPlayer(PlayerBase receivingPlayer) {
        this.receivingPlayer = receivingPlayer;
    }

    public StateMachine<Team> getStateMachine() {
        return stateMachine;
    }

    public Point3f getSupportSpot() {
        return supportSpotCalculator.getBestSupportingSpot();
    }

    public SupportSpotCalculator getSupportSpotCalculator() {
        return supportSpotCalculator;
    }

    public PlayerBase getSupportingPlayer() {
        return supportingPlayer;
    }

    public void setSupportingPlayer(PlayerBase supportingPlayer) {
        this.supportingPlayer = supportingPlayer;
    }

    public boolean isAllPlayersAtHome() {
        for (var player : players) {
            if (!player.isInHomeRegion()) {
                return false;
            }
        }
        return true;
    }

    public boolean isInControl() {
        return controllingPlayer != null;
    }

    public boolean isOpponentWithinRadius(Point3f position, float radius) {
        var radiusSq = radius * radius;
        for (var opponent : opponents.getPlayers()) {
            if (opponent.getPosition().distanceSquared(position) < radiusSq) {
                return true;
            }
        }
        return false;
    }

    /**
     * Find the teammate whose safe pass target lies closest to the opponents' goal line
     *
     * @param passer          the player about to pass
     * @param power           the kick force
     * @param minPassDistance receivers nearer than this to the passer are not considered
     * @return the receiver and the point to kick the ball to, if any pass is possible
     */
    public Optional<Pass> isPassPossible(PlayerBase passer, float power, float minPassDistance) {
        var closestToGoalSoFar = Float.MAX_VALUE;
        Pass best = null;
        var passerPosition = passer.getPosition();
        for (var player : players) {
            if (player == passer
            || passerPosition.distanceSquared(player.getPosition()) <= minPassDistance * minPassDistance) {
                continue;
            }
            var target = isPassToReceiverPossible(player, power);
            if (target.isPresent()) {
                var distanceToGoal = Math.abs(target.get().x - opponentsGoal.getCenter().x);
                if (distanceToGoal < closestToGoalSoFar) {
                    closestToGoalSoFar = distanceToGoal;
                    best = new Pass(player, target.get());
                }
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Test whether no opponent can intercept a ball kicked from start to target
     *
     * @param receiver the intended receiver, or null when the target is just a position
     */
    public boolean isPassSafeFromAllOpponents(Point3f start, Point3f target, PlayerBase receiver, float force) {
        var frame = passFrame(start, target);
        for (var opponent : opponents.getPlayers()) {
            if (!isPassSafeFromOpponent(start, target, receiver, opponent, force, frame)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Test the pass against a single opponent. An opponent behind the start of the pass can never intercept it.
     */
    public boolean isPassSafeFromOpponent(Point3f start, Point3f target, PlayerBase receiver, PlayerBase opponent,
                                          float force) {
        return isPassSafeFromOpponent(start, target, receiver, opponent, force, passFrame(start, target));
    }

    /**
     * Try a number of random targets along the opponents' goal mouth
     *
     * @param from  where the ball is kicked from
     * @param power the kick force
     * @return a target that the ball reaches and no opponent can intercept
     */
    public Optional<Point3f> isShootPossible(Point3f from, float power) {
        var ball = pitch.getBall();
        var random = pitch.getRandom();
        var minZ = opponentsGoal.getLeftPost().z + ball.getBoundingRadius();
        var maxZ = opponentsGoal.getRightPost().z - ball.getBoundingRadius();
        for (int i = 0; i < pitch.getConfiguration().strikeAttempts(); i++) {
            var target = opponentsGoal.getCenter();
            // whole unit steps from the left post; the last step can overshoot a mouth of fractional width
            var z = minZ + (float) Math.floor(random.nextDouble() * (maxZ - minZ + 1));
            target.z = Math.min(z, maxZ);
            var time = ball.calculateTimeToCoverDistance(from, target, power);
            if (time >= 0 && isPassSafeFromAllOpponents(from, target, null, power)) {
                return Optional.of(target);
            }
        }
        return Optional.empty();
    }

    public void lostControl() {
        controllingPlayer = null;
    }

    /**
     * Ask the controlling player for the ball, if a pass to the requester would be safe
     */
    public void requestPass(PlayerBase requester) {
        var config = pitch.getConfiguration();
        if (pitch.getRandom().nextFloat() > config.chanceOfHandlingPassRequest()) {
            return;
        }
        if (controllingPlayer == null || controllingPlayer == requester) {
            return;
        }
        if (isPassSafeFromAllOpponents(controllingPlayer.getPosition(), requester.getPosition(), requester,
                                       config.maxPassingForce())) {
            requester.send(controllingPlayer, MessageKind.PASS_TO_ME, requester);
        }
    }

    /**
     * Send every field player, and optionally the keeper, back to its default home region
     */
    public void returnAllFieldPlayersToHome(boolean withGoalKeeper) {
        var dispatcher = pitch.getDispatcher();
        for (var player : players) {
            if (withGoalKeeper || player.getRole() != PlayerRole.GOAL_KEEPER) {
                dispatcher.send(getId(), player.getId(), MessageKind.GO_HOME);
            }
        }
    }

    /**
     * Forget all key players
     */
    public void resetKeyPlayers() {
        controllingPlayer = null;
        supportingPlayer = null;
        receivingPlayer = null;
        playerClosestToBall = null;
    }

    /**
     * Assign the home regions of the current team state
     *
     * @throws IllegalStateException if the team is neither attacking nor defending
     */
    public void setupTeamPositions() {
        boolean attacking;
        if (stateMachine.isInState(TeamStates.ATTACKING)) {
            attacking = true;
        } else if (stateMachine.isInState(TeamStates.DEFENDING)) {
            attacking = false;
        } else {
            throw new IllegalStateException("No team positions for " + this + " in " + stateMachine.getCurrentState());
        }
        for (int i = 0; i < players.size(); i++) {
            players.get(i).setHomeRegionId(attacking ? color.attackingRegion(i) : color.defendingRegion(i));
        }
    }

    @Override
    public String toString() {
        return "Team[" + color + "]";
    }

    @Override
    public void update(float delta) {
        calculateClosestPlayerToBall();
        stateMachine.update();
        for (var player : players) {
            player.update(delta);
        }
    }

    /**
     * Point waiting and homeward bound players at the centers of their current home regions
     */
    public void updateTargetsOfWaitingPlayers() {
        for (var player : players) {
            if (player instanceof FieldPlayer fieldPlayer) {
                var fsm = fieldPlayer.getStateMachine();
                if (fsm.isInState(FieldPlayerStates.WAIT) || fsm.isInState(FieldPlayerStates.RETURN_TO_HOME_REGION)) {
                    fieldPlayer.getSteering().setTarget(fieldPlayer.getHomeRegion().getCenter());
                }
            }
        }
    }

    void calculateClosestPlayerToBall() {
        var ballPosition = pitch.getBall().getPosition();
        var closest = Float.MAX_VALUE;
        for (var player : players) {
            var distanceSq = player.getPosition().distanceSquared(ballPosition);
            player.setDistanceSqToBall(distanceSq);
            if (distanceSq < closest) {
                closest = distanceSq;
                playerClosestToBall = player;
            }
        }
        distanceSqToBallOfClosestPlayer = closest;
    }

    /**
     * Find the best point to pass to the receiver: its position or one of the tangent points of the circle it can
     * cover while the ball travels, whichever safe target lies closest to the opponents' goal line.
     */
    Optional<Point3f> isPassToReceiverPossible(PlayerBase receiver, float power) {
        var ball = pitch.getBall();
        var ballPosition = ball.getPosition();
        var receiverPosition = receiver.getPosition();
        var time = ball.calculateTimeToCoverDistance(ballPosition, receiverPosition, power);
        if (time < 0) {
            return Optional.empty();
        }
        var interceptRange = time * receiver.getMaxSpeed() * INTERCEPT_SCALING_FACTOR;

        var candidates = new ArrayList<Point3f>(3);
        var tangents = getTangentPoints(receiverPosition, interceptRange, ballPosition);
        tangents.ifPresent(t -> candidates.add(t.first()));
        candidates.add(receiverPosition);
        tangents.ifPresent(t -> candidates.add(t.second()));

        var closestPassSoFar = Float.MAX_VALUE;
        Point3f best = null;
        for (var candidate : candidates) {
            var distance = Math.abs(candidate.x - opponentsGoal.getCenter().x);
            if (distance < closestPassSoFar && pitch.getPlayingArea().isInside(candidate)
            && isPassSafeFromAllOpponents(ballPosition, candidate, receiver, power)) {
                closestPassSoFar = distance;
                best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }

    private void createPlayers() {
        var entities = pitch.getEntityManager();
        var facing = Rotations.lookAlong(homeGoal.getFacing());
        for (int i = 0; i < 5; i++) {
            var region = color.kickOffRegion(i);
            PlayerBase player;
            if (i == 0) {
                player = new GoalKeeper(entities.nextId(), this, region, GoalKeeperStates.TEND_GOAL);
            } else {
                var role = i < 3 ? PlayerRole.ATTACKER : PlayerRole.DEFENDER;
                player = new FieldPlayer(entities.nextId(), this, region, FieldPlayerStates.WAIT, role);
            }
            player.setRotation(facing);
            players.add(player);
            entities.add(player);
            pitch.getWorld().addAgent(player);
            pitch.getDispatcher().register(player);
        }
        log.debug("{} created {} players", this, players.size());
    }

    private boolean isPassSafeFromOpponent(Point3f start, Point3f target, PlayerBase receiver, PlayerBase opponent,
                                           float force, LocalFrame frame) {
        var opponentPosition = opponent.getPosition();
        var local = frame.toLocal(opponentPosition);
        if (local.z < 0) {
            return true;
        }
        if (start.distanceSquared(target) < start.distanceSquared(opponentPosition)) {
            if (receiver != null) {
                return target.distanceSquared(opponentPosition) > target.distanceSquared(receiver.getPosition());
            }
            return true;
        }
        var ball = pitch.getBall();
        var timeForBall = ball.calculateTimeToCoverDistance(new Point3f(), new Point3f(local.z, 0, 0), force);
        var reach = opponent.getMaxSpeed() * timeForBall + ball.getBoundingRadius() + opponent.getBoundingRadius();
        return Math.abs(local.x) >= reach;
    }

    /**
     * A pass: the teammate to receive it and the point the ball is kicked to
     */
    public record Pass(PlayerBase receiver, Point3f target) {
    }

    /**
     * Points where the tangents from a viewpoint touch a circle
     */
    public record TangentPoints(Point3f first, Point3f second) {
    }
}
