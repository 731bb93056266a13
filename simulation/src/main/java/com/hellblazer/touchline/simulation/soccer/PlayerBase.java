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
import com.hellblazer.touchline.simulation.entity.MovingEntity;
import com.hellblazer.touchline.simulation.fsm.StateMachine;
import com.hellblazer.touchline.simulation.messaging.MessageKind;
import com.hellblazer.touchline.simulation.messaging.Telegram;
import com.hellblazer.touchline.simulation.steering.SteeringBehaviors;
import com.hellblazer.touchline.simulation.steering.SteeringParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;

/**
 * State shared by field players and goal keepers: the team and pitch they belong to, their steering, their home
 * region and the tactical predicates the state machines are written in terms of.
 *
 * @author hal.hildebrand
 */
public abstract class PlayerBase extends MovingEntity {
    private static final Logger log = LoggerFactory.getLogger(PlayerBase.class);

    protected final Team                team;
    protected final Pitch               pitch;
    protected final Ball                ball;
    protected final SteeringBehaviors   steering;
    protected final SoccerConfiguration config;
    private final   PlayerRole          role;
    private final   int                 defaultRegionId;
    private         int                 homeRegionId;
    private         float               distanceSqToBall = Float.MAX_VALUE;

    protected PlayerBase(int id, Team team, int homeRegionId, PlayerRole role) {
        super(id, team.getPitch().getConfiguration().playerRadius(),
              team.getPitch().getConfiguration().playerMass(),
              team.getPitch().getConfiguration().maxSpeedWithoutBall(),
              team.getPitch().getConfiguration().maxForce(), team.getPitch().getConfiguration().maxTurnRate());
        this.team = team;
        this.pitch = team.getPitch();
        this.ball = pitch.getBall();
        this.config = pitch.getConfiguration();
        this.role = role;
        this.homeRegionId = homeRegionId;
        this.defaultRegionId = homeRegionId;
        steering = new SteeringBehaviors(this, pitch.getWorld(), SteeringParameters.defaultConfig(), pitch.getRandom());
        steering.setTargetAgent1(ball);
    }

    /**
     * Make sure the attacker has the best placed teammate running into support. A change of supporter sends the
     * previous one home.
     */
    public void findSupport() {
        var best = team.calculateBestSupportingAttacker();
        var current = team.getSupportingPlayer();
        if (current == null) {
            if (best == null) {
                log.debug("{} found no supporting attacker", this);
                return;
            }
            team.setSupportingPlayer(best);
            send(best, MessageKind.SUPPORT_ATTACKER);
            return;
        }
        if (best != null && best != current) {
            send(current, MessageKind.GO_HOME);
            team.setSupportingPlayer(best);
            send(best, MessageKind.SUPPORT_ATTACKER);
        }
    }

    public Ball getBall() {
        return ball;
    }

    public SoccerConfiguration getConfiguration() {
        return config;
    }

    public float getDistanceSqToBall() {
        return distanceSqToBall;
    }

    void setDistanceSqToBall(float distanceSqToBall) {
        this.distanceSqToBall = distanceSqToBall;
    }

    /**
     * Distance along the x axis to the goal this player defends
     */
    public float getDistanceToHomeGoal() {
        return Math.abs(position.x - team.getHomeGoal().getCenter().x);
    }

    /**
     * Distance along the x axis to the goal this player attacks
     */
    public float getDistanceToOpponentsGoal() {
        return Math.abs(position.x - team.getOpponentsGoal().getCenter().x);
    }

    public Region getHomeRegion() {
        return pitch.getRegionById(homeRegionId);
    }

    public int getHomeRegionId() {
        return homeRegionId;
    }

    public void setHomeRegionId(int homeRegionId) {
        this.homeRegionId = homeRegionId;
    }

    public Pitch getPitch() {
        return pitch;
    }

    public PlayerRole getRole() {
        return role;
    }

    public abstract StateMachine<? extends PlayerBase> getStateMachine();

    public SteeringBehaviors getSteering() {
        return steering;
    }

    public Team getTeam() {
        return team;
    }

    @Override
    public boolean handleMessage(Telegram telegram) {
        return getStateMachine().handleMessage(telegram);
    }

    /**
     * True if this player is nearer the opponents' goal than the player controlling the ball
     */
    public boolean isAheadOfAttacker() {
        var controlling = team.getControllingPlayer();
        if (controlling == null) {
            return false;
        }
        return getDistanceToOpponentsGoal() < controlling.getDistanceToOpponentsGoal();
    }

    public boolean isAtTarget() {
        var range = config.inTargetRange();
        return position.distanceSquared(steering.getTarget()) < range * range;
    }

    public boolean isBallWithinKeeperRange() {
        var range = config.keeperInTargetRange();
        return position.distanceSquared(ball.getPosition()) < range * range;
    }

    public boolean isBallWithinKickingRange() {
        var range = config.kickingDistance() + ball.getBoundingRadius();
        return position.distanceSquared(ball.getPosition()) < range * range;
    }

    public boolean isBallWithinReceivingRange() {
        var range = config.receivingRange();
        return position.distanceSquared(ball.getPosition()) < range * range;
    }

    /**
     * True if this player is its team's closest player to the ball and nearer to it than any opponent
     */
    public boolean isClosestPlayerOnPitchToBall() {
        return isClosestTeamMemberToBall()
        && distanceSqToBall < team.getOpponents().getDistanceSqToBallOfClosestPlayer();
    }

    public boolean isClosestTeamMemberToBall() {
        return team.getPlayerClosestToBall() == this;
    }

    public boolean isControllingPlayer() {
        return team.getControllingPlayer() == this;
    }

    /**
     * True inside the third of the pitch nearest the opponents' goal
     */
    public boolean isInHotRegion() {
        return getDistanceToOpponentsGoal() < pitch.getPlayingArea().getLength() / 3;
    }

    /**
     * The keeper only has to be somewhere in its region, field players within its central half
     */
    public boolean isInHomeRegion() {
        return getHomeRegion().isInside(position, role != PlayerRole.GOAL_KEEPER);
    }

    public boolean isPositionInFrontOfPlayer(Point3f target) {
        return Vectors.between(position, target).dot(getDirection()) > 0;
    }

    /**
     * True if an opponent in front of this player is inside its comfort zone
     */
    public boolean isThreatened() {
        var comfort = config.comfortZone() * config.comfortZone();
        for (var opponent : team.getOpponents().getPlayers()) {
            var opponentPosition = opponent.getPosition();
            if (isPositionInFrontOfPlayer(opponentPosition) && position.distanceSquared(opponentPosition) < comfort) {
                return true;
            }
        }
        return false;
    }

    /**
     * Go back to the region assigned at creation
     */
    public void setDefaultHomeRegion() {
        homeRegionId = defaultRegionId;
    }

    /**
     * Stop moving at once
     */
    public void stop() {
        velocity.set(0, 0, 0);
    }

    /**
     * Turn towards the ball, limited by the turn rate
     */
    public void trackBall() {
        isRotateHeadingToFacePosition(ball.getPosition());
    }

    @Override
    public String toString() {
        return String.format("%s[%d %s %s]", getClass().getSimpleName(), getId(), team.getColor(), role);
    }

    /**
     * Integrate the steering force over one step and face the direction of travel
     */
    protected void move(Vector3f force, float delta) {
        integrate(force, delta);
        if (velocity.lengthSquared() > MIN_SPEED_SQ_FOR_HEADING) {
            rotateToDirection(velocity);
        }
    }

    boolean send(PlayerBase receiver, MessageKind kind) {
        return pitch.getDispatcher().send(getId(), receiver.getId(), kind);
    }

    boolean send(PlayerBase receiver, MessageKind kind, Object payload) {
        return pitch.getDispatcher().send(getId(), receiver.getId(), kind, payload);
    }
}
