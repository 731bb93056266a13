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
package com.hellblazer.touchline.simulation.steering;

import com.hellblazer.touchline.common.Path;
import com.hellblazer.touchline.geometry.Ray3D;
import com.hellblazer.touchline.geometry.RayHit;
import com.hellblazer.touchline.geometry.Rotations;
import com.hellblazer.touchline.geometry.Vectors;
import com.hellblazer.touchline.simulation.entity.MovingEntity;
import com.hellblazer.touchline.simulation.world.Wall;
import com.hellblazer.touchline.simulation.world.World;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3f;
import javax.vecmath.Tuple3f;
import javax.vecmath.Vector3f;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.random.RandomGenerator;

/**
 * Steering force engine of a single agent. Behaviors are switched on and off by the agent's decision layer; each
 * call to {@link #calculate(float)} evaluates the active behaviors in {@link BehaviorKind} order, scales each force
 * by its weight and accumulates it until the agent's maximum force is used up. Behaviors after that point are
 * skipped for the tick.
 * <p>
 * Evade, pursuit, offset pursuit, interpose and hide act on target agents. Switching one of them on without its
 * target is a programming error and fails the calculation with an {@link IllegalStateException}.
 *
 * <pre>
 * var steering = new SteeringBehaviors(agent, world, SteeringParameters.defaultConfig(), random);
 * steering.setTarget(new Point3f(10, 0, 10));
 * steering.arriveOn();
 * var force = steering.calculate(delta);
 * </pre>
 *
 * @author hal.hildebrand
 */
public class SteeringBehaviors {
    public static final float BRAKING_WEIGHT = 0.2f;

    private static final Logger log                = LoggerFactory.getLogger(SteeringBehaviors.class);
    private static final float  SIDE_FEELER_LEFT   = (float) (Math.PI * 1.75);
    private static final float  SIDE_FEELER_RIGHT  = (float) (Math.PI * 0.25);
    private static final float  ZERO_LENGTH_FACTOR = 0.0001f;

    private final MovingEntity      owner;
    private final World             world;
    private final RandomGenerator   random;
    private final Set<BehaviorKind> active        = EnumSet.noneOf(BehaviorKind.class);
    private final Vector3f          steeringForce = new Vector3f();
    private final Point3f           target        = new Point3f();
    private final Vector3f          offset        = new Vector3f();
    private final Vector3f          wanderTarget;
    private       SteeringParameters parameters;
    private       List<MovingEntity> neighbors    = Collections.emptyList();
    private       MovingEntity       targetAgent1;
    private       MovingEntity       targetAgent2;
    private       Path               path         = new Path();
    private       float              deceleration;
    private       float              interposeDistance;

    public SteeringBehaviors(MovingEntity owner, World world, SteeringParameters parameters, RandomGenerator random) {
        this.owner = Objects.requireNonNull(owner, "owner cannot be null");
        this.world = Objects.requireNonNull(world, "world cannot be null");
        this.parameters = Objects.requireNonNull(parameters, "parameters cannot be null");
        this.random = Objects.requireNonNull(random, "random cannot be null");
        this.deceleration = parameters.deceleration();
        var theta = random.nextDouble() * Math.PI * 2;
        wanderTarget = new Vector3f((float) (parameters.wanderRadius() * Math.cos(theta)), 0,
                                    (float) (parameters.wanderRadius() * Math.sin(theta)));
    }

    /**
     * Sum the active behaviors using prioritized summation
     *
     * @param delta elapsed time, scales the wander jitter
     * @return the steering force, never longer than the owner's maximum force
     */
    public Vector3f calculate(float delta) {
        steeringForce.set(0, 0, 0);
        if (active.stream().anyMatch(BehaviorKind::isGroupBehavior)) {
            neighbors = world.calculateNeighbors(owner, parameters.viewDistance());
        } else {
            neighbors = Collections.emptyList();
        }
        for (var kind : active) {
            var force = compute(kind, delta);
            force.scale(parameters.weight(kind));
            if (!accumulateForce(force)) {
                log.trace("{} force budget exhausted at {}", owner, kind);
                break;
            }
        }
        return new Vector3f(steeringForce);
    }

    /**
     * @return the force produced by the last calculation
     */
    public Vector3f getForce() {
        return new Vector3f(steeringForce);
    }

    public Set<BehaviorKind> getActive() {
        return Collections.unmodifiableSet(active);
    }

    public float getDeceleration() {
        return deceleration;
    }

    public void setDeceleration(float deceleration) {
        if (deceleration <= 0) {
            throw new IllegalArgumentException("deceleration must be positive: " + deceleration);
        }
        this.deceleration = deceleration;
    }

    public float getInterposeDistance() {
        return interposeDistance;
    }

    public Vector3f getOffset() {
        return new Vector3f(offset);
    }

    public void setOffset(Tuple3f offset) {
        this.offset.set(offset);
    }

    public SteeringParameters getParameters() {
        return parameters;
    }

    public void setParameters(SteeringParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters, "parameters cannot be null");
    }

    public Path getPath() {
        return path;
    }

    public void setPath(Path path) {
        this.path = Objects.requireNonNull(path, "path cannot be null");
    }

    public Point3f getTarget() {
        return new Point3f(target);
    }

    public void setTarget(Tuple3f target) {
        this.target.set(target);
    }

    public MovingEntity getTargetAgent1() {
        return targetAgent1;
    }

    public void setTargetAgent1(MovingEntity targetAgent1) {
        this.targetAgent1 = targetAgent1;
    }

    public MovingEntity getTargetAgent2() {
        return targetAgent2;
    }

    public void setTargetAgent2(MovingEntity targetAgent2) {
        this.targetAgent2 = targetAgent2;
    }

    public boolean isOn(BehaviorKind kind) {
        return active.contains(kind);
    }

    public void on(BehaviorKind kind) {
        active.add(kind);
    }

    public void off(BehaviorKind kind) {
        active.remove(kind);
    }

    public boolean isSeekOn() {
        return isOn(BehaviorKind.SEEK);
    }

    public boolean isArriveOn() {
        return isOn(BehaviorKind.ARRIVE);
    }

    public boolean isPursuitOn() {
        return isOn(BehaviorKind.PURSUIT);
    }

    public boolean isInterposeOn() {
        return isOn(BehaviorKind.INTERPOSE);
    }

    public void seekOn() {
        on(BehaviorKind.SEEK);
    }

    public void seekOff() {
        off(BehaviorKind.SEEK);
    }

    public void fleeOn() {
        on(BehaviorKind.FLEE);
    }

    public void fleeOff() {
        off(BehaviorKind.FLEE);
    }

    public void arriveOn() {
        on(BehaviorKind.ARRIVE);
    }

    public void arriveOff() {
        off(BehaviorKind.ARRIVE);
    }

    public void pursuitOn() {
        on(BehaviorKind.PURSUIT);
    }

    public void pursuitOff() {
        off(BehaviorKind.PURSUIT);
    }

    public void evadeOn() {
        on(BehaviorKind.EVADE);
    }

    public void evadeOff() {
        off(BehaviorKind.EVADE);
    }

    /**
     * Follow the leader at an offset expressed in the leader's frame
     */
    public void offsetPursuitOn(MovingEntity leader, Tuple3f offset) {
        targetAgent1 = leader;
        this.offset.set(offset);
        on(BehaviorKind.OFFSET_PURSUIT);
    }

    public void offsetPursuitOff() {
        off(BehaviorKind.OFFSET_PURSUIT);
    }

    /**
     * Position the agent between target agents one and two
     */
    public void interposeOn() {
        interposeDistance = 0;
        on(BehaviorKind.INTERPOSE);
    }

    /**
     * Guard the target point: stay the given distance from it on the line towards target agent one
     */
    public void interposeOn(float distance) {
        if (distance <= 0) {
            throw new IllegalArgumentException("Interpose distance must be positive: " + distance);
        }
        interposeDistance = distance;
        on(BehaviorKind.INTERPOSE);
    }

    public void interposeOff() {
        off(BehaviorKind.INTERPOSE);
    }

    public void hideOn() {
        on(BehaviorKind.HIDE);
    }

    public void hideOff() {
        off(BehaviorKind.HIDE);
    }

    public void wanderOn() {
        on(BehaviorKind.WANDER);
    }

    public void wanderOff() {
        off(BehaviorKind.WANDER);
    }

    public void obstacleAvoidanceOn() {
        on(BehaviorKind.OBSTACLE_AVOIDANCE);
    }

    public void obstacleAvoidanceOff() {
        off(BehaviorKind.OBSTACLE_AVOIDANCE);
    }

    public void wallAvoidanceOn() {
        on(BehaviorKind.WALL_AVOIDANCE);
    }

    public void wallAvoidanceOff() {
        off(BehaviorKind.WALL_AVOIDANCE);
    }

    public void followPathOn() {
        on(BehaviorKind.FOLLOW_PATH);
    }

    public void followPathOff() {
        off(BehaviorKind.FOLLOW_PATH);
    }

    public void cohesionOn() {
        on(BehaviorKind.COHESION);
    }

    public void cohesionOff() {
        off(BehaviorKind.COHESION);
    }

    public void separationOn() {
        on(BehaviorKind.SEPARATION);
    }

    public void separationOff() {
        off(BehaviorKind.SEPARATION);
    }

    public void alignmentOn() {
        on(BehaviorKind.ALIGNMENT);
    }

    public void alignmentOff() {
        off(BehaviorKind.ALIGNMENT);
    }

    public void flockingOn() {
        cohesionOn();
        separationOn();
        alignmentOn();
        wanderOn();
    }

    public void flockingOff() {
        cohesionOff();
        separationOff();
        alignmentOff();
        wanderOff();
    }

    @Override
    public String toString() {
        return String.format("SteeringBehaviors{owner=%s, active=%s}", owner, active);
    }

    /**
     * Add as much of the force as the remaining budget allows
     *
     * @return false if the budget was already exhausted
     */
    boolean accumulateForce(Vector3f forceToAdd) {
        var magnitudeRemaining = owner.getMaxForce() - steeringForce.length();
        if (magnitudeRemaining <= 0) {
            return false;
        }
        Vectors.truncate(forceToAdd, magnitudeRemaining);
        steeringForce.add(forceToAdd);
        return true;
    }

    Vector3f alignment() {
        var averageHeading = new Vector3f();
        var count = 0;
        for (var neighbor : neighbors) {
            if (neighbor != owner && neighbor != targetAgent1) {
                averageHeading.add(neighbor.getDirection());
                count++;
            }
        }
        var force = new Vector3f();
        if (count > 0) {
            averageHeading.scale(1.0f / count);
            force.sub(averageHeading, owner.getDirection());
        }
        return force;
    }

    Vector3f arrive(Tuple3f targetPosition, float decelerationRate) {
        var toTarget = Vectors.between(owner.getPosition(), targetPosition);
        var distance = toTarget.length();
        var force = new Vector3f();
        if (distance > 0) {
            var speed = Math.min(distance / decelerationRate, owner.getMaxSpeed());
            toTarget.scale(speed / distance);
            force.sub(toTarget, owner.getVelocity());
        }
        return force;
    }

    Vector3f cohesion() {
        var centerOfMass = new Point3f();
        var count = 0;
        for (var neighbor : neighbors) {
            if (neighbor != owner && neighbor != targetAgent1) {
                centerOfMass.add(neighbor.getPosition());
                count++;
            }
        }
        if (count == 0) {
            return new Vector3f();
        }
        centerOfMass.scale(1.0f / count);
        return Vectors.normalized(seek(centerOfMass));
    }

    Vector3f evade(MovingEntity pursuer) {
        var toPursuer = Vectors.between(owner.getPosition(), pursuer.getPosition());
        var panic = parameters.panicDistance();
        if (toPursuer.lengthSquared() > panic * panic) {
            return new Vector3f();
        }
        return flee(predict(pursuer, pursuer.getPosition(), toPursuer.length()));
    }

    Vector3f flee(Tuple3f targetPosition) {
        var panic = parameters.panicDistance();
        var position = owner.getPosition();
        var force = new Vector3f();
        if (position.distanceSquared(new Point3f(targetPosition)) < panic * panic) {
            var desired = Vectors.normalized(Vectors.between(targetPosition, position));
            desired.scale(owner.getMaxSpeed());
            force.sub(desired, owner.getVelocity());
        }
        return force;
    }

    Vector3f followPath() {
        var seekDistance = parameters.waypointSeekDistance();
        if (path.getCurrentWaypoint().distanceSquared(owner.getPosition()) < seekDistance * seekDistance) {
            path.setNextWaypoint();
        }
        if (!path.isFinished()) {
            return seek(path.getCurrentWaypoint());
        }
        return arrive(path.getCurrentWaypoint(), Deceleration.MIDDLE.rate());
    }

    Vector3f hide(MovingEntity hunter) {
        var position = owner.getPosition();
        var hunterPosition = hunter.getPosition();
        Point3f bestHidingSpot = null;
        var closestDistanceSq = Float.MAX_VALUE;
        for (var obstacle : world.getObstacles()) {
            if (!obstacle.isVisible()) {
                continue;
            }
            var spot = hidingPosition(obstacle.getCenter(), obstacle.getRadius(), hunterPosition);
            var distanceSq = spot.distanceSquared(position);
            if (distanceSq < closestDistanceSq) {
                closestDistanceSq = distanceSq;
                bestHidingSpot = spot;
            }
        }
        if (bestHidingSpot == null) {
            return evade(hunter);
        }
        return arrive(bestHidingSpot, Deceleration.VERY_FAST.rate());
    }

    Vector3f interpose(MovingEntity agentA, MovingEntity agentB) {
        var midPoint = new Point3f();
        midPoint.interpolate(agentA.getPosition(), agentB.getPosition(), 0.5f);
        var time = owner.getPosition().distance(midPoint) / owner.getMaxSpeed();
        var predictedA = extrapolate(agentA, time);
        var predictedB = extrapolate(agentB, time);
        midPoint.interpolate(predictedA, predictedB, 0.5f);
        return arrive(midPoint, Deceleration.VERY_FAST.rate());
    }

    /**
     * Stay {@link #getInterposeDistance()} from the target point on the line towards the guarded agent
     */
    Vector3f interposeAtDistance(MovingEntity guarded) {
        var toGuarded = Vectors.normalized(Vectors.between(target, guarded.getPosition()));
        toGuarded.scale(interposeDistance);
        var spot = new Point3f(target);
        spot.add(toGuarded);
        return arrive(spot, Deceleration.FAST.rate());
    }

    Vector3f obstacleAvoidance() {
        var frame = owner.getLocalFrame();
        var detectionBoxLength = owner.getSpeed() + owner.getMaxSpeed() + owner.getBoundingRadius();
        var ray = new Ray3D(new Point3f(), Rotations.FORWARD);

        Point3f closestLocal = null;
        var closestRadius = 0f;
        var distanceToClosest = Float.MAX_VALUE;
        for (var obstacle : world.getObstacles()) {
            if (!obstacle.isVisible()) {
                continue;
            }
            var local = frame.toLocal(obstacle.getCenter());
            if (local.z <= 0 || local.z >= detectionBoxLength) {
                continue;
            }
            var expandedRadius = obstacle.getRadius() + owner.getBoundingRadius();
            if (Math.abs(local.x) >= expandedRadius) {
                continue;
            }
            var hit = ray.intersectSphere(new Point3f(local.x, 0, local.z), expandedRadius);
            var distance = hit.map(RayHit::distance).orElse(local.z);
            if (distance < distanceToClosest) {
                distanceToClosest = distance;
                closestLocal = local;
                closestRadius = obstacle.getRadius();
            }
        }
        if (closestLocal == null) {
            return new Vector3f();
        }
        var multiplier = 1 + (detectionBoxLength - closestLocal.z) / detectionBoxLength;
        var localForce = new Vector3f((closestRadius - closestLocal.x) * multiplier, 0,
                                      (closestRadius - closestLocal.z) * BRAKING_WEIGHT);
        return Vectors.normalized(frame.directionToWorld(localForce));
    }

    Vector3f offsetPursuit(MovingEntity leader, Tuple3f localOffset) {
        var offsetWorld = leader.getLocalFrame().toWorld(localOffset);
        var toOffset = Vectors.between(owner.getPosition(), offsetWorld);
        return arrive(predict(leader, offsetWorld, toOffset.length()), Deceleration.VERY_FAST.rate());
    }

    Vector3f pursuit(MovingEntity evader) {
        var toEvader = Vectors.between(owner.getPosition(), evader.getPosition());
        var heading = owner.getDirection();
        var relativeHeading = heading.dot(evader.getDirection());
        if (toEvader.dot(heading) > 0 && relativeHeading < -0.95f) {
            return seek(evader.getPosition());
        }
        return seek(predict(evader, evader.getPosition(), toEvader.length()));
    }

    Vector3f seek(Tuple3f targetPosition) {
        var desired = Vectors.normalized(Vectors.between(owner.getPosition(), targetPosition));
        desired.scale(owner.getMaxSpeed());
        var force = new Vector3f();
        force.sub(desired, owner.getVelocity());
        return force;
    }

    Vector3f separation() {
        var force = new Vector3f();
        var position = owner.getPosition();
        for (var neighbor : neighbors) {
            if (neighbor != owner && neighbor != targetAgent1) {
                var toAgent = Vectors.between(neighbor.getPosition(), position);
                var length = toAgent.length();
                if (length == 0) {
                    length = ZERO_LENGTH_FACTOR;
                }
                toAgent = Vectors.normalized(toAgent);
                toAgent.scale(1.0f / length);
                force.add(toAgent);
            }
        }
        return force;
    }

    Vector3f wallAvoidance() {
        var heading = owner.getDirection();
        var position = owner.getPosition();
        var length = parameters.wallDetectionFeelerLength();
        var feelers = List.of(new Ray3D(position, heading, length),
                              new Ray3D(position, Rotations.rotateY(heading, SIDE_FEELER_LEFT), length * 0.5f),
                              new Ray3D(position, Rotations.rotateY(heading, SIDE_FEELER_RIGHT), length * 0.5f));

        RayHit closestHit = null;
        Ray3D closestFeeler = null;
        for (var feeler : feelers) {
            for (Wall wall : world.getWalls()) {
                var hit = wall.intersectRay(feeler);
                if (hit.isPresent() && (closestHit == null || hit.get().distance() < closestHit.distance())) {
                    closestHit = hit.get();
                    closestFeeler = feeler;
                }
            }
        }
        if (closestHit == null) {
            return new Vector3f();
        }
        var overShoot = Vectors.between(closestHit.point(), closestFeeler.getPointAt(closestFeeler.maxDistance()));
        var force = new Vector3f(closestHit.normal());
        force.scale(overShoot.length());
        return force;
    }

    Vector3f wander(float delta) {
        var jitter = parameters.wanderJitter() * delta;
        wanderTarget.x += random.nextFloat(-1, 1) * jitter;
        wanderTarget.z += random.nextFloat(-1, 1) * jitter;
        var onCircle = Vectors.normalized(wanderTarget);
        onCircle.scale(parameters.wanderRadius());
        wanderTarget.set(onCircle);

        var local = new Point3f(wanderTarget.x, 0, wanderTarget.z + parameters.wanderDistance());
        var worldTarget = owner.getLocalFrame().toWorld(local);
        return Vectors.between(owner.getPosition(), worldTarget);
    }

    private Vector3f compute(BehaviorKind kind, float delta) {
        return switch (kind) {
            case WALL_AVOIDANCE -> wallAvoidance();
            case OBSTACLE_AVOIDANCE -> obstacleAvoidance();
            case EVADE -> evade(require(targetAgent1, "Evade target not assigned"));
            case SEPARATION -> separation();
            case ALIGNMENT -> alignment();
            case COHESION -> cohesion();
            case FLEE -> flee(target);
            case SEEK -> seek(target);
            case ARRIVE -> arrive(target, deceleration);
            case WANDER -> wander(delta);
            case PURSUIT -> pursuit(require(targetAgent1, "Pursuit target not assigned"));
            case OFFSET_PURSUIT -> offsetPursuit(require(targetAgent1, "Offset pursuit leader not assigned"), offset);
            case INTERPOSE -> interposeDistance > 0 ? interposeAtDistance(
            require(targetAgent1, "Interpose target not assigned")) : interpose(
            require(targetAgent1, "Interpose targets not assigned"),
            require(targetAgent2, "Interpose targets not assigned"));
            case HIDE -> hide(require(targetAgent1, "Hide target not assigned"));
            case FOLLOW_PATH -> followPath();
        };
    }

    private Point3f extrapolate(MovingEntity agent, float time) {
        var velocity = agent.getVelocity();
        velocity.scale(time);
        var predicted = agent.getPosition();
        predicted.add(velocity);
        return predicted;
    }

    private Point3f hidingPosition(Point3f obstacleCenter, float obstacleRadius, Point3f hunterPosition) {
        var toHidingSpot = Vectors.normalized(Vectors.between(hunterPosition, obstacleCenter));
        toHidingSpot.scale(obstacleRadius + parameters.distanceFromBoundary());
        var spot = new Point3f(obstacleCenter);
        spot.add(toHidingSpot);
        return spot;
    }

    /**
     * Extrapolate a point along the agent's velocity for the time it takes to close the distance
     */
    private Point3f predict(MovingEntity agent, Tuple3f from, float distance) {
        var lookAheadTime = distance / (owner.getMaxSpeed() + agent.getSpeed());
        var velocity = agent.getVelocity();
        velocity.scale(lookAheadTime);
        var predicted = new Point3f(from);
        predicted.add(velocity);
        return predicted;
    }

    private MovingEntity require(MovingEntity agent, String message) {
        if (agent == null) {
            throw new IllegalStateException(message + " for " + owner);
        }
        return agent;
    }
}
