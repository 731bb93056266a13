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
package com.hellblazer.touchline.simulation.entity;

import com.hellblazer.touchline.geometry.LocalFrame;
import com.hellblazer.touchline.geometry.Rotations;

import javax.vecmath.Point3f;
import javax.vecmath.Tuple3f;
import javax.vecmath.Vector3f;

/**
 * An entity with velocity and the physical limits that bound how steering forces move it. The velocity never
 * exceeds {@link #getMaxSpeed()} after an integration step.
 *
 * @author hal.hildebrand
 */
public abstract class MovingEntity extends GameEntity {
    /** Angles below this are treated as already facing the target */
    public static final float FACING_EPSILON = 0.00001f;

    /** Squared speed below which an entity keeps its heading */
    public static final float MIN_SPEED_SQ_FOR_HEADING = 0.00000001f;

    protected final Vector3f velocity = new Vector3f();
    private         float    mass;
    private         float    maxSpeed;
    private         float    maxForce;
    private         float    maxTurnRate;

    protected MovingEntity(int id, float boundingRadius, float mass, float maxSpeed, float maxForce,
                           float maxTurnRate) {
        super(id, boundingRadius);
        if (mass <= 0) {
            throw new IllegalArgumentException("Mass must be positive: " + mass);
        }
        this.mass = mass;
        this.maxSpeed = maxSpeed;
        this.maxForce = maxForce;
        this.maxTurnRate = maxTurnRate;
    }

    public float getMass() {
        return mass;
    }

    public void setMass(float mass) {
        if (mass <= 0) {
            throw new IllegalArgumentException("Mass must be positive: " + mass);
        }
        this.mass = mass;
    }

    public float getMaxForce() {
        return maxForce;
    }

    public void setMaxForce(float maxForce) {
        this.maxForce = maxForce;
    }

    public float getMaxSpeed() {
        return maxSpeed;
    }

    public void setMaxSpeed(float maxSpeed) {
        this.maxSpeed = maxSpeed;
    }

    public float getMaxTurnRate() {
        return maxTurnRate;
    }

    public void setMaxTurnRate(float maxTurnRate) {
        this.maxTurnRate = maxTurnRate;
    }

    public float getSpeed() {
        return velocity.length();
    }

    public float getSpeedSq() {
        return velocity.lengthSquared();
    }

    public Vector3f getVelocity() {
        return new Vector3f(velocity);
    }

    public void setVelocity(Tuple3f velocity) {
        this.velocity.set(velocity);
    }

    /**
     * The frame whose z axis is this entity's heading
     */
    public LocalFrame getLocalFrame() {
        return LocalFrame.of(position, getDirection());
    }

    /**
     * Turn the heading towards a position, by at most {@link #getMaxTurnRate()} radians
     *
     * @param target the position to face
     * @return true once the entity already faces the target
     */
    public boolean isRotateHeadingToFacePosition(Point3f target) {
        var toTarget = new Vector3f();
        toTarget.sub(target, position);
        toTarget.y = 0;
        if (toTarget.lengthSquared() == 0) {
            return true;
        }
        toTarget.normalize();

        var heading = getDirection();
        var angle = heading.angle(toTarget);
        if (Float.isNaN(angle) || angle < FACING_EPSILON) {
            return true;
        }
        if (angle > maxTurnRate) {
            angle = maxTurnRate;
        }
        var sign = heading.x * toTarget.z < heading.z * toTarget.x ? 1 : -1;
        rotateY(angle * sign);
        return false;
    }

    /**
     * Face the given direction immediately
     */
    public void rotateToDirection(Tuple3f direction) {
        if (direction.x == 0 && direction.z == 0) {
            return;
        }
        rotation.set(Rotations.lookAlong(direction));
    }

    /**
     * Turn the heading around the y axis
     */
    public void rotateY(float radians) {
        rotation.mul(Rotations.aroundY(radians));
        rotation.normalize();
    }

    /**
     * Apply a steering force for the elapsed time: accelerate by force over mass, clamp the velocity to the maximum
     * speed, then move.
     */
    protected void integrate(Vector3f force, float delta) {
        var acceleration = new Vector3f(force);
        acceleration.scale(delta / mass);
        velocity.add(acceleration);
        truncateVelocity();
        var displacement = new Vector3f(velocity);
        displacement.scale(delta);
        position.add(displacement);
    }

    protected void truncateVelocity() {
        if (velocity.lengthSquared() > maxSpeed * maxSpeed) {
            velocity.normalize();
            velocity.scale(maxSpeed);
        }
    }
}
