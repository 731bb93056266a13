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

import com.hellblazer.touchline.common.Smoother;
import com.hellblazer.touchline.simulation.steering.SteeringBehaviors;
import com.hellblazer.touchline.simulation.steering.SteeringParameters;
import com.hellblazer.touchline.simulation.world.World;

import java.util.random.RandomGenerator;

/**
 * A general purpose steered agent. Each update sums the active steering behaviors, integrates the force over the
 * elapsed time and turns to face the direction of travel, optionally smoothed over recent velocities.
 *
 * @author hal.hildebrand
 */
public class Vehicle extends MovingEntity {
    public static final float DEFAULT_MASS          = 1;
    public static final float DEFAULT_MAX_SPEED     = 1;
    public static final float DEFAULT_MAX_FORCE     = 100;
    public static final float DEFAULT_MAX_TURN_RATE = (float) Math.PI;

    private final World             world;
    private final SteeringBehaviors steering;
    private final Smoother          headingSmoother = new Smoother();
    private       boolean           smoothingOn;

    public Vehicle(int id, World world, float boundingRadius, RandomGenerator random) {
        this(id, world, boundingRadius, DEFAULT_MASS, DEFAULT_MAX_SPEED, DEFAULT_MAX_FORCE, DEFAULT_MAX_TURN_RATE,
             SteeringParameters.defaultConfig(), random);
    }

    public Vehicle(int id, World world, float boundingRadius, float mass, float maxSpeed, float maxForce,
                   float maxTurnRate, SteeringParameters parameters, RandomGenerator random) {
        super(id, boundingRadius, mass, maxSpeed, maxForce, maxTurnRate);
        this.world = world;
        this.steering = new SteeringBehaviors(this, world, parameters, random);
    }

    public SteeringBehaviors getSteering() {
        return steering;
    }

    public World getWorld() {
        return world;
    }

    public boolean isSmoothingOn() {
        return smoothingOn;
    }

    public void setSmoothingOn(boolean smoothingOn) {
        this.smoothingOn = smoothingOn;
    }

    @Override
    public void update(float delta) {
        var force = steering.calculate(delta);
        integrate(force, delta);
        if (getSpeedSq() > MIN_SPEED_SQ_FOR_HEADING) {
            rotateToDirection(smoothingOn ? headingSmoother.update(velocity) : velocity);
        }
    }
}
