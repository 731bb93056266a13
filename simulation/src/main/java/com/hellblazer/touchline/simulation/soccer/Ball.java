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
import com.hellblazer.touchline.geometry.Ray3D;
import com.hellblazer.touchline.geometry.Rotations;
import com.hellblazer.touchline.simulation.entity.MovingEntity;
import com.hellblazer.touchline.simulation.world.World;

import javax.vecmath.Point3f;
import javax.vecmath.Tuple3f;
import javax.vecmath.Vector3f;
import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * The ball. It moves with constant deceleration, bounces off the pitch walls and comes to rest once friction has
 * consumed its speed. Time is measured in ticks.
 *
 * @author hal.hildebrand
 */
public class Ball extends MovingEntity {
    /** Deceleration per tick, opposite to the velocity */
    public static final float FRICTION = -0.005f;
    /** Kick accuracy in [0, 1]; lower values add more noise */
    public static final float ACCURACY = 0.99f;

    private final World   world;
    private final Point3f previousPosition = new Point3f();

    public Ball(int id, float radius, float mass, World world) {
        super(id, radius, mass, Float.MAX_VALUE, 0, 0);
        this.world = Objects.requireNonNull(world, "world cannot be null");
    }

    /**
     * Rotate the direction towards the target by a random angle bounded by the kick accuracy
     *
     * @return the perturbed target
     */
    public Point3f addNoiseToKick(Point3f target, RandomGenerator random) {
        var displacement = (float) ((Math.PI - Math.PI * ACCURACY) * random.nextDouble(-1, 1));
        var toTarget = Rotations.rotateY(Vectors.between(position, target), displacement);
        var noisy = new Point3f(position);
        noisy.add(toTarget);
        return noisy;
    }

    /**
     * Where the ball will be after the given number of ticks, using s = ut + at²/2
     */
    public Point3f calculateFuturePosition(float time) {
        var ut = new Vector3f(velocity);
        ut.scale(time);
        var friction = Vectors.normalized(velocity);
        friction.scale(0.5f * FRICTION * time * time);
        var future = new Point3f(position);
        future.add(ut);
        future.add(friction);
        return future;
    }

    /**
     * Ticks the ball needs to travel from start to end when kicked with the given force
     *
     * @return the time, or -1 if friction stops the ball before it arrives
     */
    public float calculateTimeToCoverDistance(Point3f start, Point3f end, float force) {
        var speed = force / getMass();
        var distance = start.distance(end);
        var term = speed * speed + 2 * distance * FRICTION;
        if (term <= 0) {
            return -1;
        }
        return ((float) Math.sqrt(term) - speed) / FRICTION;
    }

    public Point3f getPreviousPosition() {
        return new Point3f(previousPosition);
    }

    /**
     * Replace the velocity with one of the given force along the direction
     */
    public void kick(Tuple3f direction, float force) {
        var heading = Vectors.normalized(new Vector3f(direction));
        heading.scale(force / getMass());
        velocity.set(heading);
    }

    /**
     * Put the ball at rest at the center spot
     */
    public void placeAtPosition() {
        placeAtPosition(new Point3f());
    }

    /**
     * Put the ball at rest at the position
     */
    public void placeAtPosition(Point3f newPosition) {
        position.set(newPosition);
        previousPosition.set(newPosition);
        velocity.set(0, 0, 0);
    }

    public void trap() {
        velocity.set(0, 0, 0);
    }

    @Override
    public void update(float delta) {
        previousPosition.set(position);
        testCollisionWithWalls();

        if (velocity.lengthSquared() > FRICTION * FRICTION) {
            var friction = Vectors.normalized(velocity);
            friction.scale(FRICTION);
            velocity.add(friction);
            position.add(velocity);
            if (velocity.lengthSquared() > MIN_SPEED_SQ_FOR_HEADING) {
                rotateToDirection(velocity);
            }
        } else {
            velocity.set(0, 0, 0);
        }
    }

    /**
     * Reflect the velocity off the closest wall the ball reaches within this tick
     */
    void testCollisionWithWalls() {
        if (velocity.lengthSquared() == 0) {
            return;
        }
        var path = new Ray3D(position, velocity, getBoundingRadius() + getSpeed());
        var closest = Float.POSITIVE_INFINITY;
        Vector3f normal = null;
        for (var wall : world.getWalls()) {
            var hit = wall.intersectRay(path);
            if (hit.isPresent() && hit.get().distance() < closest) {
                closest = hit.get().distance();
                normal = hit.get().normal();
            }
        }
        if (normal != null) {
            var reflection = new Vector3f(normal);
            reflection.scale(2 * velocity.dot(normal));
            velocity.sub(reflection);
        }
    }
}
