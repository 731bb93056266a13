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

import com.hellblazer.touchline.geometry.Rotations;
import com.hellblazer.touchline.simulation.messaging.MessageHandler;
import com.hellblazer.touchline.simulation.messaging.Telegram;

import javax.vecmath.Point3f;
import javax.vecmath.Quat4f;
import javax.vecmath.Tuple3f;
import javax.vecmath.Vector3f;

/**
 * Base of everything that lives in the simulation. An entity owns its transform: the position and rotation are
 * mutated only by the entity itself, and readers receive copies.
 *
 * @author hal.hildebrand
 */
public abstract class GameEntity implements MessageHandler {

    protected final Point3f position = new Point3f();
    protected final Quat4f  rotation = new Quat4f(0, 0, 0, 1);
    private final   int     id;
    private         float   boundingRadius;

    protected GameEntity(int id, float boundingRadius) {
        if (boundingRadius < 0) {
            throw new IllegalArgumentException("Bounding radius cannot be negative: " + boundingRadius);
        }
        this.id = id;
        this.boundingRadius = boundingRadius;
    }

    public float getBoundingRadius() {
        return boundingRadius;
    }

    public void setBoundingRadius(float boundingRadius) {
        this.boundingRadius = boundingRadius;
    }

    /**
     * @return the unit vector the entity faces
     */
    public Vector3f getDirection() {
        return Rotations.heading(rotation);
    }

    @Override
    public int getId() {
        return id;
    }

    public Point3f getPosition() {
        return new Point3f(position);
    }

    public void setPosition(Tuple3f position) {
        this.position.set(position);
    }

    public Quat4f getRotation() {
        return new Quat4f(rotation);
    }

    public void setRotation(Quat4f rotation) {
        this.rotation.set(rotation);
    }

    @Override
    public boolean handleMessage(Telegram telegram) {
        return false;
    }

    /**
     * Advance the entity by one tick
     *
     * @param delta the elapsed time
     */
    public abstract void update(float delta);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id + "]";
    }
}
