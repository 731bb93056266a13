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
package com.hellblazer.touchline.geometry;

import javax.vecmath.Matrix3f;
import javax.vecmath.Quat4f;
import javax.vecmath.Tuple3f;
import javax.vecmath.Vector3f;

/**
 * Rotation helpers for agents that move on the x-z plane with y up. Positive angles turn the forward axis
 * (0, 0, 1) towards the x axis.
 *
 * @author hal.hildebrand
 */
public final class Rotations {
    public static final Vector3f FORWARD = new Vector3f(0, 0, 1);
    public static final Vector3f UP      = new Vector3f(0, 1, 0);

    private Rotations() {
    }

    /**
     * Quaternion for a rotation of the given angle around the y axis
     */
    public static Quat4f aroundY(float radians) {
        var half = radians * 0.5f;
        return new Quat4f(0, (float) Math.sin(half), 0, (float) Math.cos(half));
    }

    /**
     * Quaternion that turns the forward axis onto the projection of the direction on the x-z plane
     */
    public static Quat4f lookAlong(Tuple3f direction) {
        return aroundY(yawOf(direction));
    }

    /**
     * The angle around the y axis that turns the forward axis onto the direction
     */
    public static float yawOf(Tuple3f direction) {
        return (float) Math.atan2(direction.x, direction.z);
    }

    /**
     * Rotate a vector around the y axis
     */
    public static Vector3f rotateY(Tuple3f v, float radians) {
        var cos = (float) Math.cos(radians);
        var sin = (float) Math.sin(radians);
        return new Vector3f(v.x * cos + v.z * sin, v.y, -v.x * sin + v.z * cos);
    }

    /**
     * Apply the rotation to a vector
     */
    public static Vector3f transform(Quat4f rotation, Tuple3f v) {
        var matrix = new Matrix3f();
        matrix.set(rotation);
        var result = new Vector3f(v);
        matrix.transform(result);
        return result;
    }

    /**
     * The direction the forward axis points to under the rotation
     */
    public static Vector3f heading(Quat4f rotation) {
        return transform(rotation, FORWARD);
    }
}
