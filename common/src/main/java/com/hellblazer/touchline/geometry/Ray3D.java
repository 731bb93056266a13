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

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;
import java.util.Optional;

/**
 * Ray used by feelers and ball collision checks. Defined by an origin point, a normalized direction vector and a
 * maximum distance.
 *
 * @author hal.hildebrand
 */
public record Ray3D(Point3f origin, Vector3f direction, float maxDistance) {

    /**
     * Default maximum distance for unbounded rays
     */
    public static final float UNBOUNDED = Float.POSITIVE_INFINITY;

    /**
     * Create a ray with validation
     *
     * @param origin      the starting point of the ray
     * @param direction   the direction vector (will be normalized)
     * @param maxDistance the maximum distance along the ray (must be positive, can be UNBOUNDED)
     */
    public Ray3D {
        if (maxDistance <= 0) {
            throw new IllegalArgumentException("Ray max distance must be positive or unbounded: " + maxDistance);
        }
        origin = new Point3f(origin);
        direction = new Vector3f(direction);
        if (direction.lengthSquared() == 0) {
            throw new IllegalArgumentException("Ray direction cannot be zero vector");
        }
        direction.normalize();
    }

    /**
     * Create an unbounded ray
     */
    public Ray3D(Point3f origin, Vector3f direction) {
        this(origin, direction, UNBOUNDED);
    }

    /**
     * Create a ray from origin to target point, limited to the target
     */
    public static Ray3D fromPoints(Point3f origin, Point3f target) {
        var direction = new Vector3f();
        direction.sub(target, origin);
        return new Ray3D(origin, direction, direction.length());
    }

    /**
     * Get a point along the ray at parameter t
     *
     * @param t the distance from the origin
     * @return the point at origin + t * direction
     */
    public Point3f getPointAt(float t) {
        return new Point3f(origin.x + t * direction.x, origin.y + t * direction.y, origin.z + t * direction.z);
    }

    /**
     * Intersect with a sphere. A ray starting inside the sphere hits the far side.
     *
     * @param center sphere center
     * @param radius sphere radius
     * @return the nearest hit within the ray's maximum distance
     */
    public Optional<RayHit> intersectSphere(Point3f center, float radius) {
        var oc = new Vector3f();
        oc.sub(origin, center);

        var b = 2.0f * oc.dot(direction);
        var c = oc.dot(oc) - radius * radius;

        var discriminant = b * b - 4 * c;
        if (discriminant < 0) {
            return Optional.empty();
        }

        var sqrtDiscriminant = (float) Math.sqrt(discriminant);
        var t1 = (-b - sqrtDiscriminant) / 2;
        var t2 = (-b + sqrtDiscriminant) / 2;

        float t;
        if (t1 >= 0 && t1 <= maxDistance) {
            t = t1;
        } else if (t2 >= 0 && t2 <= maxDistance) {
            t = t2;
        } else {
            return Optional.empty();
        }

        var point = getPointAt(t);
        var normal = new Vector3f();
        normal.sub(point, center);
        normal.normalize();
        return Optional.of(new RayHit(t, point, normal));
    }
}
