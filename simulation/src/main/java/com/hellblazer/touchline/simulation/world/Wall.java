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
package com.hellblazer.touchline.simulation.world;

import com.hellblazer.touchline.geometry.Ray3D;
import com.hellblazer.touchline.geometry.RayHit;

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;
import java.util.Optional;

/**
 * A vertical, one sided wall standing on the segment from {@code from} to {@code to} in the x-z plane. Only rays
 * travelling against the normal hit it, so an agent inside the field is stopped by the wall while one outside
 * passes through.
 *
 * @author hal.hildebrand
 */
public record Wall(Point3f from, Point3f to, Vector3f normal) {

    public Wall {
        from = new Point3f(from.x, 0, from.z);
        to = new Point3f(to.x, 0, to.z);
        if (from.equals(to)) {
            throw new IllegalArgumentException("Wall needs two distinct end points: " + from);
        }
        normal = new Vector3f(normal.x, 0, normal.z);
        if (normal.lengthSquared() == 0) {
            throw new IllegalArgumentException("Wall normal must lie on the x-z plane");
        }
        normal.normalize();
    }

    /**
     * Intersect the ray with the front face of the wall. The ray is projected onto the x-z plane.
     *
     * @return the hit, if the ray reaches the wall within its maximum distance
     */
    public Optional<RayHit> intersectRay(Ray3D ray) {
        var direction = ray.direction();
        var denominator = direction.x * normal.x + direction.z * normal.z;
        if (denominator >= 0) {
            return Optional.empty();
        }
        var origin = ray.origin();
        var t = ((from.x - origin.x) * normal.x + (from.z - origin.z) * normal.z) / denominator;
        if (t < 0 || t > ray.maxDistance()) {
            return Optional.empty();
        }
        var hitX = origin.x + direction.x * t;
        var hitZ = origin.z + direction.z * t;
        var edgeX = to.x - from.x;
        var edgeZ = to.z - from.z;
        var s = ((hitX - from.x) * edgeX + (hitZ - from.z) * edgeZ) / (edgeX * edgeX + edgeZ * edgeZ);
        if (s < 0 || s > 1) {
            return Optional.empty();
        }
        return Optional.of(new RayHit(t, new Point3f(hitX, origin.y + direction.y * t, hitZ), new Vector3f(normal)));
    }

    public float length() {
        return from.distance(to);
    }
}
