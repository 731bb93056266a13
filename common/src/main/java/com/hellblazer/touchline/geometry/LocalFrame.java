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
import javax.vecmath.Tuple3f;
import javax.vecmath.Vector3f;

/**
 * Right handed frame on the x-z plane: the local z axis points along a heading, the local x axis is
 * {@code up × z} and local y stays world up.
 *
 * @author hal.hildebrand
 */
public record LocalFrame(Point3f origin, Vector3f xAxis, Vector3f zAxis) {

    public LocalFrame {
        origin = new Point3f(origin);
        xAxis = new Vector3f(xAxis);
        zAxis = new Vector3f(zAxis);
    }

    /**
     * Frame located at the origin looking along the heading
     *
     * @param origin  the frame origin
     * @param heading the local z axis, normalized here
     */
    public static LocalFrame of(Point3f origin, Vector3f heading) {
        var z = new Vector3f(heading.x, 0, heading.z);
        if (z.lengthSquared() == 0) {
            throw new IllegalArgumentException("Frame heading cannot be zero on the x-z plane: " + heading);
        }
        z.normalize();
        var x = new Vector3f();
        x.cross(Rotations.UP, z);
        return new LocalFrame(origin, x, z);
    }

    /**
     * Express a world space point in this frame
     */
    public Point3f toLocal(Tuple3f world) {
        var d = new Vector3f(world.x - origin.x, world.y - origin.y, world.z - origin.z);
        return new Point3f(d.dot(xAxis), d.y, d.dot(zAxis));
    }

    /**
     * Express a local point in world space
     */
    public Point3f toWorld(Tuple3f local) {
        return new Point3f(origin.x + local.x * xAxis.x + local.z * zAxis.x, origin.y + local.y,
                           origin.z + local.x * xAxis.z + local.z * zAxis.z);
    }

    /**
     * Rotate a local direction into world space, ignoring the origin
     */
    public Vector3f directionToWorld(Tuple3f local) {
        return new Vector3f(local.x * xAxis.x + local.z * zAxis.x, local.y, local.x * xAxis.z + local.z * zAxis.z);
    }
}
