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
import java.util.Optional;

/**
 * A spherical obstacle. Invisible obstacles are ignored by avoidance and hiding.
 *
 * @author hal.hildebrand
 */
public class Obstacle {
    private final Point3f center;
    private final float   radius;
    private       boolean visible = true;

    public Obstacle(Point3f center, float radius) {
        if (radius <= 0) {
            throw new IllegalArgumentException("Obstacle radius must be positive: " + radius);
        }
        this.center = new Point3f(center);
        this.radius = radius;
    }

    public Point3f getCenter() {
        return new Point3f(center);
    }

    public float getRadius() {
        return radius;
    }

    public Optional<RayHit> intersectRay(Ray3D ray) {
        return ray.intersectSphere(center, radius);
    }

    public boolean isVisible() {
        return visible;
    }

    public void setVisible(boolean visible) {
        this.visible = visible;
    }

    @Override
    public String toString() {
        return String.format("Obstacle{center=%s, radius=%.2f, visible=%s}", center, radius, visible);
    }
}
