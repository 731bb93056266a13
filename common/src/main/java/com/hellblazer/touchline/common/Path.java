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
package com.hellblazer.touchline.common;

import com.hellblazer.touchline.geometry.AxisAlignedBox;
import com.hellblazer.touchline.geometry.Rotations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.random.RandomGenerator;

/**
 * An ordered list of waypoints with a cursor. A looping path wraps back to its first waypoint; an open path parks on
 * its last waypoint and reports itself finished there.
 *
 * @author hal.hildebrand
 */
public class Path {
    private static final Logger log = LoggerFactory.getLogger(Path.class);

    private final List<Point3f> waypoints = new ArrayList<>();
    private       boolean       loop;
    private       int           index;

    public Path() {
        this(false);
    }

    public Path(boolean loop) {
        this.loop = loop;
    }

    public Path addWaypoint(Point3f waypoint) {
        waypoints.add(new Point3f(waypoint));
        return this;
    }

    /**
     * Remove all waypoints and rewind the cursor
     */
    public Path clear() {
        waypoints.clear();
        index = 0;
        return this;
    }

    /**
     * Replace the waypoints with a ring of randomly spaced points around the center of the box. Waypoint i lies at
     * angle {@code 2πi/count} around the y axis, at a random fraction between 20% and 100% of the box half extent.
     *
     * @param numberOfWaypoints the number of waypoints
     * @param box               the bounds of the path
     * @param random            source of the radial distances
     * @return this path
     */
    public Path createRandomPath(int numberOfWaypoints, AxisAlignedBox box, RandomGenerator random) {
        if (numberOfWaypoints < 1) {
            throw new IllegalArgumentException("A path needs at least one waypoint: " + numberOfWaypoints);
        }
        var spacing = (float) (2 * Math.PI / numberOfWaypoints);
        var center = box.getCenter();
        var half = box.getHalfExtents();
        clear();
        for (int i = 0; i < numberOfWaypoints; i++) {
            var radial = new Vector3f(half.x == 0 ? 0 : random.nextFloat(half.x * 0.2f, half.x), 0,
                                      half.z == 0 ? 0 : random.nextFloat(half.z * 0.2f, half.z));
            var offset = Rotations.rotateY(radial, spacing * i);
            var waypoint = new Point3f(center);
            waypoint.add(offset);
            waypoints.add(waypoint);
        }
        log.debug("Created random path of {} waypoints around {}", numberOfWaypoints, center);
        return this;
    }

    public Point3f getCurrentWaypoint() {
        if (waypoints.isEmpty()) {
            throw new IllegalStateException("No waypoints are assigned to the path");
        }
        return new Point3f(waypoints.get(index));
    }

    public int getIndex() {
        return index;
    }

    public List<Point3f> getWaypoints() {
        return Collections.unmodifiableList(waypoints);
    }

    public boolean isEmpty() {
        return waypoints.isEmpty();
    }

    public boolean isFinished() {
        return !loop && index == waypoints.size() - 1;
    }

    public boolean isLoop() {
        return loop;
    }

    public void setLoop(boolean loop) {
        this.loop = loop;
    }

    /**
     * Advance the cursor to the next waypoint
     */
    public Path setNextWaypoint() {
        if (waypoints.isEmpty()) {
            throw new IllegalStateException("No waypoints are assigned to the path");
        }
        if (++index == waypoints.size()) {
            index = loop ? 0 : index - 1;
        }
        return this;
    }

    @Override
    public String toString() {
        return String.format("Path{waypoints=%d, index=%d, loop=%s}", waypoints.size(), index, loop);
    }
}
