package com.hellblazer.touchline.common;

import com.hellblazer.touchline.geometry.AxisAlignedBox;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class PathTest {

    private static Path threePoints(boolean loop) {
        return new Path(loop).addWaypoint(new Point3f(0, 0, 0))
                             .addWaypoint(new Point3f(10, 0, 0))
                             .addWaypoint(new Point3f(10, 0, 10));
    }

    @Test
    void testOpenPathParksOnLastWaypoint() {
        var path = threePoints(false);
        assertFalse(path.isFinished());
        path.setNextWaypoint().setNextWaypoint();
        assertTrue(path.isFinished(), "Open path is finished on its last waypoint");
        path.setNextWaypoint();
        assertEquals(new Point3f(10, 0, 10), path.getCurrentWaypoint(), "Open path stays on its last waypoint");
    }

    @Test
    void testLoopingPathWraps() {
        var path = threePoints(true);
        path.setNextWaypoint().setNextWaypoint().setNextWaypoint();
        assertEquals(0, path.getIndex(), "Looping path wraps to the first waypoint");
        assertFalse(path.isFinished(), "Looping path is never finished");
    }

    @Test
    void testEmptyPathCannotAdvance() {
        var path = new Path();
        assertThrows(IllegalStateException.class, path::setNextWaypoint);
        assertThrows(IllegalStateException.class, path::getCurrentWaypoint);
    }

    @Test
    void testRandomPathStaysInsideBox() {
        var box = AxisAlignedBox.centeredAt(new Point3f(5, 0, -5), new Vector3f(20, 0, 20));
        var path = new Path(true).createRandomPath(8, box, new Random(7));
        assertEquals(8, path.getWaypoints().size());
        for (var waypoint : path.getWaypoints()) {
            assertEquals(0.0f, waypoint.y, "Waypoints lie on the ground plane");
            assertTrue(waypoint.distance(box.getCenter()) <= 20 * Math.sqrt(2) + 1e-3,
                       "Waypoint " + waypoint + " should lie within the box radius");
        }
    }
}
