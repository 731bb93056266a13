package com.hellblazer.touchline.geometry;

import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;

import static org.junit.jupiter.api.Assertions.*;

class Ray3DTest {

    @Test
    void testSphereHitReportsNearestSurface() {
        var ray = new Ray3D(new Point3f(0, 0, 0), new Vector3f(0, 0, 2));
        var hit = ray.intersectSphere(new Point3f(0, 0, 10), 2);
        assertTrue(hit.isPresent());
        assertEquals(8.0f, hit.get().distance(), 1e-5f);
        assertTrue(hit.get().normal().epsilonEquals(new Vector3f(0, 0, -1), 1e-5f));
    }

    @Test
    void testSphereBeyondMaxDistanceMissed() {
        var ray = new Ray3D(new Point3f(0, 0, 0), new Vector3f(0, 0, 1), 5);
        assertTrue(ray.intersectSphere(new Point3f(0, 0, 10), 2).isEmpty());
    }

    @Test
    void testSphereOffAxisMissed() {
        var ray = new Ray3D(new Point3f(0, 0, 0), new Vector3f(0, 0, 1));
        assertTrue(ray.intersectSphere(new Point3f(5, 0, 10), 2).isEmpty());
    }

    @Test
    void testFromPointsLimitsDistance() {
        var ray = Ray3D.fromPoints(new Point3f(1, 0, 1), new Point3f(4, 0, 5));
        assertEquals(5.0f, ray.maxDistance(), 1e-5f);
        assertTrue(ray.getPointAt(5).epsilonEquals(new Point3f(4, 0, 5), 1e-5f));
    }

    @Test
    void testInvalidRays() {
        assertThrows(IllegalArgumentException.class, () -> new Ray3D(new Point3f(), new Vector3f()));
        assertThrows(IllegalArgumentException.class, () -> new Ray3D(new Point3f(), new Vector3f(1, 0, 0), 0));
    }
}
