package com.hellblazer.touchline.common;

import org.junit.jupiter.api.Test;

import javax.vecmath.Vector3f;

import static org.junit.jupiter.api.Assertions.*;

class SmootherTest {

    @Test
    void testAveragesAgainstZeroFilledHistory() {
        var smoother = new Smoother(4);
        var result = smoother.update(new Vector3f(4, 0, 8));
        assertEquals(1.0f, result.x, 1e-6f, "Single sample is averaged with three zero samples");
        assertEquals(2.0f, result.z, 1e-6f);
    }

    @Test
    void testOldestSampleIsOverwritten() {
        var smoother = new Smoother(2);
        smoother.update(new Vector3f(10, 0, 0));
        smoother.update(new Vector3f(20, 0, 0));
        var result = smoother.update(new Vector3f(30, 0, 0));
        assertEquals(25.0f, result.x, 1e-6f, "Only the two most recent samples contribute");
    }

    @Test
    void testSteadyInputConverges() {
        var smoother = new Smoother();
        Vector3f result = null;
        for (int i = 0; i < Smoother.DEFAULT_SAMPLE_SIZE; i++) {
            result = smoother.update(new Vector3f(0, 0, 1));
        }
        assertEquals(new Vector3f(0, 0, 1), result);
    }

    @Test
    void testRejectsEmptyHistory() {
        assertThrows(IllegalArgumentException.class, () -> new Smoother(0));
    }
}
