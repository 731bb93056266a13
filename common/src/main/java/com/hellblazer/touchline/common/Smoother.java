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

import javax.vecmath.Vector3f;

/**
 * Rolling average over the most recent vector samples. Used to decouple a jittery velocity from the heading an
 * agent displays. The history starts zero filled, so the first samples are averaged against zero vectors.
 *
 * @author hal.hildebrand
 */
public class Smoother {
    public static final int DEFAULT_SAMPLE_SIZE = 10;

    private final Vector3f[] history;
    private       int        nextUpdateSlot;

    public Smoother() {
        this(DEFAULT_SAMPLE_SIZE);
    }

    /**
     * @param sampleSize number of samples averaged
     */
    public Smoother(int sampleSize) {
        if (sampleSize < 1) {
            throw new IllegalArgumentException("Sample size must be at least 1: " + sampleSize);
        }
        history = new Vector3f[sampleSize];
        for (int i = 0; i < sampleSize; i++) {
            history[i] = new Vector3f();
        }
    }

    public int getSampleSize() {
        return history.length;
    }

    /**
     * Record the most recent sample, overwriting the oldest, and answer the average of the whole history
     *
     * @param mostRecentValue the new sample
     * @return the smoothed value
     */
    public Vector3f update(Vector3f mostRecentValue) {
        history[nextUpdateSlot].set(mostRecentValue);
        nextUpdateSlot = (nextUpdateSlot + 1) % history.length;

        var average = new Vector3f();
        for (var sample : history) {
            average.add(sample);
        }
        average.scale(1.0f / history.length);
        return average;
    }
}
