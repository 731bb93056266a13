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

import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongSupplier;
import java.util.random.RandomGenerator;

/**
 * Rate limiter for code that should only run a fixed number of times per second, such as tactical scoring or
 * kicking. Construct with the desired frequency and only let the guarded section run when {@link #isReady()}
 * answers true.
 * <p>
 * A frequency of zero disables regulation entirely (always ready); a negative frequency blocks forever. Each time
 * the regulator opens, the next opening is jittered by up to {@value #UPDATE_PERIOD_VARIATOR} milliseconds so that
 * many regulators created in the same tick spread their work across frames.
 *
 * @author hal.hildebrand
 */
public class Regulator {
    /** Maximum jitter, in milliseconds, applied to each update period */
    public static final double UPDATE_PERIOD_VARIATOR = 10.0;

    private static final double NANOS_PER_MILLI = 1_000_000.0;

    private final LongSupplier    nanoClock;
    private final RandomGenerator random;
    private final double          updatePeriod;
    private       double          nextUpdateTime;

    /**
     * Create a regulator driven by the system nano clock
     *
     * @param updatesPerSecond the desired frequency
     */
    public Regulator(double updatesPerSecond) {
        this(updatesPerSecond, System::nanoTime, ThreadLocalRandom.current());
    }

    /**
     * Create a regulator with an explicit clock and source of jitter
     *
     * @param updatesPerSecond the desired frequency; 0 never blocks, negative always blocks
     * @param nanoClock        monotonic time source in nanoseconds
     * @param random           source of the update period jitter
     */
    public Regulator(double updatesPerSecond, LongSupplier nanoClock, RandomGenerator random) {
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock cannot be null");
        this.random = Objects.requireNonNull(random, "random cannot be null");
        if (updatesPerSecond > 0) {
            updatePeriod = 1000.0 / updatesPerSecond;
        } else if (updatesPerSecond == 0) {
            updatePeriod = 0;
        } else {
            updatePeriod = -1;
        }
        nextUpdateTime = now();
    }

    /**
     * @return the period between openings in milliseconds, 0 when unregulated and -1 when blocked
     */
    public double getUpdatePeriod() {
        return updatePeriod;
    }

    /**
     * Answer whether the guarded code may run now. Opening the regulator schedules the next opening.
     *
     * @return true if the current time has reached the next update time
     */
    public boolean isReady() {
        if (updatePeriod == 0) {
            return true;
        }
        if (updatePeriod < 0) {
            return false;
        }
        var currentTime = now();
        if (currentTime >= nextUpdateTime) {
            nextUpdateTime = currentTime + updatePeriod + random.nextDouble(-UPDATE_PERIOD_VARIATOR,
                                                                            UPDATE_PERIOD_VARIATOR);
            return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return String.format("Regulator{period=%.1fms}", updatePeriod);
    }

    private double now() {
        return nanoClock.getAsLong() / NANOS_PER_MILLI;
    }
}
