/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.songtimeline;

import org.apache.commons.lang3.Validate;

/**
 * Conversion between tick distances and time distances under one constant tempo. All composite
 * conversions of a {@link TempoMap} are built from these two functions.
 */
public final class TickMath {

    private TickMath() {}

    /**
     * @param tickDelta distance in ticks, may be negative
     * @param resolution ticks per beat
     * @param bpm beats per minute (not scaled)
     * @return the distance in seconds
     */
    public static double tickDeltaToTime(long tickDelta, double resolution, double bpm) {
        checkArguments(resolution, bpm);
        return (tickDelta / resolution) * (60.0 / bpm);
    }

    /**
     * Inverse of {@link #tickDeltaToTime(long, double, double)}, rounded to the nearest tick. Repeated
     * round trips can therefore drift by up to one tick.
     * @param timeDelta distance in seconds
     * @param resolution ticks per beat
     * @param bpm beats per minute (not scaled)
     * @return the distance in ticks
     */
    public static long timeDeltaToTick(double timeDelta, double resolution, double bpm) {
        checkArguments(resolution, bpm);
        return Math.round(timeDelta * (bpm / 60.0) * resolution);
    }

    /**
     * Time in seconds between two tick positions
     */
    public static double distanceToTime(long tickStart, long tickEnd, double resolution, double bpm) {
        return tickDeltaToTime(tickEnd - tickStart, resolution, bpm);
    }

    private static void checkArguments(double resolution, double bpm) {
        Validate.isTrue(Double.isFinite(resolution) && resolution > 0, "resolution must be finite and > 0 but was %s", resolution);
        Validate.isTrue(Double.isFinite(bpm) && bpm > 0, "bpm must be finite and > 0 but was %s", bpm);
    }
}
