/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.songtimeline;

/**
 * Defaults every new {@link SongTimeline} starts with.
 */
public final class SongConfig {

    /** Ticks per beat of a timeline unless a resolution is given explicitly */
    public static final double STANDARD_BEAT_RESOLUTION = 192;

    /** Factor between a stored tempo value and beats per minute */
    public static final int BPM_SCALE = 1000;

    /** 120.000 beats per minute */
    public static final int DEFAULT_BPM_SCALED = 120 * BPM_SCALE;

    public static final int DEFAULT_TS_NUMERATOR = 4;
    public static final int DEFAULT_TS_DENOMINATOR = 4;

    private SongConfig() {}
}
