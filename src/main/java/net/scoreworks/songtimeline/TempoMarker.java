/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.songtimeline;

import org.apache.commons.lang3.Validate;

/**
 * A tempo change. The tempo is stored as beats per minute multiplied by {@link SongConfig#BPM_SCALE}, so
 * three decimal digits survive without floating point drift.
 */
public class TempoMarker extends SyncTrackEntry {

    private final int value;

    /**
     * Playback time of this marker's tick in seconds. Only ever written by {@link TempoMap}
     */
    private double assignedTime;

    /**
     * Tempo marker at tick 0 with the default tempo
     */
    public TempoMarker() {
        this(0, SongConfig.DEFAULT_BPM_SCALED);
    }

    /**
     * @param tick position of the tempo change
     * @param value beats per minute times {@link SongConfig#BPM_SCALE}
     */
    public TempoMarker(long tick, int value) {
        super(tick, EntryKind.TEMPO);
        Validate.isTrue(value > 0, "tempo must be > 0 but was %d", value);
        this.value = value;
    }

    public static TempoMarker ofBpm(long tick, double bpm) {
        Validate.isTrue(Double.isFinite(bpm), "bpm must be finite");
        double scaled = bpm * SongConfig.BPM_SCALE;
        Validate.isTrue(scaled > 0 && scaled <= Integer.MAX_VALUE, "bpm must be > 0 and storable but was %s", bpm);
        return new TempoMarker(tick, (int) Math.round(scaled));
    }

    public int getValue() {
        return value;
    }

    public double getBpm() {
        return value / (double) SongConfig.BPM_SCALE;
    }

    public double getAssignedTime() {
        return assignedTime;
    }

    void setAssignedTime(double assignedTime) {
        this.assignedTime = assignedTime;
    }

    @Override
    public String toString() {
        return "TempoMarker{tick=" + getTick() + ", bpm=" + getBpm() + ", assignedTime=" + assignedTime + '}';
    }
}
