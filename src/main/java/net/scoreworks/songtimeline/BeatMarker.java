/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.songtimeline;

/**
 * A beat line derived from the time signatures by {@link SongTimeline#generateBeats(long)}. Beats are
 * never authored directly.
 */
public class BeatMarker extends SyncTrackEntry {

    public enum Type {
        /** first beat of a measure */
        MEASURE,
        BEAT
    }

    private final Type type;

    BeatMarker(long tick, Type type) {
        super(tick, EntryKind.BEAT);
        this.type = type;
    }

    public Type getType() {
        return type;
    }

    @Override
    public String toString() {
        return "BeatMarker{tick=" + getTick() + ", type=" + type + '}';
    }
}
