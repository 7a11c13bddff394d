/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.songtimeline;

/**
 * Entry of the sync track, the combined tempo and time signature sequence that governs conversions
 * between ticks and time. Only {@link TempoMarker}, {@link TimeSignatureMarker} and {@link BeatMarker} extend it.
 */
public abstract class SyncTrackEntry extends TimelineEntry {

    SyncTrackEntry(long tick, EntryKind kind) {
        super(tick, kind);
    }
}
