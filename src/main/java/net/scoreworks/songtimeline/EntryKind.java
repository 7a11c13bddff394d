/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.songtimeline;

/**
 * Discriminant every {@link TimelineEntry} carries. Typed views of an {@link OrderedTrack} are
 * partitioned on this tag rather than on the runtime class of an entry.
 */
public enum EntryKind {
    TEMPO,
    TIME_SIGNATURE,
    BEAT,
    TEXT_EVENT,
    SECTION,
    VENUE_EVENT,
    CHART_OBJECT
}
