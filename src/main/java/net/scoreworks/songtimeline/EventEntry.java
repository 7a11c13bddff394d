/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.songtimeline;

import org.apache.commons.lang3.Validate;

/**
 * Entry of the event track. Events are ordered by tick but take no part in timing. The kind of an event is fixed
 * by {@link TextEvent}, {@link Section} and {@link VenueEvent}, the only direct subclasses.
 */
public abstract class EventEntry extends TimelineEntry {

    private final String text;

    EventEntry(long tick, EntryKind kind, String text) {
        super(tick, kind);
        this.text = Validate.notNull(text, "text");
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{tick=" + getTick() + ", text='" + text + "'}";
    }
}
