/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.songtimeline;

import org.apache.commons.lang3.Validate;

/**
 * Lighting, camera and stage cue of the venue track. Unlike other events a venue event may span a tick length.
 */
public class VenueEvent extends EventEntry {

    public enum Type {
        LIGHTING,
        POST_PROCESSING,
        SINGALONG,
        SPOTLIGHT,
        STAGE_EFFECT,
        OTHER
    }

    private final Type type;
    private long length;

    public VenueEvent(long tick, Type type, String text) {
        this(tick, type, text, 0);
    }

    public VenueEvent(long tick, Type type, String text, long length) {
        super(tick, EntryKind.VENUE_EVENT, text);
        Validate.isTrue(length >= 0, "length must be >= 0 but was %d", length);
        this.type = Validate.notNull(type, "type");
        this.length = length;
    }

    public Type getType() {
        return type;
    }

    public long getLength() {
        return length;
    }

    public long getEndTick() {
        return getTick() + length;
    }

    @Override
    protected void rescale(double ratio) {
        super.rescale(ratio);
        length = Math.round(length * ratio);
    }
}
