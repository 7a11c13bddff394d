/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.songtimeline.chart;

import net.scoreworks.songtimeline.EntryKind;
import net.scoreworks.songtimeline.TimelineEntry;
import org.apache.commons.lang3.Validate;

/**
 * Base class for everything placed on a {@link Chart}, like notes or star power phrases. The concrete note models
 * are supplied by the game modes using this library.
 */
public abstract class ChartObject extends TimelineEntry {

    private long length;

    protected ChartObject(long tick, long length) {
        super(tick, EntryKind.CHART_OBJECT);
        Validate.isTrue(length >= 0, "length must be >= 0 but was %d", length);
        this.length = length;
    }

    /**
     * @return sustain length in ticks, 0 if this object has none
     */
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
