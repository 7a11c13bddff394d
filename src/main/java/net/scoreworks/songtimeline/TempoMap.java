/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.songtimeline;

import org.apache.commons.lang3.Validate;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Piecewise linear mapping between ticks and seconds defined by the tempo markers of a sync track. Each marker
 * caches the time its tick is played at ({@link TempoMarker#getAssignedTime()}), so single conversions only
 * need the closest preceding marker.
 */
public class TempoMap {

    private final TypedView<TempoMarker> tempoMarkers;

    TempoMap(TypedView<TempoMarker> tempoMarkers) {
        Validate.isTrue(tempoMarkers.getKind() == EntryKind.TEMPO, "view must contain tempo markers");
        this.tempoMarkers = tempoMarkers;
    }

    public TypedView<TempoMarker> getTempoMarkers() {
        return tempoMarkers;
    }

    /**
     * Assign times to all tempo markers in one forward pass, each marker continuing from its predecessor.
     * Computing every marker from scratch would be quadratic in the number of tempo changes.
     */
    public void recomputeAssignedTimes(double resolution) {
        TempoMarker previous = tempoMarkers.get(0);
        previous.setAssignedTime(0);
        for (int i = 1; i < tempoMarkers.size(); i++) {
            TempoMarker marker = tempoMarkers.get(i);
            double delta = TickMath.distanceToTime(previous.getTick(), marker.getTick(), resolution, previous.getBpm());
            marker.setAssignedTime(previous.getAssignedTime() + delta);
            previous = marker;
        }
    }

    /**
     * @return playback time of a tick in seconds, negative ticks are clamped to 0
     */
    public double tickToTime(long tick, double resolution) {
        if (tick < 0)
            tick = 0;
        int index = tempoMarkers.findClosestIndex(tick);
        if (tempoMarkers.get(index).getTick() > tick && index > 0)
            index--;
        TempoMarker previous = tempoMarkers.get(index);
        return previous.getAssignedTime() + TickMath.distanceToTime(previous.getTick(), tick, resolution, previous.getBpm());
    }

    /**
     * Inverse of {@link #tickToTime(long, double)}. Negative times are clamped to 0. The result may be off by one
     * tick due to rounding.
     */
    public long timeToTick(double time, double resolution) {
        if (time < 0)
            time = 0;
        //assigned times never decrease along the tempo markers, so search the last one not after the given time
        int low = 0;
        int high = tempoMarkers.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (tempoMarkers.get(mid).getAssignedTime() <= time)
                low = mid + 1;
            else
                high = mid;
        }
        TempoMarker previous = tempoMarkers.get(Math.max(low - 1, 0));
        return previous.getTick() + TickMath.timeDeltaToTick(time - previous.getAssignedTime(), resolution, previous.getBpm());
    }

    /**
     * Convert a tick to time directly from the raw sync track without using assigned times. Use this while cached
     * times are known to be stale, e.g. during an open {@link TimelineBatch}.
     * @param initialTempo tempo in effect from tick 0, usually the first tempo marker
     * @param syncTrack tick ordered entries, entries other than tempo markers are skipped
     */
    public static double liveTickToTime(long tick, double resolution, @NotNull TempoMarker initialTempo,
                                        @NotNull List<? extends TimelineEntry> syncTrack) {
        if (tick < 0)
            tick = 0;
        double time = 0;
        TempoMarker previous = initialTempo;
        for (TimelineEntry entry : syncTrack) {
            if (entry.getKind() != EntryKind.TEMPO)
                continue;
            if (entry.getTick() > tick)
                break;
            TempoMarker marker = (TempoMarker) entry;
            time += TickMath.distanceToTime(previous.getTick(), marker.getTick(), resolution, previous.getBpm());
            previous = marker;
        }
        return time + TickMath.distanceToTime(previous.getTick(), tick, resolution, previous.getBpm());
    }
}
