/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.songtimeline;

/**
 * Handle for a group of mutations on a {@link SongTimeline}. While any batch is open, mutations skip the
 * refresh of views and assigned times. Closing the outermost batch refreshes once, so use it with
 * try-with-resources:
 * <pre>{@code
 * try (TimelineBatch batch = timeline.beginBatch()) {
 *     timeline.addTempoMarker(...);
 *     timeline.addEvent(...);
 * }
 * }</pre>
 */
public class TimelineBatch implements AutoCloseable {

    private final SongTimeline timeline;
    private boolean closed;

    TimelineBatch(SongTimeline timeline) {
        this.timeline = timeline;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Closing an already closed batch does nothing
     */
    @Override
    public void close() {
        if (closed)
            return;
        closed = true;
        timeline.endBatch();
    }
}
