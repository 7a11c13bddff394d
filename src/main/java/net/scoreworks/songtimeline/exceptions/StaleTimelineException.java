/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.songtimeline.exceptions;

public class StaleTimelineException extends RuntimeException {
    public StaleTimelineException() {
        super("Cached timing data is stale while a TimelineBatch is open. Close the batch first or use liveTickToTime()!");
    }
}
