/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.songtimeline.exceptions;

import net.scoreworks.songtimeline.TimelineEntry;

/**
 * Thrown when an entry is inserted into a track although it already has an owner or was removed before
 */
public class EntryOwnershipException extends RuntimeException {
    public EntryOwnershipException(TimelineEntry entry, String message) {
        super(entry.getClass().getSimpleName() + " at tick " + entry.getTick() + " " + message);
    }
}
