/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.songtimeline;

/**
 * A global text event like "end" or "music_start"
 */
public class TextEvent extends EventEntry {

    public TextEvent(long tick, String text) {
        super(tick, EntryKind.TEXT_EVENT, text);
    }
}
