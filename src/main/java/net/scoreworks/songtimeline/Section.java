/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.songtimeline;

/**
 * Named practice section, the text being the display name ("Intro", "Guitar Solo")
 */
public class Section extends EventEntry {

    public Section(long tick, String name) {
        super(tick, EntryKind.SECTION, name);
    }

    public String getName() {
        return getText();
    }
}
