/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.songtimeline;

import net.scoreworks.songtimeline.exceptions.EntryOwnershipException;
import org.apache.commons.lang3.Validate;

/**
 * Base class for everything that lives on a tick-ordered track. Each entry has one and only one owning
 * {@link OrderedTrack} during its lifetime. The entry does not reference that track: the track owns it
 * by position in its backing list. Once removed, an entry can not be inserted anywhere again.
 */
public abstract class TimelineEntry {

    enum Ownership { NEW, ATTACHED, REMOVED }

    private final EntryKind kind;

    private long tick;

    private Ownership ownership = Ownership.NEW;

    protected TimelineEntry(long tick, EntryKind kind) {
        Validate.isTrue(tick >= 0, "tick must be >= 0 but was %d", tick);
        this.tick = tick;
        this.kind = Validate.notNull(kind, "kind");
    }

    public long getTick() {
        return tick;
    }

    public final EntryKind getKind() {
        return kind;
    }

    /**
     * @return true while this entry is owned by a track
     */
    public boolean isAttached() {
        return ownership == Ownership.ATTACHED;
    }

    /**
     * Scale all tick based fields of this entry. Only called by the owning track while it is being
     * rescaled, so tick order is preserved. Implementations with additional tick lengths must call super.
     * @param ratio target resolution divided by current resolution
     */
    protected void rescale(double ratio) {
        tick = Math.round(tick * ratio);
    }

    void checkAttachable() {
        if (ownership == Ownership.ATTACHED)
            throw new EntryOwnershipException(this, "is already owned by a track");
        if (ownership == Ownership.REMOVED)
            throw new EntryOwnershipException(this, "was removed from its track and can not be reused");
    }

    void attach() {
        checkAttachable();
        ownership = Ownership.ATTACHED;
    }

    void detach() {
        ownership = Ownership.REMOVED;
    }
}
