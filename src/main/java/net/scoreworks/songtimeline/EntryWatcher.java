/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.songtimeline;

import org.apache.commons.lang3.Validate;
import org.jetbrains.annotations.NotNull;

/**
 * Follows the position of one entry on the timeline, in ticks and in seconds. A renderer holding on to an entry
 * uses it to learn when the entry moved on screen, because a tempo change earlier in the song or a rescale moved it,
 * and when the entry left the timeline.
 * <p>
 * The position is recorded on registration and compared after every refresh of the timeline. Any number of
 * watchers may follow the same entry.
 * @param <E> class-type of the watched entry
 */
public abstract class EntryWatcher<E extends TimelineEntry> {
    private final WatcherScope scope;
    private final E entry;

    private long lastTick;
    private double lastTime;

    /**
     * Registers the new watcher in the given scope
     */
    protected EntryWatcher(@NotNull WatcherScope scope, @NotNull E entry) {
        this.scope = Validate.notNull(scope, "scope");
        this.entry = Validate.notNull(entry, "entry");
        lastTick = entry.getTick();
        lastTime = scope.getTimeline().liveTickToTime(lastTick);
        scope.register(this);
    }

    public WatcherScope getScope() {
        return scope;
    }

    public E getEntry() {
        return entry;
    }

    /**
     * @return tick of the entry at registration or at the last refresh it was part of
     */
    public long getLastTick() {
        return lastTick;
    }

    /**
     * @return playback time in seconds belonging to {@link #getLastTick()}
     */
    public double getLastTime() {
        return lastTime;
    }

    /**
     * Stop following the entry
     * @return false if this watcher was no longer registered
     */
    public boolean unregister() {
        return scope.unregister(this);
    }

    /**
     * Called after a refresh moved the entry. At least one of tick and time differs from its old value.
     */
    protected abstract void onPositionChanged(long oldTick, long newTick, double oldTime, double newTime);

    /**
     * Called once the entry was removed from the timeline, the watcher is unregistered already.
     * {@link #getLastTick()} and {@link #getLastTime()} still report the last known position.
     */
    protected abstract void onRemoved();

    void timelineRefreshed(SongTimeline timeline) {
        long tick = entry.getTick();
        double time = timeline.liveTickToTime(tick);
        if (tick == lastTick && time == lastTime)
            return;
        long oldTick = lastTick;
        double oldTime = lastTime;
        lastTick = tick;
        lastTime = time;
        onPositionChanged(oldTick, tick, oldTime, time);
    }
}
