/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.songtimeline;

import org.apache.commons.collections4.MultiValuedMap;
import org.apache.commons.collections4.multimap.ArrayListValuedHashMap;
import org.apache.commons.lang3.Validate;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Group of {@link EntryWatcher}s of one {@link SongTimeline}, usually one per view of the song. Entries are
 * matched by identity. Disposing the scope drops all of its watchers at once.
 */
public class WatcherScope {

    private final SongTimeline timeline;
    private final MultiValuedMap<TimelineEntry, EntryWatcher<?>> watchers = new ArrayListValuedHashMap<>();
    private boolean disposed;

    public WatcherScope(@NotNull SongTimeline timeline) {
        this.timeline = Validate.notNull(timeline, "timeline");
        timeline.addWatcherScope(this);
    }

    public SongTimeline getTimeline() {
        return timeline;
    }

    /**
     * @return read-only snapshot of the watchers following the given entry, in registration order
     */
    public List<EntryWatcher<?>> getWatchers(TimelineEntry entry) {
        return Collections.unmodifiableList(new ArrayList<>(watchers.get(entry)));
    }

    public int size() {
        return watchers.size();
    }

    public boolean isDisposed() {
        return disposed;
    }

    /**
     * Detach this scope from its timeline. Its watchers receive no further notifications
     */
    public void dispose() {
        timeline.removeWatcherScope(this);
        watchers.clear();
        disposed = true;
    }

    void register(EntryWatcher<?> watcher) {
        Validate.validState(!disposed, "scope is disposed");
        watchers.put(watcher.getEntry(), watcher);
    }

    boolean unregister(EntryWatcher<?> watcher) {
        return watchers.removeMapping(watcher.getEntry(), watcher);
    }

    void entryRemoved(TimelineEntry removed) {
        Collection<EntryWatcher<?>> affected = watchers.remove(removed);
        for (EntryWatcher<?> watcher : affected) {
            watcher.onRemoved();
        }
    }

    void timelineRefreshed() {
        //watchers may unregister while being notified
        for (EntryWatcher<?> watcher : new ArrayList<>(watchers.values())) {
            if (watcher.getEntry().isAttached() && watchers.containsMapping(watcher.getEntry(), watcher))
                watcher.timelineRefreshed(timeline);
        }
    }
}
