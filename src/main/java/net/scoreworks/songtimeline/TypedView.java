/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.songtimeline;

import org.jetbrains.annotations.Nullable;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;
import java.util.RandomAccess;

/**
 * Read-only, tick-ordered list of all entries of one {@link EntryKind} of an {@link OrderedTrack}. The
 * content is a snapshot of the backing track taken at its last {@link OrderedTrack#refreshTypedViews()}.
 * Mutating methods of {@link java.util.List} throw {@link UnsupportedOperationException}.
 * @param <T> class-type of the entries of this kind
 */
public class TypedView<T extends TimelineEntry> extends AbstractList<T> implements RandomAccess {

    private final EntryKind kind;
    private final Class<T> type;
    private final List<T> cache = new ArrayList<>();

    TypedView(EntryKind kind, Class<T> type) {
        this.kind = kind;
        this.type = type;
    }

    public EntryKind getKind() {
        return kind;
    }

    public Class<T> getType() {
        return type;
    }

    boolean accepts(TimelineEntry entry) {
        return entry.getKind() == kind && type.isInstance(entry);
    }

    @Override
    public T get(int index) {
        return cache.get(index);
    }

    @Override
    public int size() {
        return cache.size();
    }

    /**
     * Partition the backing entries on their kind tag
     */
    void rebuild(List<? extends TimelineEntry> backing) {
        cache.clear();
        for (TimelineEntry entry : backing) {
            if (entry.getKind() == kind)
                cache.add(type.cast(entry));
        }
    }

    /**
     * @return the last entry with a tick smaller than or equal to the given tick. Ticks before the first
     * entry are clamped to the first entry. Null only if the view is empty
     */
    @Nullable
    public T findPrevious(long tick) {
        if (cache.isEmpty())
            return null;
        int index = OrderedTrack.upperBound(cache, tick) - 1;
        return cache.get(Math.max(index, 0));
    }

    /**
     * Binary search for the entry closest to the given tick. If two entries are equally close the earlier
     * one wins. Among several entries on the exact tick the last one is returned.
     * @return index of the closest entry or -1 if the view is empty
     */
    public int findClosestIndex(long tick) {
        if (cache.isEmpty())
            return -1;
        int after = OrderedTrack.upperBound(cache, tick);
        if (after == 0)
            return 0;
        if (after == cache.size())
            return after - 1;
        long distanceBefore = tick - cache.get(after - 1).getTick();
        long distanceAfter = cache.get(after).getTick() - tick;
        return distanceAfter < distanceBefore ? after : after - 1;
    }
}
