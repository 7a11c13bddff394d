/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.songtimeline;

import net.scoreworks.songtimeline.exceptions.EntryOwnershipException;
import org.apache.commons.collections4.list.UnmodifiableList;
import org.apache.commons.lang3.Validate;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Sorted container of heterogeneous {@link TimelineEntry}s sharing one tick-ordered backing list. Entries with
 * equal ticks keep the order they were inserted in. Derived {@link TypedView}s per {@link EntryKind} are only
 * brought up to date by {@link #refreshTypedViews()}, so a batch of mutations costs a single rebuild.
 * @param <E> common base type of all entries on this track
 */
public class OrderedTrack<E extends TimelineEntry> {

    private final List<E> entries = new ArrayList<>();
    private final List<E> readOnlyEntries = UnmodifiableList.unmodifiableList(entries);
    private final Map<EntryKind, TypedView<?>> views = new EnumMap<>(EntryKind.class);

    /**
     * Kinds whose entries at tick 0 anchor this track and can not be removed
     */
    private final Set<EntryKind> anchoredKinds;

    /**
     * @param anchoredKinds kinds whose entries at tick 0 refuse removal
     */
    public OrderedTrack(@NotNull Set<EntryKind> anchoredKinds) {
        this.anchoredKinds = anchoredKinds.isEmpty() ? EnumSet.noneOf(EntryKind.class) : EnumSet.copyOf(anchoredKinds);
    }

    public OrderedTrack() {
        this(EnumSet.noneOf(EntryKind.class));
    }

    /**
     * Declare a typed view for one kind of entry. The view is empty until the next {@link #refreshTypedViews()}.
     * @param type class-type the entries of this kind are exposed as
     */
    public <T extends E> TypedView<T> registerView(@NotNull EntryKind kind, @NotNull Class<T> type) {
        Validate.isTrue(!views.containsKey(kind), "a view for %s is already registered", kind);
        TypedView<T> view = new TypedView<>(kind, type);
        views.put(kind, view);
        return view;
    }

    /**
     * Insert an entry behind all entries with a smaller or equal tick. Takes O(n) for shifting the backing list.
     * @throws EntryOwnershipException if the entry is owned by a track or was removed before
     * @throws IllegalArgumentException if the entry's kind is registered for a class-type it is not an instance of
     */
    public void insert(@NotNull E entry) {
        Validate.notNull(entry, "entry");
        checkKind(entry);
        entry.attach();
        entries.add(upperBound(entries, entry.getTick()), entry);
    }

    /**
     * Insert many entries at once. Equal ticks end up in the order of the backing list first, then in the
     * iteration order of the given collection.
     */
    public void insertAll(@NotNull Collection<? extends E> newEntries) {
        Set<E> distinct = Collections.newSetFromMap(new IdentityHashMap<>());
        for (E entry : newEntries) {
            Validate.notNull(entry, "entry");
            checkKind(entry);
            entry.checkAttachable();
            if (!distinct.add(entry))
                throw new EntryOwnershipException(entry, "is contained twice in the inserted collection");
        }
        for (E entry : newEntries) {
            entry.attach();
        }
        entries.addAll(newEntries);
        //List.sort is stable
        entries.sort(Comparator.comparingLong(TimelineEntry::getTick));
    }

    /**
     * An entry whose kind has a view must be of that view's class-type, otherwise it could never be listed
     */
    private void checkKind(E entry) {
        TypedView<?> view = views.get(entry.getKind());
        if (view != null && !view.accepts(entry))
            throw new IllegalArgumentException(entry.getClass().getName() + " can not be tagged " + entry.getKind()
                    + ", entries of that kind must be " + view.getType().getName());
    }

    /**
     * Remove an entry by identity. Anchors are never removed.
     * @return true if the entry was found and removed
     */
    public boolean remove(@NotNull E entry) {
        if (isAnchor(entry))
            return false;
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i) == entry) {
                entries.remove(i);
                entry.detach();
                return true;
            }
        }
        return false;
    }

    /**
     * Remove all entries of a kind, anchors excluded
     * @return the removed entries in tick order
     */
    public List<E> removeAll(@NotNull EntryKind kind) {
        List<E> removed = new ArrayList<>();
        Iterator<E> it = entries.iterator();
        while (it.hasNext()) {
            E entry = it.next();
            if (entry.getKind() == kind && !isAnchor(entry)) {
                it.remove();
                entry.detach();
                removed.add(entry);
            }
        }
        return removed;
    }

    /**
     * @return true for entries at tick 0 whose kind anchors this track
     */
    public boolean isAnchor(@NotNull E entry) {
        return entry.getTick() == 0 && anchoredKinds.contains(entry.getKind());
    }

    public boolean contains(E entry) {
        for (E e : entries) {
            if (e == entry)
                return true;
        }
        return false;
    }

    /**
     * Rebuild every registered {@link TypedView} from the backing list
     */
    public void refreshTypedViews() {
        for (TypedView<?> view : views.values()) {
            view.rebuild(entries);
        }
    }

    /**
     * Scale the ticks of all entries. Rounding keeps the order since scaling is monotonic.
     */
    public void rescale(double ratio) {
        Validate.isTrue(Double.isFinite(ratio) && ratio > 0, "ratio must be finite and > 0 but was %s", ratio);
        for (E entry : entries) {
            entry.rescale(ratio);
        }
    }

    /**
     * @return read-only access to the backing list of all entries, in tick order
     */
    public List<E> getEntries() {
        return readOnlyEntries;
    }

    public int size() {
        return entries.size();
    }

    /**
     * @return index of the first entry with a tick greater than the given tick, or the size of the list
     */
    static int upperBound(List<? extends TimelineEntry> sorted, long tick) {
        int low = 0;
        int high = sorted.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (sorted.get(mid).getTick() <= tick)
                low = mid + 1;
            else
                high = mid;
        }
        return low;
    }
}
