/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.songtimeline.chart;

import net.scoreworks.songtimeline.EntryKind;
import net.scoreworks.songtimeline.OrderedTrack;
import net.scoreworks.songtimeline.TypedView;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

/**
 * The chart of one instrument and difficulty. Each chart owns a fixed slot of its timeline's chart table, given
 * by {@link #getIndex()}, which can not change during the chart's lifetime.
 */
public class Chart {

    private final Instrument instrument;
    private final Difficulty difficulty;

    /**
     * Reference to the slot the chart is saved at
     */
    private final int index;

    private final OrderedTrack<ChartObject> chartObjects = new OrderedTrack<>();
    private final TypedView<ChartObject> cachedObjects = chartObjects.registerView(EntryKind.CHART_OBJECT, ChartObject.class);

    /**
     * Told about every object removed from this chart
     */
    private final Consumer<? super ChartObject> removalListener;

    /**
     * @param removalListener receives each object after it was removed from this chart
     */
    public Chart(@NotNull Instrument instrument, @NotNull Difficulty difficulty, @NotNull Consumer<? super ChartObject> removalListener) {
        this.instrument = instrument;
        this.difficulty = difficulty;
        this.index = slotIndex(instrument, difficulty);
        this.removalListener = removalListener;
    }

    /**
     * @return position of the given combination in a densely packed table of all instrument and difficulty pairs
     */
    public static int slotIndex(@NotNull Instrument instrument, @NotNull Difficulty difficulty) {
        return instrument.ordinal() * Difficulty.values().length + difficulty.ordinal();
    }

    public static int slotCount() {
        return Instrument.values().length * Difficulty.values().length;
    }

    public Instrument getInstrument() {
        return instrument;
    }

    public Difficulty getDifficulty() {
        return difficulty;
    }

    public GameMode getGameMode() {
        return instrument.getGameMode();
    }

    public int getIndex() {
        return index;
    }

    public void add(@NotNull ChartObject chartObject) {
        chartObjects.insert(chartObject);
        updateCache();
    }

    /**
     * Insert many objects with a single cache update
     */
    public void addAll(@NotNull Collection<? extends ChartObject> objects) {
        chartObjects.insertAll(objects);
        updateCache();
    }

    /**
     * @return true if the object was part of this chart
     */
    public boolean remove(@NotNull ChartObject chartObject) {
        boolean removed = chartObjects.remove(chartObject);
        if (removed) {
            updateCache();
            removalListener.accept(chartObject);
        }
        return removed;
    }

    /**
     * @return read-only, tick-ordered objects of this chart
     */
    public List<ChartObject> getChartObjects() {
        return cachedObjects;
    }

    @Nullable
    public ChartObject getPreviousObject(long tick) {
        return cachedObjects.findPrevious(tick);
    }

    public boolean isEmpty() {
        return chartObjects.size() == 0;
    }

    public void updateCache() {
        chartObjects.refreshTypedViews();
    }

    /**
     * Scale the ticks and lengths of all objects, see {@link net.scoreworks.songtimeline.SongTimeline#rescale(double)}
     */
    public void rescale(double ratio) {
        chartObjects.rescale(ratio);
        updateCache();
    }

    @Override
    public String toString() {
        return "Chart{" + instrument + ", " + difficulty + ", objects=" + chartObjects.size() + '}';
    }
}
