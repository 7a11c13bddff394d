/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.songtimeline;

import net.scoreworks.songtimeline.chart.Chart;
import net.scoreworks.songtimeline.chart.Difficulty;
import net.scoreworks.songtimeline.chart.Instrument;
import net.scoreworks.songtimeline.exceptions.StaleTimelineException;
import org.apache.commons.collections4.list.UnmodifiableList;
import org.apache.commons.lang3.Validate;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;


/**
 * Root of a song's timing data. Owns the sync track (tempo and time signature changes), the event track
 * (text events, sections and venue events) and one {@link Chart} per instrument and difficulty. All conversions
 * between ticks and seconds go through this class.
 * <p>
 * Every mutation refreshes typed views and assigned tempo times right away, unless a {@link TimelineBatch} is
 * open. Not thread safe: callers must serialize access to one instance.
 */
public class SongTimeline {
    private static final Logger LOG = LoggerFactory.getLogger(SongTimeline.class);

    private double resolution;

    private final OrderedTrack<SyncTrackEntry> syncTrack = new OrderedTrack<>(EnumSet.of(EntryKind.TEMPO, EntryKind.TIME_SIGNATURE));
    private final OrderedTrack<EventEntry> eventTrack = new OrderedTrack<>();

    private final TypedView<TempoMarker> tempoMarkers = syncTrack.registerView(EntryKind.TEMPO, TempoMarker.class);
    private final TypedView<TimeSignatureMarker> timeSignatures = syncTrack.registerView(EntryKind.TIME_SIGNATURE, TimeSignatureMarker.class);
    private final TypedView<BeatMarker> beats = syncTrack.registerView(EntryKind.BEAT, BeatMarker.class);

    private final TypedView<TextEvent> events = eventTrack.registerView(EntryKind.TEXT_EVENT, TextEvent.class);
    private final TypedView<Section> sections = eventTrack.registerView(EntryKind.SECTION, Section.class);
    private final TypedView<VenueEvent> venueEvents = eventTrack.registerView(EntryKind.VENUE_EVENT, VenueEvent.class);

    private final TempoMap tempoMap = new TempoMap(tempoMarkers);

    /**
     * Densely packed by {@link Chart#slotIndex(Instrument, Difficulty)}
     */
    private final Chart[] charts = new Chart[Chart.slotCount()];

    private final Set<WatcherScope> watcherScopes = new HashSet<>();

    private int openBatches;

    public SongTimeline() {
        this(SongConfig.STANDARD_BEAT_RESOLUTION);
    }

    /**
     * Create a timeline holding a default tempo and a 4/4 time signature at tick 0
     * @param resolution ticks per beat
     */
    public SongTimeline(double resolution) {
        checkResolution(resolution);
        this.resolution = resolution;
        syncTrack.insert(new TempoMarker());
        syncTrack.insert(new TimeSignatureMarker());
        for (Instrument instrument : Instrument.values()) {
            for (Difficulty difficulty : Difficulty.values()) {
                Chart chart = new Chart(instrument, difficulty, this::notifyRemoval);
                charts[chart.getIndex()] = chart;
            }
        }
        refresh();
        LOG.debug("Created timeline with resolution {}", resolution);
    }

    public double getResolution() {
        return resolution;
    }

    //=====================================mutations========================================//

    public void addTempoMarker(@NotNull TempoMarker marker) {
        syncTrack.insert(marker);
        afterMutation();
    }

    /**
     * @return false if the marker is not part of this timeline or anchors it at tick 0
     */
    public boolean removeTempoMarker(@NotNull TempoMarker marker) {
        return removeFrom(syncTrack, marker);
    }

    public void addTimeSignatureMarker(@NotNull TimeSignatureMarker marker) {
        syncTrack.insert(marker);
        afterMutation();
    }

    /**
     * @return false if the marker is not part of this timeline or anchors it at tick 0
     */
    public boolean removeTimeSignatureMarker(@NotNull TimeSignatureMarker marker) {
        return removeFrom(syncTrack, marker);
    }

    /**
     * Add a text event, section or venue event
     */
    public void addEvent(@NotNull EventEntry event) {
        eventTrack.insert(event);
        afterMutation();
    }

    /**
     * @return false if the event is not part of this timeline
     */
    public boolean removeEvent(@NotNull EventEntry event) {
        return removeFrom(eventTrack, event);
    }

    private <E extends TimelineEntry> boolean removeFrom(OrderedTrack<E> track, E entry) {
        Validate.notNull(entry, "entry");
        if (track.isAnchor(entry)) {
            LOG.debug("Refused to remove anchor {}", entry);
            return false;
        }
        if (!track.remove(entry)) {
            LOG.debug("{} is not part of this timeline", entry);
            return false;
        }
        notifyRemoval(entry);
        afterMutation();
        return true;
    }

    /**
     * Replace all beat markers by beats derived from the time signatures, up to and including the given tick.
     * Each signature places a beat every {@code resolution * 4 / denominator} ticks starting at its own tick, the
     * first of every {@code numerator} beats being a {@link BeatMarker.Type#MEASURE}.
     * @return the number of generated beats
     */
    public int generateBeats(long endTick) {
        Validate.isTrue(endTick >= 0, "endTick must be >= 0 but was %d", endTick);
        //read signatures from the backing track, the typed view is stale during a batch
        List<TimeSignatureMarker> signatures = new ArrayList<>();
        for (SyncTrackEntry entry : syncTrack.getEntries()) {
            if (entry.getKind() == EntryKind.TIME_SIGNATURE)
                signatures.add((TimeSignatureMarker) entry);
        }
        List<BeatMarker> generated = new ArrayList<>();
        for (int i = 0; i < signatures.size(); i++) {
            TimeSignatureMarker signature = signatures.get(i);
            long limit = endTick;
            if (i + 1 < signatures.size())
                limit = Math.min(limit, signatures.get(i + 1).getTick() - 1);
            double beatLength = signature.beatLengthInTicks(resolution);
            long beat = 0;
            long tick = signature.getTick();
            while (tick <= limit) {
                BeatMarker.Type type = beat % signature.getNumerator() == 0 ? BeatMarker.Type.MEASURE : BeatMarker.Type.BEAT;
                generated.add(new BeatMarker(tick, type));
                beat++;
                tick = signature.getTick() + Math.round(beat * beatLength);
            }
        }
        for (SyncTrackEntry removed : syncTrack.removeAll(EntryKind.BEAT)) {
            notifyRemoval(removed);
        }
        syncTrack.insertAll(generated);
        LOG.debug("Generated {} beats up to tick {}", generated.size(), endTick);
        afterMutation();
        return generated.size();
    }

    /**
     * @return factor that converts ticks of this timeline into ticks of the target resolution
     */
    public double resolutionScaleRatio(double targetResolution) {
        return targetResolution / resolution;
    }

    /**
     * Change the resolution, scaling the ticks of all entries and chart objects so they keep their musical position
     */
    public void rescale(double newResolution) {
        checkResolution(newResolution);
        double ratio = resolutionScaleRatio(newResolution);
        syncTrack.rescale(ratio);
        eventTrack.rescale(ratio);
        for (Chart chart : charts) {
            chart.rescale(ratio);
        }
        LOG.info("Rescaled timeline from resolution {} to {}", resolution, newResolution);
        resolution = newResolution;
        afterMutation();
    }

    //=====================================batches & caches========================================//

    /**
     * Open a batch. Mutations inside it skip refreshing until the outermost batch is closed.
     */
    public TimelineBatch beginBatch() {
        openBatches++;
        return new TimelineBatch(this);
    }

    public boolean isBatchOpen() {
        return openBatches > 0;
    }

    void endBatch() {
        openBatches--;
        if (openBatches == 0) {
            LOG.debug("Batch closed");
            refresh();
        }
    }

    private void afterMutation() {
        if (openBatches == 0)
            refresh();
    }

    /**
     * Rebuild all typed views, assign times to the tempo markers and tell {@link EntryWatcher}s whose entry moved.
     * Happens automatically after mutations outside a {@link TimelineBatch}.
     */
    public void refresh() {
        syncTrack.refreshTypedViews();
        eventTrack.refreshTypedViews();
        tempoMap.recomputeAssignedTimes(resolution);
        for (WatcherScope scope : new ArrayList<>(watcherScopes)) {
            scope.timelineRefreshed();
        }
        LOG.debug("Refreshed timeline: {} sync entries, {} events", syncTrack.size(), eventTrack.size());
    }

    public void updateAllChartCaches() {
        for (Chart chart : charts) {
            chart.updateCache();
        }
    }

    private void checkNotStale() {
        if (openBatches > 0)
            throw new StaleTimelineException();
    }

    //=====================================conversions========================================//

    /**
     * @return playback time of a tick in seconds
     */
    public double tickToTime(long tick) {
        checkNotStale();
        return tempoMap.tickToTime(tick, resolution);
    }

    /**
     * @return the tick played at the given time, negative times are clamped to 0
     */
    public long timeToTick(double time) {
        checkNotStale();
        return tempoMap.timeToTick(time, resolution);
    }

    /**
     * Like {@link #tickToTime(long)} but computed from the backing sync track, so it is safe to call during a batch
     */
    public double liveTickToTime(long tick) {
        TempoMarker initial = null;
        for (SyncTrackEntry entry : syncTrack.getEntries()) {
            if (entry.getKind() == EntryKind.TEMPO) {
                initial = (TempoMarker) entry;
                break;
            }
        }
        return TempoMap.liveTickToTime(tick, resolution, Validate.notNull(initial, "tempo anchor"), syncTrack.getEntries());
    }

    public TempoMarker getPreviousTempoMarker(long tick) {
        checkNotStale();
        return tempoMarkers.findPrevious(tick);
    }

    public TimeSignatureMarker getPreviousTimeSignature(long tick) {
        checkNotStale();
        return timeSignatures.findPrevious(tick);
    }

    @Nullable
    public Section getPreviousSection(long tick) {
        checkNotStale();
        return sections.findPrevious(tick);
    }

    //=====================================read access========================================//

    public TempoMap getTempoMap() {
        return tempoMap;
    }

    /**
     * @return read-only backing list of all tempo, time signature and beat markers
     */
    public List<SyncTrackEntry> getSyncTrack() {
        return syncTrack.getEntries();
    }

    /**
     * @return read-only backing list of all text events, sections and venue events
     */
    public List<EventEntry> getEventsAndSections() {
        return eventTrack.getEntries();
    }

    public TypedView<TempoMarker> getTempoMarkers() {
        return tempoMarkers;
    }

    public TypedView<TimeSignatureMarker> getTimeSignatures() {
        return timeSignatures;
    }

    public TypedView<BeatMarker> getBeats() {
        return beats;
    }

    public TypedView<TextEvent> getEvents() {
        return events;
    }

    public TypedView<Section> getSections() {
        return sections;
    }

    public TypedView<VenueEvent> getVenueEvents() {
        return venueEvents;
    }

    //=====================================charts========================================//

    public Chart getChart(@NotNull Instrument instrument, @NotNull Difficulty difficulty) {
        Validate.notNull(instrument, "instrument");
        Validate.notNull(difficulty, "difficulty");
        return charts[Chart.slotIndex(instrument, difficulty)];
    }

    public boolean chartExistsForInstrument(@NotNull Instrument instrument) {
        for (Difficulty difficulty : Difficulty.values()) {
            if (doesChartExist(instrument, difficulty))
                return true;
        }
        return false;
    }

    public boolean doesChartExist(@NotNull Instrument instrument, @NotNull Difficulty difficulty) {
        return !getChart(instrument, difficulty).isEmpty();
    }

    public List<Chart> getCharts() {
        return UnmodifiableList.unmodifiableList(Arrays.asList(charts));
    }

    //=====================================watchers========================================//

    private void notifyRemoval(TimelineEntry entry) {
        for (WatcherScope scope : new ArrayList<>(watcherScopes)) {
            scope.entryRemoved(entry);
        }
    }

    void addWatcherScope(WatcherScope scope) {
        watcherScopes.add(scope);
    }

    void removeWatcherScope(WatcherScope scope) {
        watcherScopes.remove(scope);
    }

    private static void checkResolution(double resolution) {
        Validate.isTrue(Double.isFinite(resolution) && resolution > 0, "resolution must be finite and > 0 but was %s", resolution);
    }
}
