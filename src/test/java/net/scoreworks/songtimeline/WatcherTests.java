package net.scoreworks.songtimeline;

import net.scoreworks.songtimeline.chart.Chart;
import net.scoreworks.songtimeline.chart.Difficulty;
import net.scoreworks.songtimeline.chart.Instrument;
import net.scoreworks.songtimeline.test_model.TestNote;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

public class WatcherTests {
    SongTimeline timeline;
    WatcherScope scope;
    TempoMarker marker;
    Section section;
    RecordingWatcher tempoWatcher;
    RecordingWatcher sectionWatcher;

    @BeforeEach
    public void prepareTimeline() {
        timeline = new SongTimeline();
        marker = new TempoMarker(384, 60000);
        section = new Section(192, "Intro");
        timeline.addTempoMarker(marker);
        timeline.addEvent(section);

        scope = new WatcherScope(timeline);
        tempoWatcher = new RecordingWatcher(scope, marker);
        sectionWatcher = new RecordingWatcher(scope, section);
    }

    @AfterEach
    public void cleanUp() {
        scope.dispose();
    }

    @Test
    public void testRegistrationRecordsPosition() {
        Assertions.assertEquals(384, tempoWatcher.getLastTick());
        Assertions.assertEquals(1.0, tempoWatcher.getLastTime(), 1e-9);
        Assertions.assertEquals(0.5, sectionWatcher.getLastTime(), 1e-9);
    }

    @Test
    public void testEarlierTempoChangeMovesEntryInTime() {
        timeline.addTempoMarker(new TempoMarker(192, 240000));
        Assertions.assertEquals(1, tempoWatcher.changes);
        Assertions.assertEquals(384, tempoWatcher.oldTick);
        Assertions.assertEquals(384, tempoWatcher.newTick);
        Assertions.assertEquals(1.0, tempoWatcher.oldTime, 1e-9);
        Assertions.assertEquals(0.75, tempoWatcher.newTime, 1e-9);
        Assertions.assertEquals(0.75, tempoWatcher.getLastTime(), 1e-9);
        //the section lies before the new tempo
        Assertions.assertEquals(0, sectionWatcher.changes);
    }

    @Test
    public void testUnrelatedRefreshDoesNotNotify() {
        timeline.addTempoMarker(new TempoMarker(1000, 90000));
        timeline.addEvent(new TextEvent(50, "crowd"));
        timeline.refresh();
        Assertions.assertEquals(0, tempoWatcher.changes);
        Assertions.assertEquals(0, sectionWatcher.changes);
    }

    @Test
    public void testRescaleReportsNewTick() {
        timeline.rescale(480);
        Assertions.assertEquals(1, sectionWatcher.changes);
        Assertions.assertEquals(192, sectionWatcher.oldTick);
        Assertions.assertEquals(480, sectionWatcher.newTick);
        Assertions.assertEquals(0.5, sectionWatcher.newTime, 1e-9);
    }

    @Test
    public void testAllWatchersOfAnEntrySeeItsRemoval() {
        RecordingWatcher second = new RecordingWatcher(scope, section);
        Assertions.assertEquals(Arrays.asList(sectionWatcher, second), scope.getWatchers(section));
        Assertions.assertEquals(3, scope.size());

        timeline.removeEvent(section);
        Assertions.assertTrue(sectionWatcher.removed);
        Assertions.assertTrue(second.removed);
        Assertions.assertEquals(192, second.getLastTick());
        Assertions.assertTrue(scope.getWatchers(section).isEmpty());
        Assertions.assertEquals(1, scope.size());
        Assertions.assertFalse(tempoWatcher.removed);
        Assertions.assertFalse(sectionWatcher.unregister());
    }

    @Test
    public void testBatchNotifiesOnceOnClose() {
        try (TimelineBatch batch = timeline.beginBatch()) {
            timeline.addTempoMarker(new TempoMarker(96, 100000));
            timeline.addTempoMarker(new TempoMarker(200, 100000));
            Assertions.assertEquals(0, tempoWatcher.changes);
        }
        Assertions.assertEquals(1, tempoWatcher.changes);
    }

    @Test
    public void testUnregisteredWatcherIsNotNotified() {
        Assertions.assertTrue(tempoWatcher.unregister());
        timeline.addTempoMarker(new TempoMarker(192, 240000));
        timeline.removeTempoMarker(marker);
        Assertions.assertEquals(0, tempoWatcher.changes);
        Assertions.assertFalse(tempoWatcher.removed);
    }

    @Test
    public void testRemovedChartObjectIsReported() {
        Chart chart = timeline.getChart(Instrument.GUITAR, Difficulty.EXPERT);
        TestNote note = new TestNote(768, 3, 0);
        chart.add(note);
        RecordingWatcher noteWatcher = new RecordingWatcher(scope, note);
        timeline.addTempoMarker(new TempoMarker(192, 240000));
        Assertions.assertEquals(1, noteWatcher.changes);

        Assertions.assertTrue(chart.remove(note));
        Assertions.assertTrue(noteWatcher.removed);
        Assertions.assertTrue(scope.getWatchers(note).isEmpty());
    }

    @Test
    public void testRegeneratedBeatsAreReportedRemoved() {
        timeline.generateBeats(192);
        BeatMarker beat = timeline.getBeats().get(1);
        RecordingWatcher beatWatcher = new RecordingWatcher(scope, beat);
        timeline.generateBeats(384);
        Assertions.assertTrue(beatWatcher.removed);
        Assertions.assertFalse(beat.isAttached());
    }

    @Test
    public void testDisposedScope() {
        scope.dispose();
        timeline.removeEvent(section);
        timeline.addTempoMarker(new TempoMarker(192, 240000));
        Assertions.assertFalse(sectionWatcher.removed);
        Assertions.assertEquals(0, tempoWatcher.changes);
        Assertions.assertTrue(scope.isDisposed());
        Assertions.assertThrows(IllegalStateException.class, () -> new RecordingWatcher(scope, marker));
    }

    private static class RecordingWatcher extends EntryWatcher<TimelineEntry> {
        int changes;
        boolean removed;
        long oldTick, newTick;
        double oldTime, newTime;

        public RecordingWatcher(WatcherScope ws, TimelineEntry watched) {
            super(ws, watched);
        }
        @Override
        protected void onPositionChanged(long oldTick, long newTick, double oldTime, double newTime) {
            changes++;
            this.oldTick = oldTick;
            this.newTick = newTick;
            this.oldTime = oldTime;
            this.newTime = newTime;
        }
        @Override
        protected void onRemoved() {
            removed = true;
        }
    }
}
