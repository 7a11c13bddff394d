package net.scoreworks.songtimeline;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Random;

public class TempoMapTests {
    static final double RESOLUTION = 480;

    OrderedTrack<SyncTrackEntry> syncTrack;
    TempoMap tempoMap;

    @BeforeEach
    public void createTempoMap() {
        syncTrack = new OrderedTrack<>(EnumSet.of(EntryKind.TEMPO, EntryKind.TIME_SIGNATURE));
        tempoMap = new TempoMap(syncTrack.registerView(EntryKind.TEMPO, TempoMarker.class));
        syncTrack.insert(new TempoMarker(0, 150000));
        syncTrack.insert(new TimeSignatureMarker());
        refresh();
    }

    private void refresh() {
        syncTrack.refreshTypedViews();
        tempoMap.recomputeAssignedTimes(RESOLUTION);
    }

    private void insertRandomTempoChanges(long seed, int count) {
        Random random = new Random(seed);
        for (int i = 0; i < count; i++) {
            long tick = random.nextInt(200_000);
            int value = 40_000 + random.nextInt(260_000);
            syncTrack.insert(new TempoMarker(tick, value));
            if (i % 5 == 0)
                syncTrack.insert(new TimeSignatureMarker(tick, 3 + random.nextInt(4), 4));
        }
        refresh();
    }

    @Test
    public void testConstantTempo() {
        for (int n = 0; n < 50; n++) {
            Assertions.assertEquals(n * 60.0 / 150, tempoMap.tickToTime((long) (n * RESOLUTION), RESOLUTION), 1e-9);
        }
    }

    @Test
    public void testAssignedTimesFollowPrecedingTempo() {
        TempoMarker slow = new TempoMarker(960, 60000);
        TempoMarker fast = new TempoMarker(1440, 240000);
        syncTrack.insert(fast);
        syncTrack.insert(slow);
        refresh();

        Assertions.assertEquals(0.0, tempoMap.getTempoMarkers().get(0).getAssignedTime());
        //2 beats at 150 bpm
        Assertions.assertEquals(0.8, slow.getAssignedTime(), 1e-9);
        //plus 1 beat at 60 bpm
        Assertions.assertEquals(1.8, fast.getAssignedTime(), 1e-9);
        Assertions.assertEquals(1.8 + 0.25, tempoMap.tickToTime(1920, RESOLUTION), 1e-9);
    }

    @Test
    public void testAssignedTimesNeverDecrease() {
        insertRandomTempoChanges(42, 300);
        TypedView<TempoMarker> markers = tempoMap.getTempoMarkers();
        Assertions.assertEquals(301, markers.size());
        for (int i = 1; i < markers.size(); i++) {
            Assertions.assertTrue(markers.get(i - 1).getTick() <= markers.get(i).getTick());
            Assertions.assertTrue(markers.get(i - 1).getAssignedTime() <= markers.get(i).getAssignedTime());
        }
    }

    @Test
    public void testRoundTripIsWithinOneTick() {
        insertRandomTempoChanges(7, 100);
        for (long tick = 0; tick < 210_000; tick += 37) {
            long back = tempoMap.timeToTick(tempoMap.tickToTime(tick, RESOLUTION), RESOLUTION);
            Assertions.assertTrue(Math.abs(back - tick) <= 1, "tick " + tick + " came back as " + back);
        }
    }

    @Test
    public void testTimeToTick() {
        syncTrack.insert(new TempoMarker(960, 60000));
        refresh();
        Assertions.assertEquals(480, tempoMap.timeToTick(0.4, RESOLUTION));
        Assertions.assertEquals(960, tempoMap.timeToTick(0.8, RESOLUTION));
        Assertions.assertEquals(1440, tempoMap.timeToTick(1.8, RESOLUTION));
        //negative time clamps to the start
        Assertions.assertEquals(0, tempoMap.timeToTick(-3.0, RESOLUTION));
    }

    @Test
    public void testSecondTempoLeavesEarlierTimesUntouched() {
        long[] ticks = {0, 1, 100, 479, 480, 959, 960, 1500, 10_000};
        double[] before = new double[ticks.length];
        for (int i = 0; i < ticks.length; i++) {
            before[i] = tempoMap.tickToTime(ticks[i], RESOLUTION);
        }
        syncTrack.insert(new TempoMarker(960, 100000));
        refresh();
        for (int i = 0; i < ticks.length; i++) {
            if (ticks[i] < 960)
                Assertions.assertEquals(before[i], tempoMap.tickToTime(ticks[i], RESOLUTION), 1e-12);
            else    //new slope of 100 bpm from tick 960 on
                Assertions.assertEquals(before[6] + (ticks[i] - 960) / RESOLUTION * 0.6, tempoMap.tickToTime(ticks[i], RESOLUTION), 1e-9);
        }
    }

    @Test
    public void testLiveTickToTimeMatchesCachedConversion() {
        insertRandomTempoChanges(1234, 150);
        TempoMarker initial = tempoMap.getTempoMarkers().get(0);
        for (long tick = 0; tick < 210_000; tick += 101) {
            Assertions.assertEquals(tempoMap.tickToTime(tick, RESOLUTION),
                    TempoMap.liveTickToTime(tick, RESOLUTION, initial, syncTrack.getEntries()), 1e-6);
        }
    }

    @Test
    public void testLiveTickToTimeIgnoresStaleCache() {
        TempoMarker initial = tempoMap.getTempoMarkers().get(0);
        syncTrack.insert(new TempoMarker(480, 75000));
        //no refresh: the cached map still sees a single tempo
        Assertions.assertEquals(1.2, tempoMap.tickToTime(1440, RESOLUTION), 1e-9);
        Assertions.assertEquals(0.4 + 1.6, TempoMap.liveTickToTime(1440, RESOLUTION, initial, syncTrack.getEntries()), 1e-9);
    }
}
