package net.scoreworks.songtimeline.test_model;

import net.scoreworks.songtimeline.chart.ChartObject;

public class TestNote extends ChartObject {
    final int fret;

    public TestNote(long tick, int fret, long sustain) {
        super(tick, sustain);
        this.fret = fret;
    }

    public int getFret() {
        return fret;
    }
}
