/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.songtimeline;

import org.apache.commons.lang3.Validate;
import org.apache.commons.lang3.math.Fraction;

public class TimeSignatureMarker extends SyncTrackEntry {

    private final int numerator;
    private final int denominator;

    /**
     * 4/4 at tick 0
     */
    public TimeSignatureMarker() {
        this(0, SongConfig.DEFAULT_TS_NUMERATOR, SongConfig.DEFAULT_TS_DENOMINATOR);
    }

    public TimeSignatureMarker(long tick, int numerator, int denominator) {
        super(tick, EntryKind.TIME_SIGNATURE);
        Validate.isTrue(numerator > 0, "numerator must be > 0 but was %d", numerator);
        Validate.isTrue(denominator > 0, "denominator must be > 0 but was %d", denominator);
        this.numerator = numerator;
        this.denominator = denominator;
    }

    public int getNumerator() {
        return numerator;
    }

    public int getDenominator() {
        return denominator;
    }

    /**
     * @return length of one measure in whole notes, unreduced (6/8 stays 6/8)
     */
    public Fraction getFraction() {
        return Fraction.getFraction(numerator, denominator);
    }

    /**
     * @param resolution ticks per quarter note
     * @return ticks covered by one beat of this signature
     */
    public double beatLengthInTicks(double resolution) {
        return resolution * 4 / denominator;
    }

    public double measureLengthInTicks(double resolution) {
        return getFraction().multiplyBy(Fraction.getFraction(4, 1)).doubleValue() * resolution;
    }

    @Override
    public String toString() {
        return "TimeSignatureMarker{tick=" + getTick() + ", " + numerator + "/" + denominator + '}';
    }
}
