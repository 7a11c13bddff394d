/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.songtimeline.chart;

public enum Instrument {
    GUITAR,
    GUITAR_COOP,
    BASS,
    RHYTHM,
    KEYS,
    DRUMS,
    GHLIVE_GUITAR,
    GHLIVE_BASS,
    GHLIVE_RHYTHM,
    GHLIVE_COOP,
    PRO_GUITAR_17_FRET,
    PRO_GUITAR_22_FRET,
    PRO_BASS_17_FRET,
    PRO_BASS_22_FRET,
    VOCALS,
    HARMONY_1,
    HARMONY_2,
    HARMONY_3;

    public GameMode getGameMode() {
        switch (this) {
            case GUITAR:
            case GUITAR_COOP:
            case BASS:
            case RHYTHM:
            case KEYS:
                return GameMode.GUITAR;
            case DRUMS:
                return GameMode.DRUMS;
            case GHLIVE_GUITAR:
            case GHLIVE_BASS:
            case GHLIVE_RHYTHM:
            case GHLIVE_COOP:
                return GameMode.GHL_GUITAR;
            case PRO_GUITAR_17_FRET:
            case PRO_GUITAR_22_FRET:
            case PRO_BASS_17_FRET:
            case PRO_BASS_22_FRET:
                return GameMode.PRO_GUITAR;
            case VOCALS:
            case HARMONY_1:
            case HARMONY_2:
            case HARMONY_3:
                return GameMode.VOCALS;
            default:
                throw new IllegalStateException("Unhandled instrument " + this);
        }
    }
}
