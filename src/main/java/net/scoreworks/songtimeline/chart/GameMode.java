/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.songtimeline.chart;

/**
 * Family of gameplay an instrument's charts are played with
 */
public enum GameMode {
    GUITAR,
    DRUMS,
    GHL_GUITAR,
    PRO_GUITAR,
    VOCALS
}
