/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.songtimeline.chart;

public enum Difficulty {
    EXPERT,
    HARD,
    MEDIUM,
    EASY
}
