/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

/**
 * Position of a syllable within its word
 */
public enum WordPosition {
    INITIAL, MEDIAL, TERMINAL
}
