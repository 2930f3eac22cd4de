/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

/**
 * Diatonic pitch names, ordered by their step within the octave
 */
public enum PitchName {
    C, D, E, F, G, A, B;

    /**
     * @return the diatonic step of this pitch within its octave, starting with 0 for C
     */
    public int getStep() {
        return ordinal();
    }
}
