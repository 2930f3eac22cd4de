/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

public enum ClefShape {
    G(PitchName.G, 4),
    F(PitchName.F, 3),
    C(PitchName.C, 4);

    /** pitch sitting on the line the clef is placed on */
    private final PitchName pitch;
    private final int octave;

    ClefShape(PitchName pitch, int octave) {
        this.pitch = pitch;
        this.octave = octave;
    }

    public PitchName getPitch() {
        return pitch;
    }

    public int getOctave() {
        return octave;
    }
}
