/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

/**
 * Notes sounding together. The notes share the time position and drawing X of the chord
 */
public class Chord extends LayerElement {

    public Chord() {
        super(NodeKind.CHORD);
    }

    private Chord(Chord other) {
        super(other);
    }

    @Override
    public Chord copyAttributes() {
        return new Chord(this);
    }

    @Override
    protected boolean isSupportedChild(Node child) {
        return child.is(NodeKind.NOTE);
    }
}
