/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

/**
 * Clef change within a layer, in effect for the following notes of the layer
 */
public class Clef extends LayerElement {
    private final ClefShape shape;
    private final int line;

    public Clef(ClefShape shape, int line) {
        super(NodeKind.CLEF);
        this.shape = shape;
        this.line = line;
    }

    private Clef(Clef other) {
        super(other);
        this.shape = other.shape;
        this.line = other.line;
    }

    @Override
    public Clef copyAttributes() {
        return new Clef(this);
    }

    public ClefShape getShape() {
        return shape;
    }

    public int getLine() {
        return line;
    }
}
