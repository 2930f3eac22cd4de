/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

public class Rest extends LayerElement {

    public Rest() {
        super(NodeKind.REST);
    }

    private Rest(Rest other) {
        super(other);
    }

    @Override
    public Rest copyAttributes() {
        return new Rest(this);
    }
}
