/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

/**
 * A slur runs from one element to another one, possibly across measures and staves
 */
public class Slur extends ControlElement {

    public Slur(TimeSpan span) {
        super(NodeKind.SLUR);
        enableCapability(Capability.TIME_POINT, span);
        enableCapability(Capability.TIME_SPANNING, span);
    }

    private Slur(Slur other) {
        super(other);
    }

    @Override
    public Slur copyAttributes() {
        return new Slur(this);
    }

    public TimeSpan getSpan() {
        return getCapabilityData(Capability.TIME_SPANNING);
    }
}
