/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

public interface LayerView extends NodeView {

    int getN();

    StemDirection getDrawingStemDir();

    boolean isCrossStaffFromAbove();

    boolean isCrossStaffFromBelow();
}
