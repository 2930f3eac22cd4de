/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

public interface MeasureView extends NodeView {

    boolean isMeasured();

    int getDrawingX();

    int getWidth();
}
