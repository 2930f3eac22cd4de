/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

import org.apache.commons.lang3.math.Fraction;

public interface LayerElementView extends NodeView {

    Fraction getDuration();

    /**
     * @return the time position within the measure, null before horizontal alignment
     */
    Fraction getOnset();

    int getDrawingX();

    boolean isCue();
}
