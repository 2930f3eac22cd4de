/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving.functors;

import net.scoreworks.engraving.Layer;
import net.scoreworks.engraving.LayerElement;
import net.scoreworks.engraving.Staff;

/**
 * Clear the drawing data computed from the content: time spanning elements of the staves, ledger lines, stem
 * directions and cross-staff references. Has to run before the passes filling them in again.
 */
public class ResetDataFunctor extends MutableFunctor {

    public ResetDataFunctor(PassContext context) {
        super(context);
    }

    @Override
    public FunctorCode visitStaff(Staff staff) {
        staff.clearTimeSpanningElements();
        staff.clearLedgerLines();
        return FunctorCode.CONTINUE;
    }

    @Override
    public FunctorCode visitLayer(Layer layer) {
        layer.resetDrawingData();
        return FunctorCode.CONTINUE;
    }

    @Override
    public FunctorCode visitLayerElement(LayerElement element) {
        element.setCrossStaff(null);
        return FunctorCode.CONTINUE;
    }
}
