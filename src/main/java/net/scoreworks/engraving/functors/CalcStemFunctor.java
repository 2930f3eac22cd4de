/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving.functors;

import net.scoreworks.engraving.Layer;
import net.scoreworks.engraving.Staff;
import net.scoreworks.engraving.StemDirection;

import java.util.ArrayList;
import java.util.List;

/**
 * Decide the stem direction of the layers of each staff. A single layer only gets a direction when it receives
 * cross-staff content. With several layers, odd layers point up and even layers point down, ignoring empty layers.
 * Two layers of which one is empty stay unset.
 */
public class CalcStemFunctor extends MutableFunctor {

    public CalcStemFunctor(PassContext context) {
        super(context);
    }

    @Override
    public FunctorCode visitStaff(Staff staff) {
        List<Layer> layers = staff.getLayers();
        if (layers.isEmpty())
            return FunctorCode.SKIP_CHILDREN;

        if (layers.size() == 1) {
            Layer layer = layers.get(0);
            if (layer.isCrossStaffFromBelow())
                layer.setDrawingStemDir(StemDirection.UP);
            else if (layer.isCrossStaffFromAbove())
                layer.setDrawingStemDir(StemDirection.DOWN);
            return FunctorCode.SKIP_CHILDREN;
        }

        List<Layer> emptyLayers = new ArrayList<>();
        for (Layer layer : layers) {
            if (layer.isEmpty())
                emptyLayers.add(layer);
        }
        if (layers.size() < 3 && !emptyLayers.isEmpty())
            return FunctorCode.SKIP_CHILDREN;

        layers.removeAll(emptyLayers);
        for (Layer layer : layers) {
            layer.setDrawingStemDir(layer.getN() % 2 != 0 ? StemDirection.UP : StemDirection.DOWN);
        }
        return FunctorCode.SKIP_CHILDREN;
    }
}
