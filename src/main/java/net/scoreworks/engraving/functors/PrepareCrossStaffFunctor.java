/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving.functors;

import net.scoreworks.engraving.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolve the staff cross-staff elements are drawn on, and flag the layers receiving content from another staff.
 * Stem directions of single layers depend on these flags.
 */
public class PrepareCrossStaffFunctor extends MutableFunctor {
    private static final Logger LOG = LoggerFactory.getLogger(PrepareCrossStaffFunctor.class);

    public PrepareCrossStaffFunctor(PassContext context) {
        super(context);
    }

    @Override
    public FunctorCode visitMeasure(Measure measure) {
        context.setCurrentMeasure(measure);
        return FunctorCode.CONTINUE;
    }

    @Override
    public FunctorCode visitStaff(Staff staff) {
        context.setCurrentStaff(staff);
        return FunctorCode.CONTINUE;
    }

    @Override
    public FunctorCode visitLayer(Layer layer) {
        context.setCurrentLayer(layer);
        return FunctorCode.CONTINUE;
    }

    @Override
    public FunctorCode visitLayerElement(LayerElement element) {
        Staff staff = context.getCurrentStaff();
        Integer crossStaffN = element.getCrossStaffN();
        if (crossStaffN == null || staff == null || crossStaffN == staff.getN()) {
            element.setCrossStaff(null);
            return FunctorCode.CONTINUE;
        }
        Staff target = context.getCurrentMeasure().getStaff(crossStaffN);
        if (target == null) {
            LOG.warn("{} is drawn on staff {} which does not exist in {}, ignoring it", element, crossStaffN,
                    context.getCurrentMeasure());
            element.setCrossStaff(null);
            return FunctorCode.CONTINUE;
        }
        element.setCrossStaff(target);

        Layer targetLayer = target.getLayer(context.getCurrentLayer().getN());
        if (targetLayer == null && !target.getLayers().isEmpty())
            targetLayer = target.getLayers().get(0);
        if (targetLayer == null) {
            LOG.debug("{} has no layer to receive {}", target, element);
            return FunctorCode.CONTINUE;
        }
        //the target staff is above when its number is lower, content is then coming from below
        if (crossStaffN < staff.getN())
            targetLayer.setCrossStaffFromBelow(true);
        else
            targetLayer.setCrossStaffFromAbove(true);
        return FunctorCode.CONTINUE;
    }
}
