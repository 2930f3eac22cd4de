/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving.functors;

import net.scoreworks.engraving.*;

import java.util.Iterator;

/**
 * Carry time spanning elements across measure boundaries. Elements spanning several measures are collected when the
 * traversal meets them. Every staff of a following measure then receives the running elements that apply to its
 * number. Elements starting in the measure of the staff are skipped, they are found by descending into the measure.
 */
public class PrepareTimeSpanningFunctor extends MutableFunctor {

    public PrepareTimeSpanningFunctor(PassContext context) {
        super(context);
    }

    @Override
    public FunctorCode visitNode(Node node) {
        if (node.hasCapability(Capability.TIME_SPANNING)) {
            TimeSpan span = node.getCapabilityData(Capability.TIME_SPANNING);
            if (span.isSpanningMeasures())
                context.getTimeSpanningElements().add(node);
        }
        return FunctorCode.CONTINUE;
    }

    @Override
    public FunctorCode visitMeasure(Measure measure) {
        context.setCurrentMeasure(measure);
        return FunctorCode.CONTINUE;
    }

    @Override
    public FunctorCode visitStaff(Staff staff) {
        Measure currentMeasure = context.getCurrentMeasure();
        for (Node element : context.getTimeSpanningElements()) {
            TimeSpan span = element.getCapabilityData(Capability.TIME_SPANNING);
            //make sure we are in a following measure and not on another staff of the start measure
            if (span.getStartMeasure() != currentMeasure && span.isOnStaff(staff.getN()))
                staff.addTimeSpanningElement(element);
        }
        return FunctorCode.CONTINUE;
    }

    @Override
    public FunctorCode visitMeasureEnd(Measure measure) {
        Iterator<Node> iterator = context.getTimeSpanningElements().iterator();
        while (iterator.hasNext()) {
            TimeSpan span = iterator.next().getCapabilityData(Capability.TIME_SPANNING);
            if (span.getEndMeasure() == measure)
                iterator.remove();
        }
        return FunctorCode.CONTINUE;
    }
}
