/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving.functors;

import net.scoreworks.engraving.*;
import net.scoreworks.engraving.exceptions.ContractViolationException;
import org.apache.commons.lang3.math.Fraction;

/**
 * Compute onsets and horizontal positions. Each layer element is placed at its onset within the measure, scaled by
 * the space of a whole note, and measures follow each other within their system. The staves also take their drawing
 * definition (notation type, lines, size) from the score definition of their system here.
 */
public class AlignHorizontallyFunctor extends MutableFunctor {

    public AlignHorizontallyFunctor(PassContext context) {
        super(context);
    }

    @Override
    public FunctorCode visitDoc(Doc doc) {
        doc.markLayoutStarted();
        doc.setHorizontallyAligned(false);
        return FunctorCode.CONTINUE;
    }

    @Override
    public FunctorCode visitSystem(StaffSystem system) {
        if (system.getScoreDef() == null)
            throw new ContractViolationException(system + " has no score definition");
        context.setCurrentSystem(system);
        context.setSystemX(0);
        return FunctorCode.CONTINUE;
    }

    @Override
    public FunctorCode visitScoreDef(ScoreDef scoreDef) {
        return FunctorCode.SKIP_CHILDREN;
    }

    @Override
    public FunctorCode visitMeasure(Measure measure) {
        context.setCurrentMeasure(measure);
        measure.setDrawingX(context.getSystemX());
        context.setMeasureDuration(Fraction.ZERO);
        return FunctorCode.CONTINUE;
    }

    @Override
    public FunctorCode visitStaff(Staff staff) {
        StaffDef staffDef = context.getCurrentSystem().getScoreDef().getStaffDef(staff.getN());
        if (staffDef == null)
            throw new ContractViolationException("No staff definition for " + staff + " with n=" + staff.getN());
        NotationType type = staffDef.hasNotationType() ? staffDef.getNotationType() : NotationType.CMN;
        context.setNotationType(type);
        context.setCurrentStaff(staff);
        staff.setDrawingStaffDef(staffDef);
        staff.setDrawingNotationType(type);
        staff.setDrawingLines(staffDef.getLines());
        staff.setDrawingStaffSize(staffDef.getScale());
        staff.adjustDrawingStaffSize();
        return FunctorCode.CONTINUE;
    }

    @Override
    public FunctorCode visitLayer(Layer layer) {
        context.setLayerTime(Fraction.ZERO);
        return FunctorCode.CONTINUE;
    }

    @Override
    public FunctorCode visitLayerElement(LayerElement element) {
        if (element.isInChord()) {
            //notes of a chord sound together with it
            LayerElement chord = element.getParent().asLayerElement();
            element.setOnset(chord.getOnset());
            element.setDrawingX(chord.getDrawingX());
            return FunctorCode.CONTINUE;
        }
        Fraction onset = context.getLayerTime();
        element.setOnset(onset);
        element.setDrawingX(getDrawingX(onset));
        context.setLayerTime(onset.add(element.getDuration()));
        return FunctorCode.CONTINUE;
    }

    @Override
    public FunctorCode visitLayerEnd(Layer layer) {
        if (context.getLayerTime().compareTo(context.getMeasureDuration()) > 0)
            context.setMeasureDuration(context.getLayerTime());
        return FunctorCode.CONTINUE;
    }

    @Override
    public FunctorCode visitMeasureEnd(Measure measure) {
        LayoutOptions options = context.getOptions();
        int margin = options.getMeasureLeftMargin() * options.getUnit();
        int width = 2 * margin + toPixels(context.getMeasureDuration());
        measure.setWidth(width);
        context.setSystemX(context.getSystemX() + width);
        return FunctorCode.CONTINUE;
    }

    @Override
    public FunctorCode visitDocEnd(Doc doc) {
        doc.setHorizontallyAligned(true);
        return FunctorCode.CONTINUE;
    }

    private int getDrawingX(Fraction onset) {
        LayoutOptions options = context.getOptions();
        return context.getCurrentMeasure().getDrawingX() + options.getMeasureLeftMargin() * options.getUnit()
                + toPixels(onset);
    }

    private int toPixels(Fraction duration) {
        LayoutOptions options = context.getOptions();
        return (int) Math.round(duration.doubleValue() * options.getWholeNoteSpacing() * options.getUnit());
    }
}
