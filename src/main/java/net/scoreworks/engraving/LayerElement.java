/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

import net.scoreworks.engraving.functors.ConstFunctor;
import net.scoreworks.engraving.functors.FunctorCode;
import net.scoreworks.engraving.functors.MutableFunctor;
import org.apache.commons.lang3.Validate;
import org.apache.commons.lang3.math.Fraction;

/**
 * Base class of everything that is content of a {@link Layer}. Durations are given in whole notes. Onset and
 * drawing X are assigned by the horizontal alignment.
 */
public abstract class LayerElement extends Node implements LayerElementView {
    private Fraction duration = Fraction.ZERO;
    private boolean cue;
    /** number of the staff the element is drawn on, null if it is drawn on its own staff */
    private Integer crossStaffN;

    private transient Fraction onset;
    private transient int drawingX;
    private transient Staff crossStaff;

    protected LayerElement(NodeKind kind) {
        super(kind);
    }

    protected LayerElement(LayerElement other) {
        super(other);
        this.duration = other.duration;
        this.cue = other.cue;
        this.crossStaffN = other.crossStaffN;
    }

    @Override
    public Fraction getDuration() {
        return duration;
    }

    public void setDuration(Fraction duration) {
        Validate.notNull(duration, "duration must not be null");
        Validate.isTrue(duration.compareTo(Fraction.ZERO) >= 0, "duration must not be negative");
        this.duration = duration;
    }

    @Override
    public boolean isCue() {
        return cue;
    }

    public void setCue(boolean cue) {
        this.cue = cue;
    }

    public Integer getCrossStaffN() {
        return crossStaffN;
    }

    public void setCrossStaffN(Integer crossStaffN) {
        this.crossStaffN = crossStaffN;
    }

    /**
     * @return the staff the element is drawn on when it is cross-staff, as resolved by the last preparation
     */
    public Staff getCrossStaff() {
        return crossStaff;
    }

    public void setCrossStaff(Staff crossStaff) {
        this.crossStaff = crossStaff;
    }

    @Override
    public Fraction getOnset() {
        return onset;
    }

    public void setOnset(Fraction onset) {
        this.onset = onset;
    }

    @Override
    public int getDrawingX() {
        return drawingX;
    }

    public void setDrawingX(int drawingX) {
        this.drawingX = drawingX;
    }

    /**
     * @return true if the element is part of a chord and takes its time position from it
     */
    public boolean isInChord() {
        return getParent() != null && getParent().is(NodeKind.CHORD);
    }

    @Override
    protected FunctorCode accept(MutableFunctor functor) {
        return functor.visitLayerElement(this);
    }
    @Override
    protected FunctorCode acceptEnd(MutableFunctor functor) {
        return functor.visitLayerElementEnd(this);
    }
    @Override
    protected FunctorCode accept(ConstFunctor functor) {
        return functor.visitLayerElement(this);
    }
    @Override
    protected FunctorCode acceptEnd(ConstFunctor functor) {
        return functor.visitLayerElementEnd(this);
    }
}
