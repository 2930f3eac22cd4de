/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

import net.scoreworks.engraving.exceptions.ContractViolationException;
import net.scoreworks.engraving.functors.ConstFunctor;
import net.scoreworks.engraving.functors.FunctorCode;
import net.scoreworks.engraving.functors.MutableFunctor;

import java.util.ArrayList;
import java.util.List;

/**
 * A measure holds one staff per staff number, followed by its control elements. Unmeasured measures hold
 * continuous content, e.g. mensural music, which is split into segments by cast-off.
 */
public class Measure extends Node implements MeasureView {
    private final boolean measured;
    private String n;

    private transient int drawingX;
    private transient int width;

    public Measure() {
        this(true);
    }

    public Measure(boolean measured) {
        super(NodeKind.MEASURE);
        this.measured = measured;
    }

    private Measure(Measure other) {
        super(other);
        this.measured = other.measured;
        this.n = other.n;
    }

    @Override
    public Measure copyAttributes() {
        return new Measure(this);
    }

    @Override
    protected boolean isSupportedChild(Node child) {
        if (child.is(NodeKind.STAFF)) {
            int n = child.asStaff().getN();
            if (getStaff(n) != null)
                throw new ContractViolationException(this + " already has a staff with n=" + n);
            return true;
        }
        return child.getKind().isControlElement() || child.is(NodeKind.EDITORIAL);
    }

    @Override
    public boolean isMeasured() {
        return measured;
    }

    public String getN() {
        return n;
    }

    public void setN(String n) {
        this.n = n;
    }

    /**
     * @return the staff with number n or null if there is none
     */
    public Staff getStaff(int n) {
        for (Node child : getChildren(NodeKind.STAFF)) {
            if (child.asStaff().getN() == n)
                return child.asStaff();
        }
        return null;
    }

    public List<Staff> getStaves() {
        List<Staff> staves = new ArrayList<>();
        for (Node child : getChildren(NodeKind.STAFF)) {
            staves.add(child.asStaff());
        }
        return staves;
    }

    @Override
    public int getDrawingX() {
        return drawingX;
    }

    public void setDrawingX(int drawingX) {
        this.drawingX = drawingX;
    }

    @Override
    public int getWidth() {
        return width;
    }

    public void setWidth(int width) {
        this.width = width;
    }

    @Override
    protected FunctorCode accept(MutableFunctor functor) {
        return functor.visitMeasure(this);
    }
    @Override
    protected FunctorCode acceptEnd(MutableFunctor functor) {
        return functor.visitMeasureEnd(this);
    }
    @Override
    protected FunctorCode accept(ConstFunctor functor) {
        return functor.visitMeasure(this);
    }
    @Override
    protected FunctorCode acceptEnd(ConstFunctor functor) {
        return functor.visitMeasureEnd(this);
    }
}
