/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

import net.scoreworks.engraving.functors.ConstFunctor;
import net.scoreworks.engraving.functors.FunctorCode;
import net.scoreworks.engraving.functors.MutableFunctor;

/**
 * Definition of the staves with number n: line count, notation type, size and the initial clef
 */
public class StaffDef extends Node {
    private final int n;
    private int lines = 5;
    /** null if not given, common notation is assumed then */
    private NotationType notationType;
    private int scale = 100;
    private ClefShape clefShape = ClefShape.G;
    private int clefLine = 2;
    private String type;

    /**
     * Staves can be hidden for the drawing only, e.g. when empty staves are not shown
     */
    private boolean drawingVisible = true;

    public StaffDef(int n) {
        super(NodeKind.STAFF_DEF);
        this.n = n;
    }

    private StaffDef(StaffDef other) {
        super(other);
        this.n = other.n;
        this.lines = other.lines;
        this.notationType = other.notationType;
        this.scale = other.scale;
        this.clefShape = other.clefShape;
        this.clefLine = other.clefLine;
        this.type = other.type;
        this.drawingVisible = other.drawingVisible;
    }

    @Override
    public StaffDef copyAttributes() {
        return new StaffDef(this);
    }

    public int getN() {
        return n;
    }

    public int getLines() {
        return lines;
    }

    public void setLines(int lines) {
        this.lines = lines;
    }

    public boolean hasNotationType() {
        return notationType != null;
    }

    public NotationType getNotationType() {
        return notationType;
    }

    public void setNotationType(NotationType notationType) {
        this.notationType = notationType;
    }

    public int getScale() {
        return scale;
    }

    public void setScale(int scale) {
        this.scale = scale;
    }

    public ClefShape getClefShape() {
        return clefShape;
    }

    public int getClefLine() {
        return clefLine;
    }

    public void setClef(ClefShape shape, int line) {
        this.clefShape = shape;
        this.clefLine = line;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public boolean isDrawingVisible() {
        return drawingVisible;
    }

    public void setDrawingVisible(boolean drawingVisible) {
        this.drawingVisible = drawingVisible;
    }

    @Override
    protected FunctorCode accept(MutableFunctor functor) {
        return functor.visitStaffDef(this);
    }
    @Override
    protected FunctorCode acceptEnd(MutableFunctor functor) {
        return functor.visitStaffDefEnd(this);
    }
    @Override
    protected FunctorCode accept(ConstFunctor functor) {
        return functor.visitStaffDef(this);
    }
    @Override
    protected FunctorCode acceptEnd(ConstFunctor functor) {
        return functor.visitStaffDefEnd(this);
    }
}
