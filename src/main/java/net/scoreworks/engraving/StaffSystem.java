/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

import net.scoreworks.engraving.functors.ConstFunctor;
import net.scoreworks.engraving.functors.FunctorCode;
import net.scoreworks.engraving.functors.MutableFunctor;

import java.util.ArrayList;
import java.util.List;

/**
 * One system of a page. Its {@link ScoreDef} is the staff definition table in effect for all its measures, and it
 * owns the {@link SystemAligner} handing out the vertical slots of its staves.
 */
public class StaffSystem extends Node implements SystemView {
    private int drawingY;

    /**
     * Created by the first vertical alignment visiting the system, dropped by the reset of vertical alignment
     */
    private transient SystemAligner aligner;

    public StaffSystem() {
        super(NodeKind.SYSTEM);
    }

    private StaffSystem(StaffSystem other) {
        super(other);
    }

    @Override
    public StaffSystem copyAttributes() {
        return new StaffSystem(this);
    }

    @Override
    protected boolean isSupportedChild(Node child) {
        return child.is(NodeKind.SCORE_DEF) || child.is(NodeKind.MEASURE);
    }

    /**
     * @return the score definition in effect for this system, null if there is none
     */
    public ScoreDef getScoreDef() {
        for (Node child : getChildren()) {
            if (child.is(NodeKind.SCORE_DEF))
                return child.asScoreDef();
        }
        return null;
    }

    public List<Measure> getMeasures() {
        List<Measure> measures = new ArrayList<>();
        for (Node child : getChildren(NodeKind.MEASURE)) {
            measures.add(child.asMeasure());
        }
        return measures;
    }

    @Override
    public int getDrawingY() {
        return drawingY;
    }

    public void setDrawingY(int drawingY) {
        this.drawingY = drawingY;
    }

    public SystemAligner getAligner() {
        return aligner;
    }

    public SystemAligner getOrCreateAligner() {
        if (aligner == null)
            aligner = new SystemAligner(this);
        return aligner;
    }

    public void resetAligner() {
        aligner = null;
    }

    @Override
    protected FunctorCode accept(MutableFunctor functor) {
        return functor.visitSystem(this);
    }
    @Override
    protected FunctorCode acceptEnd(MutableFunctor functor) {
        return functor.visitSystemEnd(this);
    }
    @Override
    protected FunctorCode accept(ConstFunctor functor) {
        return functor.visitSystem(this);
    }
    @Override
    protected FunctorCode acceptEnd(ConstFunctor functor) {
        return functor.visitSystemEnd(this);
    }
}
