/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

import net.scoreworks.engraving.functors.ConstFunctor;
import net.scoreworks.engraving.functors.FunctorCode;
import net.scoreworks.engraving.functors.MutableFunctor;

/**
 * Table of the staff definitions in effect, looked up by staff number
 */
public class ScoreDef extends Node {

    public ScoreDef() {
        super(NodeKind.SCORE_DEF);
    }

    private ScoreDef(ScoreDef other) {
        super(other);
    }

    @Override
    public ScoreDef copyAttributes() {
        return new ScoreDef(this);
    }

    @Override
    protected boolean isSupportedChild(Node child) {
        return child.is(NodeKind.STAFF_DEF);
    }

    /**
     * @return the staff definition with number n or null if there is none
     */
    public StaffDef getStaffDef(int n) {
        for (Node child : getChildren()) {
            StaffDef staffDef = child.asStaffDef();
            if (staffDef.getN() == n)
                return staffDef;
        }
        return null;
    }

    @Override
    protected FunctorCode accept(MutableFunctor functor) {
        return functor.visitScoreDef(this);
    }
    @Override
    protected FunctorCode acceptEnd(MutableFunctor functor) {
        return functor.visitScoreDefEnd(this);
    }
    @Override
    protected FunctorCode accept(ConstFunctor functor) {
        return functor.visitScoreDef(this);
    }
    @Override
    protected FunctorCode acceptEnd(ConstFunctor functor) {
        return functor.visitScoreDefEnd(this);
    }
}
