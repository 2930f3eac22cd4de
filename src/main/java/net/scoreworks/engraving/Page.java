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

public class Page extends Node {

    public Page() {
        super(NodeKind.PAGE);
    }

    private Page(Page other) {
        super(other);
    }

    @Override
    public Page copyAttributes() {
        return new Page(this);
    }

    @Override
    protected boolean isSupportedChild(Node child) {
        return child.is(NodeKind.SYSTEM);
    }

    public List<StaffSystem> getSystems() {
        List<StaffSystem> systems = new ArrayList<>();
        for (Node child : getChildren(NodeKind.SYSTEM)) {
            systems.add(child.asSystem());
        }
        return systems;
    }

    @Override
    protected FunctorCode accept(MutableFunctor functor) {
        return functor.visitPage(this);
    }
    @Override
    protected FunctorCode acceptEnd(MutableFunctor functor) {
        return functor.visitPageEnd(this);
    }
    @Override
    protected FunctorCode accept(ConstFunctor functor) {
        return functor.visitPage(this);
    }
    @Override
    protected FunctorCode acceptEnd(ConstFunctor functor) {
        return functor.visitPageEnd(this);
    }
}
