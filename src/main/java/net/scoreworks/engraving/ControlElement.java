/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

import net.scoreworks.engraving.functors.ConstFunctor;
import net.scoreworks.engraving.functors.FunctorCode;
import net.scoreworks.engraving.functors.MutableFunctor;

/**
 * Base class of elements placed in a {@link Measure} after its staves and attached to layer elements through their
 * capabilities
 */
public abstract class ControlElement extends Node {

    protected ControlElement(NodeKind kind) {
        super(kind);
    }

    protected ControlElement(ControlElement other) {
        super(other);
    }

    @Override
    protected FunctorCode accept(MutableFunctor functor) {
        return functor.visitControlElement(this);
    }
    @Override
    protected FunctorCode acceptEnd(MutableFunctor functor) {
        return functor.visitControlElementEnd(this);
    }
    @Override
    protected FunctorCode accept(ConstFunctor functor) {
        return functor.visitControlElement(this);
    }
    @Override
    protected FunctorCode acceptEnd(ConstFunctor functor) {
        return functor.visitControlElementEnd(this);
    }
}
