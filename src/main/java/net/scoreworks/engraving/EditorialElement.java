/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

import net.scoreworks.engraving.functors.ConstFunctor;
import net.scoreworks.engraving.functors.FunctorCode;
import net.scoreworks.engraving.functors.MutableFunctor;

/**
 * Editorial markup (sic, corr, app, ...). The engine only needs to know where it may appear, the kind of markup is kept
 * as type
 */
public class EditorialElement extends Node {
    private final String type;

    public EditorialElement(String type) {
        super(NodeKind.EDITORIAL);
        this.type = type;
    }

    private EditorialElement(EditorialElement other) {
        super(other);
        this.type = other.type;
    }

    @Override
    public EditorialElement copyAttributes() {
        return new EditorialElement(this);
    }

    @Override
    protected boolean isSupportedChild(Node child) {
        NodeKind kind = child.getKind();
        return kind == NodeKind.STAFF || kind == NodeKind.LAYER || kind.isLayerElement() || kind.isControlElement()
                || kind == NodeKind.EDITORIAL;
    }

    public String getType() {
        return type;
    }

    @Override
    protected FunctorCode accept(MutableFunctor functor) {
        return functor.visitEditorialElement(this);
    }
    @Override
    protected FunctorCode acceptEnd(MutableFunctor functor) {
        return functor.visitEditorialElementEnd(this);
    }
    @Override
    protected FunctorCode accept(ConstFunctor functor) {
        return functor.visitEditorialElement(this);
    }
    @Override
    protected FunctorCode acceptEnd(ConstFunctor functor) {
        return functor.visitEditorialElementEnd(this);
    }
}
