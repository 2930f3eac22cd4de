/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

import net.scoreworks.engraving.functors.ConstFunctor;
import net.scoreworks.engraving.functors.FunctorCode;
import net.scoreworks.engraving.functors.MutableFunctor;

/**
 * One verse of lyrics attached to a note
 */
public class Verse extends Node {
    private final int n;

    public Verse(int n) {
        super(NodeKind.VERSE);
        this.n = n;
    }

    private Verse(Verse other) {
        super(other);
        this.n = other.n;
    }

    @Override
    public Verse copyAttributes() {
        return new Verse(this);
    }

    @Override
    protected boolean isSupportedChild(Node child) {
        return child.is(NodeKind.SYL);
    }

    public int getN() {
        return n;
    }

    @Override
    protected FunctorCode accept(MutableFunctor functor) {
        return functor.visitVerse(this);
    }
    @Override
    protected FunctorCode acceptEnd(MutableFunctor functor) {
        return functor.visitVerseEnd(this);
    }
    @Override
    protected FunctorCode accept(ConstFunctor functor) {
        return functor.visitVerse(this);
    }
    @Override
    protected FunctorCode acceptEnd(ConstFunctor functor) {
        return functor.visitVerseEnd(this);
    }
}
