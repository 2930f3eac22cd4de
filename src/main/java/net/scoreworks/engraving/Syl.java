/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

import net.scoreworks.engraving.functors.ConstFunctor;
import net.scoreworks.engraving.functors.FunctorCode;
import net.scoreworks.engraving.functors.MutableFunctor;

/**
 * A syllable of a verse. A syllable whose extender runs to a later note carries {@link Capability#TIME_SPANNING}
 */
public class Syl extends Node {
    private final String text;
    /** null if the syllable is a word of its own */
    private WordPosition wordPos;

    public Syl(String text) {
        super(NodeKind.SYL);
        this.text = text;
    }

    private Syl(Syl other) {
        super(other);
        this.text = other.text;
        this.wordPos = other.wordPos;
    }

    @Override
    public Syl copyAttributes() {
        return new Syl(this);
    }

    public String getText() {
        return text;
    }

    public WordPosition getWordPos() {
        return wordPos;
    }

    public void setWordPos(WordPosition wordPos) {
        this.wordPos = wordPos;
    }

    /**
     * @return true if a dash connects the syllable to the next one of its word
     */
    public boolean isConnected() {
        return wordPos == WordPosition.INITIAL || wordPos == WordPosition.MEDIAL;
    }

    /**
     * @return the verse the syllable belongs to or null
     */
    public Verse getVerse() {
        Node verse = getFirstAncestor(NodeKind.VERSE);
        return verse == null ? null : verse.asVerse();
    }

    @Override
    protected FunctorCode accept(MutableFunctor functor) {
        return functor.visitSyl(this);
    }
    @Override
    protected FunctorCode acceptEnd(MutableFunctor functor) {
        return functor.visitSylEnd(this);
    }
    @Override
    protected FunctorCode accept(ConstFunctor functor) {
        return functor.visitSyl(this);
    }
    @Override
    protected FunctorCode acceptEnd(ConstFunctor functor) {
        return functor.visitSylEnd(this);
    }
}
