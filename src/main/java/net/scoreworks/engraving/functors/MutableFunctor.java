/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving.functors;

import net.scoreworks.engraving.*;

/**
 * Base class for traversals that may change the document tree or the drawing data stored on it. Every kind group has
 * an entry and an end handler, defaulting to {@link #visitNode(Node)} and {@link #visitNodeEnd(Node)}, which continue.
 * Start a traversal with {@link Node#process(MutableFunctor)}.
 */
public abstract class MutableFunctor {
    protected final PassContext context;

    protected MutableFunctor(PassContext context) {
        this.context = context;
    }

    public PassContext getContext() {
        return context;
    }

    public FunctorCode visitNode(Node node) {
        return FunctorCode.CONTINUE;
    }
    public FunctorCode visitNodeEnd(Node node) {
        return FunctorCode.CONTINUE;
    }

    public FunctorCode visitDoc(Doc doc) {
        return visitNode(doc);
    }
    public FunctorCode visitDocEnd(Doc doc) {
        return visitNodeEnd(doc);
    }

    public FunctorCode visitPage(Page page) {
        return visitNode(page);
    }
    public FunctorCode visitPageEnd(Page page) {
        return visitNodeEnd(page);
    }

    public FunctorCode visitSystem(StaffSystem system) {
        return visitNode(system);
    }
    public FunctorCode visitSystemEnd(StaffSystem system) {
        return visitNodeEnd(system);
    }

    public FunctorCode visitScoreDef(ScoreDef scoreDef) {
        return visitNode(scoreDef);
    }
    public FunctorCode visitScoreDefEnd(ScoreDef scoreDef) {
        return visitNodeEnd(scoreDef);
    }

    public FunctorCode visitStaffDef(StaffDef staffDef) {
        return visitNode(staffDef);
    }
    public FunctorCode visitStaffDefEnd(StaffDef staffDef) {
        return visitNodeEnd(staffDef);
    }

    public FunctorCode visitMeasure(Measure measure) {
        return visitNode(measure);
    }
    public FunctorCode visitMeasureEnd(Measure measure) {
        return visitNodeEnd(measure);
    }

    public FunctorCode visitStaff(Staff staff) {
        return visitNode(staff);
    }
    public FunctorCode visitStaffEnd(Staff staff) {
        return visitNodeEnd(staff);
    }

    public FunctorCode visitLayer(Layer layer) {
        return visitNode(layer);
    }
    public FunctorCode visitLayerEnd(Layer layer) {
        return visitNodeEnd(layer);
    }

    public FunctorCode visitLayerElement(LayerElement element) {
        return visitNode(element);
    }
    public FunctorCode visitLayerElementEnd(LayerElement element) {
        return visitNodeEnd(element);
    }

    public FunctorCode visitVerse(Verse verse) {
        return visitNode(verse);
    }
    public FunctorCode visitVerseEnd(Verse verse) {
        return visitNodeEnd(verse);
    }

    public FunctorCode visitSyl(Syl syl) {
        return visitNode(syl);
    }
    public FunctorCode visitSylEnd(Syl syl) {
        return visitNodeEnd(syl);
    }

    public FunctorCode visitControlElement(ControlElement element) {
        return visitNode(element);
    }
    public FunctorCode visitControlElementEnd(ControlElement element) {
        return visitNodeEnd(element);
    }

    public FunctorCode visitEditorialElement(EditorialElement element) {
        return visitNode(element);
    }
    public FunctorCode visitEditorialElementEnd(EditorialElement element) {
        return visitNodeEnd(element);
    }
}
