/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving.functors;

import net.scoreworks.engraving.*;

/**
 * Base class for read-only traversals. Handlers only receive view interfaces, which expose no way to change the tree.
 * Two read-only traversals with their own {@link PassContext} may run over the same tree at the same time.
 * Start a traversal with {@link NodeView#process(ConstFunctor)}.
 */
public abstract class ConstFunctor {
    protected final PassContext context;

    protected ConstFunctor(PassContext context) {
        this.context = context;
    }

    public PassContext getContext() {
        return context;
    }

    public FunctorCode visitNode(NodeView node) {
        return FunctorCode.CONTINUE;
    }
    public FunctorCode visitNodeEnd(NodeView node) {
        return FunctorCode.CONTINUE;
    }

    public FunctorCode visitDoc(NodeView doc) {
        return visitNode(doc);
    }
    public FunctorCode visitDocEnd(NodeView doc) {
        return visitNodeEnd(doc);
    }

    public FunctorCode visitPage(NodeView page) {
        return visitNode(page);
    }
    public FunctorCode visitPageEnd(NodeView page) {
        return visitNodeEnd(page);
    }

    public FunctorCode visitSystem(SystemView system) {
        return visitNode(system);
    }
    public FunctorCode visitSystemEnd(SystemView system) {
        return visitNodeEnd(system);
    }

    public FunctorCode visitScoreDef(NodeView scoreDef) {
        return visitNode(scoreDef);
    }
    public FunctorCode visitScoreDefEnd(NodeView scoreDef) {
        return visitNodeEnd(scoreDef);
    }

    public FunctorCode visitStaffDef(NodeView staffDef) {
        return visitNode(staffDef);
    }
    public FunctorCode visitStaffDefEnd(NodeView staffDef) {
        return visitNodeEnd(staffDef);
    }

    public FunctorCode visitMeasure(MeasureView measure) {
        return visitNode(measure);
    }
    public FunctorCode visitMeasureEnd(MeasureView measure) {
        return visitNodeEnd(measure);
    }

    public FunctorCode visitStaff(StaffView staff) {
        return visitNode(staff);
    }
    public FunctorCode visitStaffEnd(StaffView staff) {
        return visitNodeEnd(staff);
    }

    public FunctorCode visitLayer(LayerView layer) {
        return visitNode(layer);
    }
    public FunctorCode visitLayerEnd(LayerView layer) {
        return visitNodeEnd(layer);
    }

    public FunctorCode visitLayerElement(LayerElementView element) {
        return visitNode(element);
    }
    public FunctorCode visitLayerElementEnd(LayerElementView element) {
        return visitNodeEnd(element);
    }

    public FunctorCode visitVerse(NodeView verse) {
        return visitNode(verse);
    }
    public FunctorCode visitVerseEnd(NodeView verse) {
        return visitNodeEnd(verse);
    }

    public FunctorCode visitSyl(NodeView syl) {
        return visitNode(syl);
    }
    public FunctorCode visitSylEnd(NodeView syl) {
        return visitNodeEnd(syl);
    }

    public FunctorCode visitControlElement(NodeView element) {
        return visitNode(element);
    }
    public FunctorCode visitControlElementEnd(NodeView element) {
        return visitNodeEnd(element);
    }

    public FunctorCode visitEditorialElement(NodeView element) {
        return visitNode(element);
    }
    public FunctorCode visitEditorialElementEnd(NodeView element) {
        return visitNodeEnd(element);
    }
}
