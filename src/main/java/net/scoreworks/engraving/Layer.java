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
 * One voice of a staff. The drawing stem direction and the cross-staff flags are set by the layout passes and
 * cleared by the reset of drawing data
 */
public class Layer extends Node implements LayerView {
    /** null until numbered explicitly or by the staff it gets added to */
    private Integer n;

    private transient StemDirection drawingStemDir = StemDirection.NONE;
    private transient boolean crossStaffFromAbove;
    private transient boolean crossStaffFromBelow;

    public Layer() {
        super(NodeKind.LAYER);
    }

    public Layer(int n) {
        this();
        this.n = n;
    }

    private Layer(Layer other) {
        super(other);
        this.n = other.n;
    }

    @Override
    public Layer copyAttributes() {
        return new Layer(this);
    }

    @Override
    protected boolean isSupportedChild(Node child) {
        return child.getKind().isLayerElement() || child.is(NodeKind.EDITORIAL);
    }

    public boolean hasN() {
        return n != null;
    }

    /**
     * @return the layer number, 0 if not numbered
     */
    @Override
    public int getN() {
        return n == null ? 0 : n;
    }

    public void setN(int n) {
        this.n = n;
    }

    /**
     * @return true if the layer has no content at all
     */
    public boolean isEmpty() {
        return getChildCount() == 0;
    }

    public List<LayerElement> getElements() {
        List<LayerElement> elements = new ArrayList<>();
        for (Node child : getChildren()) {
            if (child.getKind().isLayerElement())
                elements.add(child.asLayerElement());
        }
        return elements;
    }

    @Override
    public StemDirection getDrawingStemDir() {
        return drawingStemDir;
    }

    public void setDrawingStemDir(StemDirection drawingStemDir) {
        this.drawingStemDir = drawingStemDir;
    }

    /**
     * @return true if content of the staff above is drawn in this layer
     */
    @Override
    public boolean isCrossStaffFromAbove() {
        return crossStaffFromAbove;
    }

    public void setCrossStaffFromAbove(boolean crossStaffFromAbove) {
        this.crossStaffFromAbove = crossStaffFromAbove;
    }

    /**
     * @return true if content of the staff below is drawn in this layer
     */
    @Override
    public boolean isCrossStaffFromBelow() {
        return crossStaffFromBelow;
    }

    public void setCrossStaffFromBelow(boolean crossStaffFromBelow) {
        this.crossStaffFromBelow = crossStaffFromBelow;
    }

    public void resetDrawingData() {
        drawingStemDir = StemDirection.NONE;
        crossStaffFromAbove = false;
        crossStaffFromBelow = false;
    }

    @Override
    protected FunctorCode accept(MutableFunctor functor) {
        return functor.visitLayer(this);
    }
    @Override
    protected FunctorCode acceptEnd(MutableFunctor functor) {
        return functor.visitLayerEnd(this);
    }
    @Override
    protected FunctorCode accept(ConstFunctor functor) {
        return functor.visitLayer(this);
    }
    @Override
    protected FunctorCode acceptEnd(ConstFunctor functor) {
        return functor.visitLayerEnd(this);
    }
}
