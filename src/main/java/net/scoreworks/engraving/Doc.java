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
 * Root of the document tree. Holds the layout options and keeps track of which layout passes have run, so passes
 * depending on earlier ones can check their preconditions.
 */
public class Doc extends Node {
    private DocType type = DocType.RAW;
    private final LayoutOptions options;

    private transient boolean layoutStarted;
    private transient boolean horizontallyAligned;
    private transient boolean verticallyAligned;

    public Doc() {
        this(new LayoutOptions());
    }

    public Doc(LayoutOptions options) {
        super(NodeKind.DOC);
        this.options = options;
    }

    private Doc(Doc other) {
        super(other);
        this.type = other.type;
        this.options = other.options;
    }

    @Override
    public Doc copyAttributes() {
        return new Doc(this);
    }

    @Override
    protected boolean isSupportedChild(Node child) {
        return child.is(NodeKind.PAGE);
    }

    public DocType getType() {
        return type;
    }

    public void setType(DocType type) {
        this.type = type;
    }

    public LayoutOptions getOptions() {
        return options;
    }

    /**
     * @return size of a drawing unit in pixels for a staff of the given size in percent
     */
    public int getDrawingUnit(int staffSize) {
        return options.getUnit() * staffSize / 100;
    }

    public List<Page> getPages() {
        List<Page> pages = new ArrayList<>();
        for (Node child : getChildren(NodeKind.PAGE)) {
            pages.add(child.asPage());
        }
        return pages;
    }

    public boolean isLayoutStarted() {
        return layoutStarted;
    }

    public void markLayoutStarted() {
        layoutStarted = true;
    }

    public boolean isHorizontallyAligned() {
        return horizontallyAligned;
    }

    public void setHorizontallyAligned(boolean horizontallyAligned) {
        this.horizontallyAligned = horizontallyAligned;
    }

    public boolean isVerticallyAligned() {
        return verticallyAligned;
    }

    public void setVerticallyAligned(boolean verticallyAligned) {
        this.verticallyAligned = verticallyAligned;
    }

    @Override
    protected FunctorCode accept(MutableFunctor functor) {
        return functor.visitDoc(this);
    }
    @Override
    protected FunctorCode acceptEnd(MutableFunctor functor) {
        return functor.visitDocEnd(this);
    }
    @Override
    protected FunctorCode accept(ConstFunctor functor) {
        return functor.visitDoc(this);
    }
    @Override
    protected FunctorCode acceptEnd(ConstFunctor functor) {
        return functor.visitDocEnd(this);
    }
}
