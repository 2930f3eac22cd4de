/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving.functors;

import net.scoreworks.engraving.*;
import net.scoreworks.engraving.exceptions.ContractViolationException;

/**
 * Stack the systems of each page from the top margin downwards, using the heights found by the vertical alignment.
 * Y grows upwards, so a page starts at its height minus the top margin.
 */
public class AlignSystemsFunctor extends MutableFunctor {

    public AlignSystemsFunctor(PassContext context) {
        super(context);
    }

    @Override
    public FunctorCode visitDoc(Doc doc) {
        if (!doc.isVerticallyAligned())
            throw new ContractViolationException("Systems of " + doc + " can't be placed before the vertical alignment");
        return FunctorCode.CONTINUE;
    }

    @Override
    public FunctorCode visitPage(Page page) {
        LayoutOptions options = context.getOptions();
        context.setPageY(options.getPageHeight() - options.getPageMarginTop());
        return FunctorCode.CONTINUE;
    }

    @Override
    public FunctorCode visitSystem(StaffSystem system) {
        LayoutOptions options = context.getOptions();
        int y = context.getPageY();
        system.setDrawingY(y);
        int height = system.getAligner() == null ? 0 : system.getAligner().getTotalHeight();
        context.setPageY(y - height - options.getSpacingSystem() * options.getUnit());
        return FunctorCode.SKIP_CHILDREN;
    }
}
