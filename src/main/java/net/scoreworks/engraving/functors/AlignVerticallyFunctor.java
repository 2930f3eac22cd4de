/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving.functors;

import net.scoreworks.engraving.*;
import net.scoreworks.engraving.exceptions.ContractViolationException;

/**
 * Give each visible staff its slot in the aligner of its system and register the verses it needs room for. Verses of
 * lyrics running into the staff from a previous measure count as well. Once a system is done, the slots are stacked.
 * Staves hidden by their definition take no slot. Staves hidden in one measure only keep their slot. Neither is
 * descended into.
 */
public class AlignVerticallyFunctor extends MutableFunctor {

    public AlignVerticallyFunctor(PassContext context) {
        super(context);
    }

    @Override
    public FunctorCode visitDoc(Doc doc) {
        if (!doc.isHorizontallyAligned())
            throw new ContractViolationException("Vertical alignment of " + doc + " needs the horizontal alignment first");
        return FunctorCode.CONTINUE;
    }

    @Override
    public FunctorCode visitSystem(StaffSystem system) {
        context.setCurrentSystem(system);
        context.setSystemAligner(system.getOrCreateAligner());
        return FunctorCode.CONTINUE;
    }

    @Override
    public FunctorCode visitScoreDef(ScoreDef scoreDef) {
        return FunctorCode.SKIP_CHILDREN;
    }

    @Override
    public FunctorCode visitMeasure(Measure measure) {
        context.setStaffIdx(0);
        return FunctorCode.CONTINUE;
    }

    @Override
    public FunctorCode visitStaff(Staff staff) {
        if (!staff.isVisibleInSystem())
            return FunctorCode.SKIP_CHILDREN;

        int staffIdx = context.getStaffIdx();
        StaffAlignment alignment = context.getSystemAligner().getStaffAlignment(staffIdx, staff, context.getDoc());
        staff.setAlignment(alignment);
        context.setStaffIdx(staffIdx + 1);
        //hidden in this measure only: keeps its slot, adds no verses
        if (!staff.isLocallyVisible())
            return FunctorCode.SKIP_CHILDREN;

        for (Node element : staff.getTimeSpanningElements()) {
            Node verse = element.is(NodeKind.VERSE) ? element : element.getFirstAncestor(NodeKind.VERSE);
            if (verse != null)
                alignment.addVerseN(verse.asVerse().getN());
        }
        context.setCurrentStaff(staff);
        return FunctorCode.CONTINUE;
    }

    @Override
    public FunctorCode visitVerse(Verse verse) {
        Node staff = verse.getFirstAncestor(NodeKind.STAFF);
        if (staff != null && staff.asStaff().getAlignment() != null)
            staff.asStaff().getAlignment().addVerseN(verse.getN());
        return FunctorCode.SKIP_CHILDREN;
    }

    @Override
    public FunctorCode visitSystemEnd(StaffSystem system) {
        system.getOrCreateAligner().computeOffsets(context.getDoc());
        return FunctorCode.CONTINUE;
    }

    @Override
    public FunctorCode visitDocEnd(Doc doc) {
        doc.setVerticallyAligned(true);
        return FunctorCode.CONTINUE;
    }
}
