/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving.functors;

import net.scoreworks.engraving.Doc;
import net.scoreworks.engraving.Staff;
import net.scoreworks.engraving.StaffSystem;

/**
 * Drop the staff alignments of all systems together with everything computed from them: cached drawing Y and ledger
 * lines of the staves. Staves would otherwise keep pointing to slots of an outdated layout.
 */
public class ResetVerticalAlignmentFunctor extends MutableFunctor {

    public ResetVerticalAlignmentFunctor(PassContext context) {
        super(context);
    }

    @Override
    public FunctorCode visitDoc(Doc doc) {
        doc.setVerticallyAligned(false);
        return FunctorCode.CONTINUE;
    }

    @Override
    public FunctorCode visitSystem(StaffSystem system) {
        system.resetAligner();
        return FunctorCode.CONTINUE;
    }

    @Override
    public FunctorCode visitStaff(Staff staff) {
        staff.resetVerticalAlignment();
        return FunctorCode.SKIP_CHILDREN;
    }
}
