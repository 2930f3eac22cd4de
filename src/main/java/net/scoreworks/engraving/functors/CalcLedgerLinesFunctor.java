/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving.functors;

import net.scoreworks.engraving.*;
import net.scoreworks.engraving.exceptions.ContractViolationException;

/**
 * Fill the ledger line buffers of the staves. The staff location of each note is taken as given or computed from its
 * pitch and the clef in effect. Notes above the top line or below the bottom line add one dash per ledger line they
 * need, overlapping dashes of neighbouring notes are merged by the staff. Tablature staves have no ledger lines.
 */
public class CalcLedgerLinesFunctor extends MutableFunctor {
    /** width of a note head in drawing units */
    private static final int HEAD_WIDTH = 2;
    private static final double CUE_RATIO = 0.75;

    public CalcLedgerLinesFunctor(PassContext context) {
        super(context);
    }

    @Override
    public FunctorCode visitDoc(Doc doc) {
        if (!doc.isVerticallyAligned())
            throw new ContractViolationException("Ledger lines of " + doc + " need the vertical alignment first");
        return FunctorCode.CONTINUE;
    }

    @Override
    public FunctorCode visitScoreDef(ScoreDef scoreDef) {
        return FunctorCode.SKIP_CHILDREN;
    }

    @Override
    public FunctorCode visitStaff(Staff staff) {
        if (staff.isTablature() || !staff.isVisible())
            return FunctorCode.SKIP_CHILDREN;
        context.setCurrentStaff(staff);
        return FunctorCode.CONTINUE;
    }

    @Override
    public FunctorCode visitLayer(Layer layer) {
        context.setCurrentClef(null);
        return FunctorCode.CONTINUE;
    }

    @Override
    public FunctorCode visitLayerElement(LayerElement element) {
        if (element.is(NodeKind.CLEF))
            context.setCurrentClef(element.asClef());
        else if (element.is(NodeKind.NOTE))
            addLedgerLines(element.asNote());
        return FunctorCode.CONTINUE;
    }

    private void addLedgerLines(Note note) {
        Staff staff = context.getCurrentStaff();
        int loc = calcLoc(note, staff);
        note.setDrawingLoc(loc);

        int topLoc = (staff.getDrawingLines() - 1) * 2;
        boolean above = loc > topLoc;
        int count;
        if (above)
            count = (loc - topLoc) / 2;
        else if (loc < 0)
            count = -loc / 2;
        else
            return;
        //spaces right above or below the staff need no ledger line
        if (count == 0)
            return;

        boolean cue = note.isCue() || note.isInChord() && note.getParent().asLayerElement().isCue();
        int unit = context.getDoc().getDrawingUnit(staff.getDrawingStaffNotationSize());
        int headWidth = HEAD_WIDTH * unit;
        if (cue)
            headWidth = (int) (headWidth * CUE_RATIO);
        int extension = (int) Math.round(context.getOptions().getLedgerLineExtension() * unit);
        int left = note.getDrawingX() - extension;
        int right = note.getDrawingX() + headWidth + extension;
        if (above)
            staff.addLedgerLineAbove(count, left, right, extension, cue);
        else
            staff.addLedgerLineBelow(count, left, right, extension, cue);
    }

    private int calcLoc(Note note, Staff staff) {
        Clef clef = context.getCurrentClef();
        if (clef != null)
            return note.calcLoc(clef.getShape(), clef.getLine());
        StaffDef staffDef = staff.getDrawingStaffDef();
        if (staffDef != null)
            return note.calcLoc(staffDef.getClefShape(), staffDef.getClefLine());
        return note.calcLoc(ClefShape.G, 2);
    }
}
