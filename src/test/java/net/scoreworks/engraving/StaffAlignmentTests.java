package net.scoreworks.engraving;

import net.scoreworks.engraving.exceptions.ContractViolationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class StaffAlignmentTests {
    Doc doc;
    Staff staff;

    @BeforeEach
    public void prepare() {
        doc = TestScores.createDoc(2, 1);
        staff = TestScores.getStaff(doc, 0, 1);
    }

    @Test
    public void testVersesFirstRegistrationWins() {
        StaffAlignment alignment = new StaffAlignment(0, staff, false);
        Assertions.assertTrue(alignment.addVerseN(1));
        Assertions.assertFalse(alignment.addVerseN(1));
        Assertions.assertEquals(1, alignment.getVersePositions().size());
    }

    @Test
    public void testVersePositionsByNumber() {
        StaffAlignment alignment = new StaffAlignment(0, staff, false);
        alignment.addVerseN(3);
        alignment.addVerseN(1);
        Assertions.assertEquals(0, alignment.getVersePosition(1));
        Assertions.assertEquals(2, alignment.getVersePosition(3));
        Assertions.assertNull(alignment.getVerseNAt(1));
        Assertions.assertEquals(3, alignment.getVerseLineCount());
    }

    @Test
    public void testCollapsedVersePositions() {
        StaffAlignment alignment = new StaffAlignment(0, staff, true);
        alignment.addVerseN(3);
        Assertions.assertEquals(0, alignment.getVersePosition(3));
        alignment.addVerseN(1);
        Assertions.assertEquals(0, alignment.getVersePosition(1));
        Assertions.assertEquals(1, alignment.getVersePosition(3));
        Assertions.assertEquals(3, alignment.getVerseNAt(1));
        Assertions.assertEquals(2, alignment.getVerseLineCount());
        Assertions.assertFalse(alignment.hasVerseN(2));
    }

    @Test
    public void testHeight() {
        StaffAlignment alignment = new StaffAlignment(0, staff, false);
        //4 spaces of 2 units and the staff spacing
        Assertions.assertEquals(4 * 2 * 9 + 12 * 9, alignment.getHeight(doc));
        alignment.addVerseN(1);
        Assertions.assertEquals(4 * 2 * 9 + 5 * 9 + 12 * 9, alignment.getHeight(doc));
    }

    @Test
    public void testSlotsAreStackedTopDown() {
        SystemAligner aligner = TestScores.getSystem(doc, 0).getOrCreateAligner();
        StaffAlignment first = aligner.getStaffAlignment(0, staff, doc);
        StaffAlignment second = aligner.getStaffAlignment(1, TestScores.getStaff(doc, 0, 2), doc);
        Assertions.assertSame(first, aligner.getStaffAlignment(0, staff, doc));
        first.addVerseN(1);
        aligner.computeOffsets(doc);
        Assertions.assertEquals(0, first.getYRel());
        Assertions.assertEquals(-225, second.getYRel());
        Assertions.assertEquals(225 + 180, aligner.getTotalHeight());
    }

    @Test
    public void testSkippedSlotIsContractViolation() {
        SystemAligner aligner = TestScores.getSystem(doc, 0).getOrCreateAligner();
        Assertions.assertThrows(ContractViolationException.class, () -> aligner.getStaffAlignment(1, staff, doc));
    }
}
