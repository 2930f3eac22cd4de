package net.scoreworks.engraving.functors;

import net.scoreworks.engraving.*;
import net.scoreworks.engraving.exceptions.ContractViolationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class AlignVerticallyTests {
    static final int SYSTEM_Y = 2970 - 50;
    static final int SLOT_HEIGHT = 4 * 2 * 9 + 12 * 9;
    static final int VERSE_HEIGHT = 5 * 9;

    Doc doc;
    LayoutEngine engine;
    Staff staff1, staff2;

    @BeforeEach
    public void prepare() {
        doc = TestScores.createDoc(2, 2);
        engine = new LayoutEngine(doc);
        staff1 = TestScores.getStaff(doc, 0, 1);
        staff2 = TestScores.getStaff(doc, 0, 2);
    }

    @Test
    public void testStavesAreStacked() {
        engine.layOut();
        Assertions.assertEquals(SYSTEM_Y, TestScores.getSystem(doc, 0).getDrawingY());
        Assertions.assertEquals(SYSTEM_Y, staff1.getDrawingY());
        Assertions.assertEquals(SYSTEM_Y - SLOT_HEIGHT, staff2.getDrawingY());
        //staves of all measures share the slots of their system
        Assertions.assertSame(staff2.getAlignment(), TestScores.getStaff(doc, 1, 2).getAlignment());
        Assertions.assertEquals(SYSTEM_Y - SLOT_HEIGHT, TestScores.getStaff(doc, 1, 2).getDrawingY());
    }

    @Test
    public void testNoAlignmentGivesZero() {
        Assertions.assertNull(staff1.getAlignment());
        Assertions.assertEquals(0, staff1.getDrawingY());
    }

    @Test
    public void testHiddenStaffTakesNoSlot() {
        TestScores.getSystem(doc, 0).getScoreDef().getStaffDef(1).setDrawingVisible(false);
        engine.layOut();
        Assertions.assertNull(staff1.getAlignment());
        Assertions.assertEquals(0, staff1.getDrawingY());
        Assertions.assertEquals(SYSTEM_Y, staff2.getDrawingY());
        Assertions.assertEquals(1, TestScores.getSystem(doc, 0).getAligner().getStaffAlignments().size());
    }

    @Test
    public void testLocallyHiddenStaffKeepsItsSlot() {
        staff1.setVisible(false);
        Note note = TestScores.quarter(PitchName.C, 5);
        note.addChild(new Verse(1));
        staff1.getLayer(1).addChild(note);
        engine.layOut();

        Staff next1 = TestScores.getStaff(doc, 1, 1);
        Staff next2 = TestScores.getStaff(doc, 1, 2);
        Assertions.assertSame(next1.getAlignment(), staff1.getAlignment());
        Assertions.assertSame(next2.getAlignment(), staff2.getAlignment());
        Assertions.assertEquals(1, staff2.getAlignment().getStaffIdx());
        Assertions.assertEquals(2, TestScores.getSystem(doc, 0).getAligner().getStaffAlignments().size());
        Assertions.assertEquals(SYSTEM_Y, next1.getDrawingY());
        Assertions.assertEquals(SYSTEM_Y - SLOT_HEIGHT, staff2.getDrawingY());
        Assertions.assertEquals(SYSTEM_Y - SLOT_HEIGHT, next2.getDrawingY());
        //the verses of the hidden staff take no room
        Assertions.assertEquals(0, staff1.getAlignment().getVerseLineCount());
    }

    @Test
    public void testVersesMakeRoom() {
        Note note = TestScores.quarter(PitchName.C, 5);
        note.addChild(new Verse(2));
        staff1.getLayer(1).addChild(note);
        engine.layOut();
        Assertions.assertEquals(1, staff1.getAlignment().getVersePosition(2));
        Assertions.assertEquals(SYSTEM_Y - SLOT_HEIGHT - 2 * VERSE_HEIGHT, staff2.getDrawingY());
    }

    @Test
    public void testCollapsedVerses() {
        doc.getOptions().setLyricVerseCollapse(true);
        Note note = TestScores.quarter(PitchName.C, 5);
        note.addChild(new Verse(2));
        staff1.getLayer(1).addChild(note);
        engine.layOut();
        Assertions.assertEquals(0, staff1.getAlignment().getVersePosition(2));
        Assertions.assertEquals(SYSTEM_Y - SLOT_HEIGHT - VERSE_HEIGHT, staff2.getDrawingY());
    }

    @Test
    public void testRunningSyllableRegistersItsVerse() {
        Note start = TestScores.quarter(PitchName.C, 5);
        Verse verse = new Verse(3);
        Syl syl = new Syl("la");
        verse.addChild(syl);
        start.addChild(verse);
        staff1.getLayer(1).addChild(start);
        Note end = TestScores.quarter(PitchName.D, 5);
        TestScores.getLayer(doc, 1, 1).addChild(end);
        syl.enableCapability(Capability.TIME_SPANNING, new TimeSpan(start, end));
        //the staff of the first measure is hidden, so only the running staff can register the verse
        staff1.setVisible(false);

        engine.layOut();
        Staff running = TestScores.getStaff(doc, 1, 1);
        Assertions.assertEquals(1, running.getTimeSpanningElements().size());
        Assertions.assertTrue(running.getAlignment().hasVerseN(3));
    }

    @Test
    public void testRealignmentGivesSameSlots() {
        Note note = TestScores.quarter(PitchName.C, 5);
        note.addChild(new Verse(2));
        staff2.getLayer(1).addChild(note);
        engine.layOut();
        StaffSystem system = TestScores.getSystem(doc, 0);
        String first = describeSlots(system);
        int y2 = staff2.getDrawingY();

        engine.resetVerticalAlignment();
        engine.alignVertically();
        Assertions.assertEquals(first, describeSlots(system));
        engine.resetVerticalAlignment();
        engine.alignVertically();
        Assertions.assertEquals(first, describeSlots(system));
        Assertions.assertEquals(y2, staff2.getDrawingY());
        Assertions.assertEquals(2, system.getAligner().getStaffAlignments().size());
    }

    private static String describeSlots(StaffSystem system) {
        StringBuilder builder = new StringBuilder();
        for (StaffAlignment alignment : system.getAligner().getStaffAlignments()) {
            builder.append(alignment.getStaffIdx()).append(':').append(alignment.getYRel()).append(':')
                    .append(alignment.getVersePositions()).append(';');
        }
        return builder.toString();
    }

    @Test
    public void testAbsoluteY() {
        staff2.setYAbs(100);
        engine.layOut();
        Assertions.assertEquals(100, staff2.getDrawingY());
    }

    @Test
    public void testFacsimileY() {
        doc.setType(DocType.FACSIMILE);
        staff2.enableCapability(Capability.FACSIMILE, new Zone(10, 500, 300, 572));
        staff2.setYAbs(100);
        engine.layOut();
        Assertions.assertEquals(500, staff2.getDrawingY());
        Assertions.assertEquals(10, staff2.getDrawingX());
        Assertions.assertEquals(100 * 72 / (9 * 2 * 4), staff2.getDrawingStaffSize());
        //facsimile data is ignored by page based documents
        doc.setType(DocType.PAGE_BASED);
        Assertions.assertEquals(100, staff2.getDrawingY());
    }

    @Test
    public void testSingleLineFacsimileStaff() {
        doc.setType(DocType.FACSIMILE);
        TestScores.getSystem(doc, 0).getScoreDef().getStaffDef(2).setLines(1);
        staff2.enableCapability(Capability.FACSIMILE, new Zone(10, 500, 300, 572));
        engine.layOut();
        Assertions.assertEquals(1, staff2.getDrawingLines());
        Assertions.assertEquals(100, staff2.getDrawingStaffSize());
        Assertions.assertEquals(500, staff2.getDrawingY());
    }

    @Test
    public void testCachedYSurvivesUntilReset() {
        engine.layOut();
        Assertions.assertEquals(SYSTEM_Y - SLOT_HEIGHT, staff2.getDrawingY());
        doc.getOptions().setPageHeight(1000);
        engine.alignSystems();
        Assertions.assertEquals(950, TestScores.getSystem(doc, 0).getDrawingY());
        Assertions.assertEquals(SYSTEM_Y - SLOT_HEIGHT, staff2.getDrawingY());

        engine.layOut();
        Assertions.assertEquals(950 - SLOT_HEIGHT, staff2.getDrawingY());
    }

    @Test
    public void testNeedsHorizontalAlignment() {
        Assertions.assertThrows(ContractViolationException.class, engine::alignVertically);
        engine.alignHorizontally();
        engine.alignVertically();
        Assertions.assertTrue(doc.isVerticallyAligned());
    }

    @Test
    public void testMissingStaffDefinition() {
        TestScores.getMeasure(doc, 1).addChild(new Staff(3));
        Assertions.assertThrows(ContractViolationException.class, engine::layOut);
    }
}
