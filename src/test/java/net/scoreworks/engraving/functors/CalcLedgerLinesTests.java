package net.scoreworks.engraving.functors;

import net.scoreworks.engraving.*;
import net.scoreworks.engraving.exceptions.ContractViolationException;
import org.apache.commons.lang3.math.Fraction;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

public class CalcLedgerLinesTests {
    Doc doc;
    LayoutEngine engine;
    Staff staff;
    Layer layer;

    @BeforeEach
    public void prepare() {
        doc = TestScores.createDoc(1, 1);
        engine = new LayoutEngine(doc);
        staff = TestScores.getStaff(doc, 0, 1);
        layer = staff.getLayer(1);
    }

    private List<Dash> dashes(LedgerLinePlacement placement, int line) {
        return staff.getLedgerLines(placement).get(line).getDashes();
    }

    @Test
    public void testNoteBelowStaff() {
        layer.addChild(TestScores.quarter(PitchName.C, 4));
        layer.addChild(TestScores.quarter(PitchName.E, 4));
        layer.addChild(TestScores.quarter(PitchName.C, 4));
        engine.layOut();
        Assertions.assertEquals(1, staff.getLedgerLines(LedgerLinePlacement.BELOW).size());
        //notes are 72 pixels apart, head of 18 pixels and extension of 5 on both sides
        Assertions.assertEquals(List.of(new Dash(13, 41), new Dash(157, 185)), dashes(LedgerLinePlacement.BELOW, 0));
        Assertions.assertTrue(staff.getLedgerLines(LedgerLinePlacement.ABOVE).isEmpty());
    }

    @Test
    public void testNotesAboveStaff() {
        layer.addChild(TestScores.quarter(PitchName.G, 5));
        layer.addChild(TestScores.quarter(PitchName.A, 5));
        layer.addChild(TestScores.quarter(PitchName.C, 6));
        engine.layOut();
        List<LedgerLine> lines = staff.getLedgerLines(LedgerLinePlacement.ABOVE);
        Assertions.assertEquals(2, lines.size());
        Assertions.assertEquals(List.of(new Dash(85, 113), new Dash(157, 185)), lines.get(0).getDashes());
        Assertions.assertEquals(List.of(new Dash(157, 185)), lines.get(1).getDashes());
        Assertions.assertEquals(12, ((Note) layer.getChildren().get(2)).getDrawingLoc());
    }

    @Test
    public void testChordDashesMerge() {
        Chord chord = new Chord();
        chord.setDuration(Fraction.ONE_QUARTER);
        chord.addChild(new Note(PitchName.C, 4));
        chord.addChild(new Note(PitchName.A, 3));
        layer.addChild(chord);
        engine.layOut();
        Assertions.assertEquals(List.of(new Dash(13, 41)), dashes(LedgerLinePlacement.BELOW, 0));
        Assertions.assertEquals(List.of(new Dash(13, 41)), dashes(LedgerLinePlacement.BELOW, 1));
    }

    @Test
    public void testCueNote() {
        Note note = TestScores.quarter(PitchName.C, 4);
        note.setCue(true);
        layer.addChild(note);
        engine.layOut();
        Assertions.assertTrue(staff.getLedgerLines(LedgerLinePlacement.BELOW).isEmpty());
        Assertions.assertEquals(List.of(new Dash(13, 36)), dashes(LedgerLinePlacement.BELOW_CUE, 0));
    }

    @Test
    public void testClefChange() {
        layer.addChild(new Clef(ClefShape.F, 4));
        layer.addChild(TestScores.quarter(PitchName.C, 4));
        engine.layOut();
        Assertions.assertTrue(staff.getLedgerLines(LedgerLinePlacement.BELOW).isEmpty());
        Assertions.assertEquals(1, staff.getLedgerLines(LedgerLinePlacement.ABOVE).size());
    }

    @Test
    public void testStaffDefinitionClef() {
        TestScores.getSystem(doc, 0).getScoreDef().getStaffDef(1).setClef(ClefShape.F, 4);
        layer.addChild(TestScores.quarter(PitchName.E, 2));
        engine.layOut();
        Assertions.assertEquals(1, staff.getLedgerLines(LedgerLinePlacement.BELOW).size());
    }

    @Test
    public void testExplicitLocation() {
        Note note = TestScores.quarter(PitchName.C, 4);
        note.setLoc(4);
        layer.addChild(note);
        engine.layOut();
        Assertions.assertTrue(staff.getLedgerLines(LedgerLinePlacement.BELOW).isEmpty());
        Assertions.assertEquals(4, note.getDrawingLoc());
    }

    @Test
    public void testTablatureHasNoLedgerLines() {
        TestScores.getSystem(doc, 0).getScoreDef().getStaffDef(1).setNotationType(NotationType.TAB_GUITAR);
        layer.addChild(TestScores.quarter(PitchName.C, 4));
        engine.layOut();
        Assertions.assertTrue(staff.isTablature());
        Assertions.assertTrue(staff.getLedgerLines(LedgerLinePlacement.BELOW).isEmpty());
    }

    @Test
    public void testLayoutDoesNotAccumulate() {
        layer.addChild(TestScores.quarter(PitchName.C, 4));
        engine.layOut();
        engine.layOut();
        Assertions.assertEquals(List.of(new Dash(13, 41)), dashes(LedgerLinePlacement.BELOW, 0));
    }

    @Test
    public void testNeedsVerticalAlignment() {
        layer.addChild(TestScores.quarter(PitchName.C, 4));
        engine.alignHorizontally();
        Assertions.assertThrows(ContractViolationException.class, engine::calcLedgerLines);
    }
}
