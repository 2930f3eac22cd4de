package net.scoreworks.engraving.functors;

import net.scoreworks.engraving.*;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

public class PrepareTimeSpanningTests {
    Doc doc;
    Note start, end;

    @BeforeEach
    public void prepare() {
        doc = TestScores.createDoc(2, 4);
        start = TestScores.quarter(PitchName.G, 4);
        end = TestScores.quarter(PitchName.A, 4);
        TestScores.getLayer(doc, 0, 1).addChild(start);
        TestScores.getLayer(doc, 2, 1).addChild(end);
    }

    private void prepareTimeSpanning() {
        LayoutEngine engine = new LayoutEngine(doc);
        engine.resetData();
        engine.prepareTimeSpanning();
    }

    @Test
    public void testSpanReachesFollowingMeasuresOfItsStaff() {
        Slur slur = new Slur(new TimeSpan(start, end));
        TestScores.getMeasure(doc, 0).addChild(slur);
        prepareTimeSpanning();

        Assertions.assertTrue(TestScores.getStaff(doc, 0, 1).getTimeSpanningElements().isEmpty());
        Assertions.assertEquals(List.of(slur), TestScores.getStaff(doc, 1, 1).getTimeSpanningElements());
        Assertions.assertEquals(List.of(slur), TestScores.getStaff(doc, 2, 1).getTimeSpanningElements());
        Assertions.assertTrue(TestScores.getStaff(doc, 3, 1).getTimeSpanningElements().isEmpty());
        for (int i = 0; i < 4; i++) {
            Assertions.assertTrue(TestScores.getStaff(doc, i, 2).getTimeSpanningElements().isEmpty());
        }
    }

    @Test
    public void testExplicitStaves() {
        Slur slur = new Slur(new TimeSpan(start, end, List.of(1, 2)));
        TestScores.getMeasure(doc, 0).addChild(slur);
        prepareTimeSpanning();
        Assertions.assertEquals(List.of(slur), TestScores.getStaff(doc, 1, 2).getTimeSpanningElements());
        Assertions.assertEquals(List.of(slur), TestScores.getStaff(doc, 1, 1).getTimeSpanningElements());
    }

    @Test
    public void testSpanWithinMeasureIsNotPropagated() {
        Note other = TestScores.quarter(PitchName.B, 4);
        TestScores.getLayer(doc, 0, 1).addChild(other);
        TestScores.getMeasure(doc, 0).addChild(new Slur(new TimeSpan(start, other)));
        prepareTimeSpanning();
        for (int i = 0; i < 4; i++) {
            Assertions.assertTrue(TestScores.getStaff(doc, i, 1).getTimeSpanningElements().isEmpty());
        }
    }

    @Test
    public void testResetClearsElements() {
        TestScores.getMeasure(doc, 0).addChild(new Slur(new TimeSpan(start, end)));
        prepareTimeSpanning();
        prepareTimeSpanning();
        Assertions.assertEquals(1, TestScores.getStaff(doc, 1, 1).getTimeSpanningElements().size());
    }
}
