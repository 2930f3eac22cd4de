package net.scoreworks.engraving;

import net.scoreworks.engraving.exceptions.ContractViolationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

public class LedgerLineTests {
    LedgerLine line;
    Staff staff;

    @BeforeEach
    public void prepare() {
        line = new LedgerLine();
        staff = new Staff(1);
    }

    @Test
    public void testDashesCloseToEachOtherAreKept() {
        line.addDash(0, 10, 2);
        line.addDash(8, 20, 2);
        Assertions.assertEquals(List.of(new Dash(0, 10), new Dash(8, 20)), line.getDashes());
    }

    @Test
    public void testOverlappingDashesMerge() {
        line.addDash(0, 10, 2);
        line.addDash(5, 20, 2);
        Assertions.assertEquals(List.of(new Dash(0, 20)), line.getDashes());
    }

    @Test
    public void testDashesAreSortedByLeftEdge() {
        line.addDash(20, 30, 2);
        line.addDash(0, 10, 2);
        Assertions.assertEquals(List.of(new Dash(0, 10), new Dash(20, 30)), line.getDashes());
    }

    @Test
    public void testMergeChain() {
        line.addDash(0, 10, 2);
        line.addDash(20, 30, 2);
        line.addDash(5, 25, 2);
        Assertions.assertEquals(List.of(new Dash(0, 30)), line.getDashes());
    }

    @Test
    public void testContainedDashKeepsOuterRightEdge() {
        line.addDash(0, 40, 2);
        line.addDash(5, 20, 2);
        Assertions.assertEquals(List.of(new Dash(0, 40)), line.getDashes());
    }

    @Test
    public void testEmptyDashIsContractViolation() {
        Assertions.assertThrows(ContractViolationException.class, () -> line.addDash(10, 10, 2));
        Assertions.assertThrows(ContractViolationException.class, () -> staff.addLedgerLineBelow(1, 5, 3, 1, false));
        Assertions.assertTrue(line.isEmpty());
    }

    @Test
    public void testSlotsGrowToCount() {
        staff.addLedgerLineAbove(3, 0, 5, 1, false);
        List<LedgerLine> lines = staff.getLedgerLines(LedgerLinePlacement.ABOVE);
        Assertions.assertEquals(3, lines.size());
        for (LedgerLine ledgerLine : lines) {
            Assertions.assertEquals(List.of(new Dash(0, 5)), ledgerLine.getDashes());
        }
        staff.addLedgerLineAbove(1, 20, 25, 1, false);
        Assertions.assertEquals(3, lines.size());
        Assertions.assertEquals(2, lines.get(0).getDashes().size());
        Assertions.assertEquals(1, lines.get(1).getDashes().size());
    }

    @Test
    public void testBuffersAreSeparate() {
        staff.addLedgerLineAbove(1, 0, 5, 1, true);
        staff.addLedgerLineBelow(2, 0, 5, 1, false);
        Assertions.assertTrue(staff.getLedgerLines(LedgerLinePlacement.ABOVE).isEmpty());
        Assertions.assertEquals(1, staff.getLedgerLines(LedgerLinePlacement.ABOVE_CUE).size());
        Assertions.assertEquals(2, staff.getLedgerLines(LedgerLinePlacement.BELOW).size());
        Assertions.assertTrue(staff.getLedgerLines(LedgerLinePlacement.BELOW_CUE).isEmpty());

        staff.resetVerticalAlignment();
        for (LedgerLinePlacement placement : LedgerLinePlacement.values()) {
            Assertions.assertTrue(staff.getLedgerLines(placement).isEmpty());
        }
    }
}
