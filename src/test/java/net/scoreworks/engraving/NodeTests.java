package net.scoreworks.engraving;

import net.scoreworks.engraving.exceptions.ContractViolationException;
import net.scoreworks.engraving.exceptions.IllegalDataModelException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

public class NodeTests {
    Doc doc;
    Measure measure;
    Staff staff;
    Layer layer;
    Note note;

    @BeforeEach
    public void createDoc() {
        doc = TestScores.createDoc(2, 1);
        measure = TestScores.getMeasure(doc, 0);
        staff = measure.getStaff(1);
        layer = staff.getLayer(1);
        note = TestScores.quarter(PitchName.C, 4);
        layer.addChild(note);
    }

    @Test
    public void testRejectedChildLeavesParentUntouched() {
        List<Node> before = new ArrayList<>(layer.getChildren());
        Page page = new Page();
        Assertions.assertFalse(layer.addChild(page));
        Assertions.assertEquals(before, layer.getChildren());
        Assertions.assertNull(page.getParent());
        Assertions.assertFalse(note.addChild(new Syl("la")));
        Assertions.assertEquals(0, note.getChildCount());
        int staffChildren = staff.getChildCount();
        Assertions.assertFalse(staff.addChild(new Page()));
        Assertions.assertEquals(staffChildren, staff.getChildCount());
    }

    @Test
    public void testNodeCantContainItself() {
        EditorialElement app = new EditorialElement("app");
        Assertions.assertThrows(ContractViolationException.class, () -> app.addChild(app));
        Assertions.assertNull(app.getParent());
        Assertions.assertEquals(0, app.getChildCount());

        EditorialElement lem = new EditorialElement("lem");
        EditorialElement rdg = new EditorialElement("rdg");
        app.addChild(lem);
        lem.addChild(rdg);
        Assertions.assertThrows(ContractViolationException.class, () -> rdg.addChild(app));
        Assertions.assertNull(app.getParent());
        Assertions.assertEquals(0, rdg.getChildCount());
    }

    @Test
    public void testReparentingIsContractViolation() {
        Layer other = TestScores.getLayer(doc, 0, 2);
        Assertions.assertThrows(ContractViolationException.class, () -> other.addChild(note));
        Assertions.assertSame(layer, note.getParent());
    }

    @Test
    public void testLayersGetNumbered() {
        Staff staff = new Staff(3);
        Layer first = new Layer();
        Layer second = new Layer();
        Layer explicit = new Layer(7);
        staff.addChild(first);
        staff.addChild(second);
        staff.addChild(explicit);
        Assertions.assertEquals(1, first.getN());
        Assertions.assertEquals(2, second.getN());
        Assertions.assertEquals(7, explicit.getN());
        Assertions.assertSame(second, staff.getLayer(2));
    }

    @Test
    public void testDuplicateStaffNumber() {
        Assertions.assertThrows(ContractViolationException.class, () -> measure.addChild(new Staff(1)));
        Assertions.assertEquals(2, measure.getChildCount(NodeKind.STAFF));
    }

    @Test
    public void testAncestors() {
        Assertions.assertSame(staff, note.getFirstAncestor(NodeKind.STAFF));
        Assertions.assertSame(measure, note.getFirstAncestor(NodeKind.MEASURE));
        Assertions.assertSame(doc, note.getDoc());
        Assertions.assertNull(note.getFirstAncestor(NodeKind.VERSE));
        Assertions.assertNull(new Note().getFirstAncestor(NodeKind.STAFF));
        Assertions.assertNull(new Note().getDoc());
    }

    @Test
    public void testKindAccessors() {
        Assertions.assertSame(staff, ((Node) staff).asStaff());
        Assertions.assertSame(note, note.asLayerElement());
        Assertions.assertThrows(IllegalDataModelException.class, staff::asLayer);
        Assertions.assertThrows(IllegalDataModelException.class, staff::asLayerElement);
        IllegalDataModelException e = Assertions.assertThrows(IllegalDataModelException.class, note::asClef);
        Assertions.assertEquals(NodeKind.NOTE, e.getKind());
        Assertions.assertEquals(note.getId(), e.getNodeId());
        Assertions.assertTrue(e.getMessage().contains(note.getId()));
    }

    @Test
    public void testCapabilities() {
        Assertions.assertFalse(staff.hasCapability(Capability.FACSIMILE));
        Assertions.assertThrows(IllegalDataModelException.class, () -> staff.getCapabilityData(Capability.FACSIMILE));
        Zone zone = new Zone(0, 100, 500, 180);
        staff.enableCapability(Capability.FACSIMILE, zone);
        Assertions.assertSame(zone, staff.getCapabilityData(Capability.FACSIMILE));

        doc.markLayoutStarted();
        Staff other = TestScores.getStaff(doc, 0, 2);
        Assertions.assertThrows(ContractViolationException.class,
                () -> other.enableCapability(Capability.FACSIMILE, zone));
        //detached nodes are not affected
        new Staff(5).enableCapability(Capability.FACSIMILE, zone);
    }

    @Test
    public void testCopyAndIdentityTransfer() {
        Note child = TestScores.quarter(PitchName.D, 4);
        child.addChild(new Verse(1));
        String id = child.getId();
        Note copy = child.copyAttributes();
        Assertions.assertEquals(0, copy.getChildCount());
        Assertions.assertEquals(PitchName.D, copy.getPname());
        Assertions.assertNotEquals(id, copy.getId());

        child.transferIdentityTo(copy);
        Assertions.assertEquals(id, copy.getId());
        Assertions.assertNotEquals(id, child.getId());
        Assertions.assertTrue(child.getId().startsWith(NodeKind.NOTE.getIdPrefix()));
        Assertions.assertThrows(ContractViolationException.class, () -> copy.transferIdentityTo(new Rest()));
    }

    @Test
    public void testStaffVisibility() {
        Assertions.assertTrue(staff.isVisible());
        staff.setVisible(false);
        Assertions.assertFalse(staff.isVisible());
        staff.setVisible(true);
        TestScores.getSystem(doc, 0).getScoreDef().getStaffDef(1).setDrawingVisible(false);
        Assertions.assertFalse(staff.isVisible());

        staff.setVisible(false);
        Assertions.assertFalse(staff.isVisibleInSystem());
        TestScores.getSystem(doc, 0).getScoreDef().getStaffDef(1).setDrawingVisible(true);
        Assertions.assertTrue(staff.isVisibleInSystem());
        Assertions.assertFalse(staff.isVisible());

        Staff undefined = new Staff(9);
        measure.addChild(undefined);
        Assertions.assertThrows(ContractViolationException.class, undefined::isVisible);
    }
}
