/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

import net.scoreworks.engraving.exceptions.ContractViolationException;
import net.scoreworks.engraving.functors.ConstFunctor;
import net.scoreworks.engraving.functors.FunctorCode;
import net.scoreworks.engraving.functors.MutableFunctor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;


/**
 * One staff of a measure. Besides its attributes, a staff stores the drawing data computed by the layout passes:
 * the {@link StaffAlignment} slot it was given, its cached drawing Y, four ledger line buffers and the time spanning
 * elements running through it. All of these are only valid until the next reset pass.
 */
public class Staff extends Node implements StaffView {
    public static final double TABLATURE_STAFF_RATIO = 1.75;

    private final int n;
    private boolean visible = true;
    /** absolute Y overriding the computed one, null if not set */
    private Integer yAbs;

    private transient int drawingStaffSize = 100;
    private transient int drawingLines = 5;
    private transient NotationType drawingNotationType;
    private transient StaffDef drawingStaffDef;
    private transient StaffAlignment alignment;
    private transient Integer cachedDrawingY;
    private final transient List<Node> timeSpanningElements = new ArrayList<>();
    private final transient Map<LedgerLinePlacement, List<LedgerLine>> ledgerLines = createLedgerLineBuffers();

    public Staff(int n) {
        super(NodeKind.STAFF);
        this.n = n;
    }

    private Staff(Staff other) {
        super(other);
        this.n = other.n;
        this.visible = other.visible;
        this.yAbs = other.yAbs;
    }

    private static Map<LedgerLinePlacement, List<LedgerLine>> createLedgerLineBuffers() {
        Map<LedgerLinePlacement, List<LedgerLine>> buffers = new EnumMap<>(LedgerLinePlacement.class);
        for (LedgerLinePlacement placement : LedgerLinePlacement.values()) {
            buffers.put(placement, new ArrayList<>());
        }
        return buffers;
    }

    @Override
    public Staff copyAttributes() {
        return new Staff(this);
    }

    @Override
    protected boolean isSupportedChild(Node child) {
        if (child.is(NodeKind.LAYER)) {
            Layer layer = child.asLayer();
            //not reliable if layers are wrapped in editorial elements, importers should number layers themselves
            if (!layer.hasN())
                layer.setN(getChildCount(NodeKind.LAYER) + 1);
            return true;
        }
        return child.is(NodeKind.EDITORIAL);
    }

    @Override
    public int getN() {
        return n;
    }

    public List<Layer> getLayers() {
        List<Layer> layers = new ArrayList<>();
        for (Node child : getChildren(NodeKind.LAYER)) {
            layers.add(child.asLayer());
        }
        return layers;
    }

    /**
     * @return the layer with number n or null if there is none
     */
    public Layer getLayer(int n) {
        for (Layer layer : getLayers()) {
            if (layer.getN() == n)
                return layer;
        }
        return null;
    }

    public boolean isLocallyVisible() {
        return visible;
    }

    public void setVisible(boolean visible) {
        this.visible = visible;
    }

    public boolean hasYAbs() {
        return yAbs != null;
    }

    public void setYAbs(Integer yAbs) {
        this.yAbs = yAbs;
    }

    /**
     * Visibility as drawn: looked up in the staff definition of the owning system by staff number, combined with the
     * local flag
     * @throws ContractViolationException if the system defines no staff with this number
     */
    @Override
    public boolean isVisible() {
        return isVisibleInSystem() && visible;
    }

    /**
     * Visibility of the staff definition alone. A staff hidden only locally keeps its position in the system
     * @throws ContractViolationException if the system defines no staff with this number
     */
    public boolean isVisibleInSystem() {
        Node system = getFirstAncestor(NodeKind.SYSTEM);
        if (system == null)
            return true;
        ScoreDef scoreDef = system.asSystem().getScoreDef();
        StaffDef staffDef = scoreDef == null ? null : scoreDef.getStaffDef(n);
        if (staffDef == null)
            throw new ContractViolationException("No staff definition for " + this + " with n=" + n);
        return staffDef.isDrawingVisible();
    }


    //==========DRAWING POSITION===================================================

    private boolean isPositionedByFacsimile() {
        if (!hasCapability(Capability.FACSIMILE))
            return false;
        Doc doc = getDoc();
        return doc != null && doc.getType() == DocType.FACSIMILE;
    }

    /**
     * Resolve the drawing Y. The value computed from the staff alignment is cached until the next reset of the
     * vertical alignment, so changing the system position in between has no effect.
     */
    @Override
    public int getDrawingY() {
        if (isPositionedByFacsimile())
            return getCapabilityData(Capability.FACSIMILE).getUly();

        if (yAbs != null)
            return yAbs;

        if (alignment == null)
            return 0;

        if (cachedDrawingY != null)
            return cachedDrawingY;

        Node system = getFirstAncestor(NodeKind.SYSTEM);
        if (system == null)
            throw new ContractViolationException(this + " has a staff alignment but no system");
        cachedDrawingY = system.asSystem().getDrawingY() + alignment.getYRel();
        return cachedDrawingY;
    }

    @Override
    public int getDrawingX() {
        if (isPositionedByFacsimile())
            return getCapabilityData(Capability.FACSIMILE).getUlx();
        Node measure = getFirstAncestor(NodeKind.MEASURE);
        return measure == null ? 0 : measure.asMeasure().getDrawingX();
    }

    @Override
    public double getDrawingRotate() {
        if (isPositionedByFacsimile())
            return getCapabilityData(Capability.FACSIMILE).getRotate();
        return 0;
    }

    /**
     * Derive the staff size from the height of the facsimile zone, taking the rotation of the zone into account
     */
    public void adjustDrawingStaffSize() {
        if (!isPositionedByFacsimile())
            return;
        Doc doc = getDoc();
        Zone zone = getCapabilityData(Capability.FACSIMILE);
        double rotate = zone.getRotate();
        int yDiff = (int) (zone.getLry() - zone.getUly() - (zone.getLrx() - zone.getUlx()) * Math.tan(Math.abs(rotate) * Math.PI / 180.0));
        //a single line gives no height to derive the size from
        if (drawingLines <= 1) {
            drawingStaffSize = 100;
            return;
        }
        drawingStaffSize = 100 * yDiff / (doc.getOptions().getUnit() * 2 * (drawingLines - 1));
    }

    /**
     * @return vertical offset of a staff location relative to the top line. Location 0 is the bottom line
     */
    public int calcPitchPosYRel(Doc doc, int loc) {
        //the offset of the top line location is 0 with 1 line, 2 with 2, etc.
        int staffLocOffset = (drawingLines - 1) * 2;
        return (loc - staffLocOffset) * doc.getDrawingUnit(drawingStaffSize);
    }

    public boolean isOnStaffLine(int y, Doc doc) {
        return (y - getDrawingY()) % (2 * doc.getDrawingUnit(drawingStaffSize)) == 0;
    }

    /**
     * @return the nearest position between two lines (or spaces) above or below y
     */
    public int getNearestInterStaffPosition(int y, Doc doc, boolean above) {
        int unit = doc.getDrawingUnit(drawingStaffSize);
        int yPos = y - getDrawingY();
        int distance = yPos % unit;
        if (above) {
            if (distance > 0)
                distance = unit - distance;
            return y - distance + unit;
        }
        if (distance < 0)
            distance = unit + distance;
        return y - distance - unit;
    }

    public StaffAlignment getAlignment() {
        return alignment;
    }

    public void setAlignment(StaffAlignment alignment) {
        this.alignment = alignment;
    }

    /**
     * Drop the staff alignment, the cached drawing Y and the ledger lines
     */
    public void resetVerticalAlignment() {
        alignment = null;
        cachedDrawingY = null;
        clearLedgerLines();
    }


    //==========STAFF DEFINITION===================================================

    public StaffDef getDrawingStaffDef() {
        return drawingStaffDef;
    }

    public void setDrawingStaffDef(StaffDef drawingStaffDef) {
        this.drawingStaffDef = drawingStaffDef;
    }

    @Override
    public NotationType getDrawingNotationType() {
        return drawingNotationType;
    }

    public void setDrawingNotationType(NotationType drawingNotationType) {
        this.drawingNotationType = drawingNotationType;
    }

    @Override
    public int getDrawingStaffSize() {
        return drawingStaffSize;
    }

    public void setDrawingStaffSize(int drawingStaffSize) {
        this.drawingStaffSize = drawingStaffSize;
    }

    /**
     * @return the staff size used for notes, which is smaller on tablature staves
     */
    public int getDrawingStaffNotationSize() {
        return isTablature() ? (int) (drawingStaffSize / TABLATURE_STAFF_RATIO) : drawingStaffSize;
    }

    @Override
    public int getDrawingLines() {
        return drawingLines;
    }

    public void setDrawingLines(int drawingLines) {
        this.drawingLines = drawingLines;
    }

    public boolean isMensural() {
        return drawingNotationType != null && drawingNotationType.isMensural();
    }

    public boolean isNeume() {
        return drawingNotationType != null && drawingNotationType.isNeume();
    }

    public boolean isTablature() {
        return drawingNotationType != null && drawingNotationType.isTablature();
    }

    public boolean isTabWithStemsOutside() {
        if (drawingStaffDef == null)
            return false;
        return drawingNotationType != NotationType.TAB_GUITAR || !"stems.within".equals(drawingStaffDef.getType());
    }


    //==========LEDGER LINES=======================================================

    public void addLedgerLineAbove(int count, int left, int right, int extension, boolean cueSize) {
        addLedgerLines(ledgerLines.get(LedgerLinePlacement.of(true, cueSize)), count, left, right, extension);
    }

    public void addLedgerLineBelow(int count, int left, int right, int extension, boolean cueSize) {
        addLedgerLines(ledgerLines.get(LedgerLinePlacement.of(false, cueSize)), count, left, right, extension);
    }

    private void addLedgerLines(List<LedgerLine> lines, int count, int left, int right, int extension) {
        if (left >= right)
            throw new ContractViolationException("Ledger line needs left < right but got (" + left + ", " + right + ")");
        while (lines.size() < count) {
            lines.add(new LedgerLine());
        }
        for (int i = 0; i < count; i++) {
            lines.get(i).addDash(left, right, extension);
        }
    }

    @Override
    public List<LedgerLine> getLedgerLines(LedgerLinePlacement placement) {
        return Collections.unmodifiableList(ledgerLines.get(placement));
    }

    public void clearLedgerLines() {
        for (List<LedgerLine> lines : ledgerLines.values()) {
            lines.clear();
        }
    }


    //==========TIME SPANNING ELEMENTS=============================================

    /**
     * @return the time spanning elements started in a previous measure and running through this staff
     */
    public List<Node> getTimeSpanningElements() {
        return Collections.unmodifiableList(timeSpanningElements);
    }

    public void addTimeSpanningElement(Node element) {
        if (!element.hasCapability(Capability.TIME_SPANNING))
            throw new ContractViolationException(element + " is not time spanning");
        timeSpanningElements.add(element);
    }

    public void clearTimeSpanningElements() {
        timeSpanningElements.clear();
    }

    @Override
    protected FunctorCode accept(MutableFunctor functor) {
        return functor.visitStaff(this);
    }
    @Override
    protected FunctorCode acceptEnd(MutableFunctor functor) {
        return functor.visitStaffEnd(this);
    }
    @Override
    protected FunctorCode accept(ConstFunctor functor) {
        return functor.visitStaff(this);
    }
    @Override
    protected FunctorCode acceptEnd(ConstFunctor functor) {
        return functor.visitStaffEnd(this);
    }
}
