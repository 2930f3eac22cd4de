/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving.functors;

import net.scoreworks.engraving.*;
import net.scoreworks.engraving.exceptions.ContractViolationException;
import org.apache.commons.lang3.math.Fraction;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulators of one traversal. A context is created for a pass, handed to the functor running it and dropped
 * afterwards. Nothing in here is stored on the tree.
 */
public class PassContext {
    private final Doc doc;

    /** position of the current staff within its measure, counting visible staves only */
    private int staffIdx;
    private NotationType notationType = NotationType.CMN;

    private StaffSystem currentSystem;
    private SystemAligner systemAligner;
    private Measure currentMeasure;
    private Staff currentStaff;
    private Layer currentLayer;
    private Clef currentClef;

    /** time position reached in the current layer */
    private Fraction layerTime = Fraction.ZERO;
    /** longest layer of the current measure */
    private Fraction measureDuration = Fraction.ZERO;
    /** horizontal position reached in the current system */
    private int systemX;
    /** vertical position reached on the current page */
    private int pageY;

    /** time spanning elements started in a previous measure and still running */
    private final List<Node> timeSpanningElements = new ArrayList<>();

    public PassContext(Doc doc) {
        this.doc = doc;
    }

    /**
     * @throws ContractViolationException if the context was created without a document
     */
    public Doc getDoc() {
        if (doc == null)
            throw new ContractViolationException("Pass needs a document but the context has none");
        return doc;
    }

    public boolean hasDoc() {
        return doc != null;
    }

    public LayoutOptions getOptions() {
        return getDoc().getOptions();
    }

    public int getStaffIdx() {
        return staffIdx;
    }

    public void setStaffIdx(int staffIdx) {
        this.staffIdx = staffIdx;
    }

    public NotationType getNotationType() {
        return notationType;
    }

    public void setNotationType(NotationType notationType) {
        this.notationType = notationType;
    }

    public StaffSystem getCurrentSystem() {
        return currentSystem;
    }

    public void setCurrentSystem(StaffSystem currentSystem) {
        this.currentSystem = currentSystem;
    }

    public SystemAligner getSystemAligner() {
        return systemAligner;
    }

    public void setSystemAligner(SystemAligner systemAligner) {
        this.systemAligner = systemAligner;
    }

    public Measure getCurrentMeasure() {
        return currentMeasure;
    }

    public void setCurrentMeasure(Measure currentMeasure) {
        this.currentMeasure = currentMeasure;
    }

    public Staff getCurrentStaff() {
        return currentStaff;
    }

    public void setCurrentStaff(Staff currentStaff) {
        this.currentStaff = currentStaff;
    }

    public Layer getCurrentLayer() {
        return currentLayer;
    }

    public void setCurrentLayer(Layer currentLayer) {
        this.currentLayer = currentLayer;
    }

    public Clef getCurrentClef() {
        return currentClef;
    }

    public void setCurrentClef(Clef currentClef) {
        this.currentClef = currentClef;
    }

    public Fraction getLayerTime() {
        return layerTime;
    }

    public void setLayerTime(Fraction layerTime) {
        this.layerTime = layerTime;
    }

    public Fraction getMeasureDuration() {
        return measureDuration;
    }

    public void setMeasureDuration(Fraction measureDuration) {
        this.measureDuration = measureDuration;
    }

    public int getSystemX() {
        return systemX;
    }

    public void setSystemX(int systemX) {
        this.systemX = systemX;
    }

    public int getPageY() {
        return pageY;
    }

    public void setPageY(int pageY) {
        this.pageY = pageY;
    }

    public List<Node> getTimeSpanningElements() {
        return timeSpanningElements;
    }
}
