/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

import org.apache.commons.lang3.Validate;

/**
 * Options steering the layout passes of a {@link Doc}. Distances are expressed in drawing units unless stated otherwise,
 * one drawing unit being half the distance between two staff lines of a staff at 100%.
 */
public class LayoutOptions {
    /** size of a drawing unit in pixels */
    private int unit = 9;
    /** space between two staves of a system */
    private int spacingStaff = 12;
    /** space between two systems of a page */
    private int spacingSystem = 12;
    /** height reserved for one verse of lyrics */
    private int lyricSize = 5;
    /** length added to each side of a ledger line dash */
    private double ledgerLineExtension = 0.54;
    /** horizontal space taken by a whole note */
    private int wholeNoteSpacing = 32;
    /** space before the first element of a measure */
    private int measureLeftMargin = 2;
    /** page height in pixels */
    private int pageHeight = 2970;
    /** top margin of a page in pixels */
    private int pageMarginTop = 50;
    /** display verses by their rank among the verses present instead of their number */
    private boolean lyricVerseCollapse;

    public int getUnit() {
        return unit;
    }

    public LayoutOptions setUnit(int unit) {
        Validate.isTrue(unit > 0, "unit must be positive but was %d", unit);
        this.unit = unit;
        return this;
    }

    public int getSpacingStaff() {
        return spacingStaff;
    }

    public LayoutOptions setSpacingStaff(int spacingStaff) {
        Validate.isTrue(spacingStaff >= 0, "staff spacing must not be negative");
        this.spacingStaff = spacingStaff;
        return this;
    }

    public int getSpacingSystem() {
        return spacingSystem;
    }

    public LayoutOptions setSpacingSystem(int spacingSystem) {
        Validate.isTrue(spacingSystem >= 0, "system spacing must not be negative");
        this.spacingSystem = spacingSystem;
        return this;
    }

    public int getLyricSize() {
        return lyricSize;
    }

    public LayoutOptions setLyricSize(int lyricSize) {
        Validate.isTrue(lyricSize >= 0, "lyric size must not be negative");
        this.lyricSize = lyricSize;
        return this;
    }

    public double getLedgerLineExtension() {
        return ledgerLineExtension;
    }

    public LayoutOptions setLedgerLineExtension(double ledgerLineExtension) {
        Validate.isTrue(ledgerLineExtension >= 0, "ledger line extension must not be negative");
        this.ledgerLineExtension = ledgerLineExtension;
        return this;
    }

    public int getWholeNoteSpacing() {
        return wholeNoteSpacing;
    }

    public LayoutOptions setWholeNoteSpacing(int wholeNoteSpacing) {
        Validate.isTrue(wholeNoteSpacing > 0, "whole note spacing must be positive");
        this.wholeNoteSpacing = wholeNoteSpacing;
        return this;
    }

    public int getMeasureLeftMargin() {
        return measureLeftMargin;
    }

    public LayoutOptions setMeasureLeftMargin(int measureLeftMargin) {
        Validate.isTrue(measureLeftMargin >= 0, "measure margin must not be negative");
        this.measureLeftMargin = measureLeftMargin;
        return this;
    }

    public int getPageHeight() {
        return pageHeight;
    }

    public LayoutOptions setPageHeight(int pageHeight) {
        Validate.isTrue(pageHeight > 0, "page height must be positive");
        this.pageHeight = pageHeight;
        return this;
    }

    public int getPageMarginTop() {
        return pageMarginTop;
    }

    public LayoutOptions setPageMarginTop(int pageMarginTop) {
        Validate.isTrue(pageMarginTop >= 0, "page margin must not be negative");
        this.pageMarginTop = pageMarginTop;
        return this;
    }

    public boolean isLyricVerseCollapse() {
        return lyricVerseCollapse;
    }

    public LayoutOptions setLyricVerseCollapse(boolean lyricVerseCollapse) {
        this.lyricVerseCollapse = lyricVerseCollapse;
        return this;
    }
}
