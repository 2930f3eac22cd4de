/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

/**
 * Immutable rectangular region of a facsimile image. Side data of {@link Capability#FACSIMILE}
 */
public final class Zone {
    private final int ulx;
    private final int uly;
    private final int lrx;
    private final int lry;
    /** rotation in degrees */
    private final double rotate;

    public Zone(int ulx, int uly, int lrx, int lry) {
        this(ulx, uly, lrx, lry, 0);
    }

    public Zone(int ulx, int uly, int lrx, int lry, double rotate) {
        this.ulx = ulx;
        this.uly = uly;
        this.lrx = lrx;
        this.lry = lry;
        this.rotate = rotate;
    }

    public int getUlx() {
        return ulx;
    }

    public int getUly() {
        return uly;
    }

    public int getLrx() {
        return lrx;
    }

    public int getLry() {
        return lry;
    }

    public double getRotate() {
        return rotate;
    }
}
