/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

/**
 * How the document is laid out. In {@link #FACSIMILE} mode, nodes positioned by a facsimile zone take their
 * coordinates from the image instead of the computed layout
 */
public enum DocType {
    RAW, PAGE_BASED, FACSIMILE
}
