/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

/**
 * Closed set of node kinds of the document tree. Each kind carries the prefix used when generating identifiers
 * for nodes of that kind
 */
public enum NodeKind {
    DOC("doc-"),
    PAGE("page-"),
    SYSTEM("system-"),
    SCORE_DEF("scoredef-"),
    STAFF_DEF("staffdef-"),
    MEASURE("measure-"),
    STAFF("staff-"),
    LAYER("layer-"),
    NOTE("note-"),
    CHORD("chord-"),
    REST("rest-"),
    CLEF("clef-"),
    GENERIC_ELEMENT("generic-"),
    VERSE("verse-"),
    SYL("syl-"),
    SLUR("slur-"),
    EDITORIAL("editorial-");

    private final String idPrefix;

    NodeKind(String idPrefix) {
        this.idPrefix = idPrefix;
    }

    public String getIdPrefix() {
        return idPrefix;
    }

    /**
     * @return true for the kinds that can be direct content of a {@link Layer}
     */
    public boolean isLayerElement() {
        return this == NOTE || this == CHORD || this == REST || this == CLEF || this == GENERIC_ELEMENT;
    }

    public boolean isControlElement() {
        return this == SLUR;
    }
}
