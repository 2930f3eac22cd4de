/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

/**
 * The notation system in effect for a staff
 */
public enum NotationType {
    CMN,
    MENSURAL,
    MENSURAL_WHITE,
    MENSURAL_BLACK,
    NEUME,
    TAB,
    TAB_GUITAR,
    TAB_LUTE_ITALIAN,
    TAB_LUTE_FRENCH,
    TAB_LUTE_GERMAN;

    public boolean isMensural() {
        return this == MENSURAL || this == MENSURAL_WHITE || this == MENSURAL_BLACK;
    }

    public boolean isNeume() {
        return this == NEUME;
    }

    public boolean isTablature() {
        return this == TAB || this == TAB_GUITAR || this == TAB_LUTE_ITALIAN || this == TAB_LUTE_FRENCH
                || this == TAB_LUTE_GERMAN;
    }
}
