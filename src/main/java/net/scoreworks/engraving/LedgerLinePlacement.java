/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

/**
 * Selects one of the four independent ledger line buffers of a {@link Staff}
 */
public enum LedgerLinePlacement {
    ABOVE, BELOW, ABOVE_CUE, BELOW_CUE;

    public static LedgerLinePlacement of(boolean above, boolean cueSize) {
        if (above)
            return cueSize ? ABOVE_CUE : ABOVE;
        return cueSize ? BELOW_CUE : BELOW;
    }
}
