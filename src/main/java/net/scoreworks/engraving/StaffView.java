/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

import java.util.List;

public interface StaffView extends NodeView {

    int getN();

    boolean isVisible();

    NotationType getDrawingNotationType();

    int getDrawingStaffSize();

    int getDrawingLines();

    /**
     * @return the drawing Y resolved by the last vertical alignment
     */
    int getDrawingY();

    int getDrawingX();

    double getDrawingRotate();

    /**
     * @return the ledger lines of one buffer, outermost slot last. Neither the list nor the lines can be modified
     */
    List<LedgerLine> getLedgerLines(LedgerLinePlacement placement);
}
