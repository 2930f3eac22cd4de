/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

import net.scoreworks.engraving.exceptions.ContractViolationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Hands out the {@link StaffAlignment}s of one system, keyed by the position of the staff within its measure. Slots
 * are created the first time a position is asked for and shared by all measures of the system.
 * Allocation is not synchronized, systems can't be aligned in parallel.
 */
public class SystemAligner {
    private final StaffSystem system;
    private final List<StaffAlignment> alignments = new ArrayList<>();
    private int totalHeight;

    SystemAligner(StaffSystem system) {
        this.system = system;
    }

    public StaffSystem getSystem() {
        return system;
    }

    /**
     * Get the slot at a staff position or create it
     * @throws ContractViolationException if positions are skipped
     */
    public StaffAlignment getStaffAlignment(int staffIdx, Staff staff, Doc doc) {
        if (staffIdx < alignments.size())
            return alignments.get(staffIdx);
        if (staffIdx > alignments.size())
            throw new ContractViolationException("Staff position " + staffIdx + " requested but only "
                    + alignments.size() + " slots exist in " + system);
        StaffAlignment alignment = new StaffAlignment(staffIdx, staff, doc.getOptions().isLyricVerseCollapse());
        alignments.add(alignment);
        return alignment;
    }

    public List<StaffAlignment> getStaffAlignments() {
        return Collections.unmodifiableList(alignments);
    }

    /**
     * Stack the slots from top to bottom. The first slot sits at the system's Y, every following slot is moved down
     * by the height of the slots above it
     */
    public void computeOffsets(Doc doc) {
        int y = 0;
        for (StaffAlignment alignment : alignments) {
            alignment.setYRel(y);
            y -= alignment.getHeight(doc);
        }
        totalHeight = -y;
    }

    /**
     * @return the height of all slots as computed by the last {@link #computeOffsets(Doc)}
     */
    public int getTotalHeight() {
        return totalHeight;
    }
}
