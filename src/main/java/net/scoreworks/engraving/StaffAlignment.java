/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

import org.apache.commons.collections4.BidiMap;
import org.apache.commons.collections4.bidimap.DualTreeBidiMap;
import org.apache.commons.collections4.bidimap.UnmodifiableBidiMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Vertical slot of the staves at one position within a system. Holds the offset of the slot relative to the system
 * and the verses of lyrics displayed under it.
 */
public class StaffAlignment {
    private final int staffIdx;
    private final boolean verseCollapse;

    /**
     * Staff that made the slot be created, non-owning. Its size determines the height of the slot
     */
    private final Staff staff;

    private int yRel;

    /**
     * Verse number to display position, sorted by verse number
     */
    private final BidiMap<Integer, Integer> versePositions = new DualTreeBidiMap<>();

    StaffAlignment(int staffIdx, Staff staff, boolean verseCollapse) {
        this.staffIdx = staffIdx;
        this.staff = staff;
        this.verseCollapse = verseCollapse;
    }

    public int getStaffIdx() {
        return staffIdx;
    }

    public Staff getStaff() {
        return staff;
    }

    public int getYRel() {
        return yRel;
    }

    void setYRel(int yRel) {
        this.yRel = yRel;
    }

    /**
     * Register a verse number. A number that is already registered is left alone, which happens when a verse is
     * met again in a later measure it spans into.
     * @return true if the number was not registered before
     */
    public boolean addVerseN(int verseN) {
        if (versePositions.containsKey(verseN))
            return false;
        //positions of collapsed verses depend on the verses present, recompute them. Values are unique in the map,
        //so it has to be cleared before
        List<Integer> verseNs = new ArrayList<>(versePositions.keySet());
        verseNs.add(verseN);
        Collections.sort(verseNs);
        versePositions.clear();
        int rank = 0;
        for (Integer n : verseNs) {
            versePositions.put(n, verseCollapse ? rank : n - 1);
            rank++;
        }
        return true;
    }

    public boolean hasVerseN(int verseN) {
        return versePositions.containsKey(verseN);
    }

    /**
     * @return the display position of a verse, 0 being the first line below the staff, or null if not registered
     */
    public Integer getVersePosition(int verseN) {
        return versePositions.get(verseN);
    }

    /**
     * @return the verse displayed at a position or null if there is none
     */
    public Integer getVerseNAt(int position) {
        return versePositions.getKey(position);
    }

    public BidiMap<Integer, Integer> getVersePositions() {
        return UnmodifiableBidiMap.unmodifiableBidiMap(versePositions);
    }

    /**
     * @return number of lyric lines to reserve below the staff
     */
    public int getVerseLineCount() {
        int count = 0;
        for (Integer position : versePositions.values()) {
            count = Math.max(count, position + 1);
        }
        return count;
    }

    /**
     * @return the height the slot takes: staff, lyric lines and spacing to the next slot
     */
    public int getHeight(Doc doc) {
        LayoutOptions options = doc.getOptions();
        int unit = doc.getDrawingUnit(staff.getDrawingStaffSize());
        int staffHeight = (staff.getDrawingLines() - 1) * 2 * unit;
        int lyricHeight = getVerseLineCount() * options.getLyricSize() * unit;
        return staffHeight + lyricHeight + options.getSpacingStaff() * options.getUnit();
    }

    @Override
    public String toString() {
        return "StaffAlignment[" + staffIdx + ", yRel=" + yRel + ", verses=" + versePositions + "]";
    }
}
