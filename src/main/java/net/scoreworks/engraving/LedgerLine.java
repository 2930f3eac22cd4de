/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

import net.scoreworks.engraving.exceptions.ContractViolationException;

import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.ListIterator;

/**
 * The dashes of one ledger line slot. Dashes are kept sorted by their left edge and overlapping dashes are merged
 * after every insertion, so the list is always sorted and free of overlaps beyond the merge threshold.
 */
public class LedgerLine {
    private final LinkedList<Dash> dashes = new LinkedList<>();

    /**
     * Insert a dash and merge dashes overlapping by more than 1.5 extensions. Dashes of the same chord overlap by at
     * least two extensions and get merged, dashes of adjacent notes don't.
     */
    void addDash(int left, int right, int extension) {
        if (left >= right)
            throw new ContractViolationException("Ledger line dash needs left < right but got (" + left + ", " + right + ")");

        //insert sorted by left edge
        ListIterator<Dash> iterator = dashes.listIterator();
        while (iterator.hasNext()) {
            if (iterator.next().getLeft() > left) {
                iterator.previous();
                break;
            }
        }
        iterator.add(new Dash(left, right));

        //single forward sweep, right edges never shrink when merging
        iterator = dashes.listIterator();
        Dash previous = iterator.next();
        while (iterator.hasNext()) {
            Dash current = iterator.next();
            if (previous.getRight() > current.getLeft() + 1.5 * extension) {
                iterator.remove();
                previous = new Dash(previous.getLeft(), Math.max(previous.getRight(), current.getRight()));
                iterator.previous();
                iterator.set(previous);
                iterator.next();
            }
            else {
                previous = current;
            }
        }
    }

    public List<Dash> getDashes() {
        return Collections.unmodifiableList(dashes);
    }

    public boolean isEmpty() {
        return dashes.isEmpty();
    }

    void clear() {
        dashes.clear();
    }

    @Override
    public String toString() {
        return dashes.toString();
    }
}
