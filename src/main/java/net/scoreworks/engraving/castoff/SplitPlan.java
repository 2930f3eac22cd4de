/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving.castoff;

import net.scoreworks.engraving.exceptions.ContractViolationException;
import org.apache.commons.lang3.Validate;
import org.apache.commons.lang3.math.Fraction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Time positions within a measure at which a new segment begins. n breaks cut a measure into n+1 segments, an element
 * belongs to the last segment starting at or before its onset.
 */
public final class SplitPlan {
    private final List<Fraction> breaks;

    /**
     * @throws ContractViolationException if the breaks are not positive and strictly increasing
     */
    public SplitPlan(List<Fraction> breaks) {
        Validate.noNullElements(breaks, "split plan contains a null break at index %d");
        Fraction previous = Fraction.ZERO;
        for (Fraction position : breaks) {
            if (position.compareTo(previous) <= 0)
                throw new ContractViolationException("Split plan breaks must be positive and increasing: " + breaks);
            previous = position;
        }
        this.breaks = Collections.unmodifiableList(new ArrayList<>(breaks));
    }

    public static SplitPlan of(Fraction... breaks) {
        return new SplitPlan(Arrays.asList(breaks));
    }

    public List<Fraction> getBreaks() {
        return breaks;
    }

    public int getSegmentCount() {
        return breaks.size() + 1;
    }

    public int getSegmentIndex(Fraction onset) {
        int index = 0;
        for (Fraction position : breaks) {
            if (onset.compareTo(position) < 0)
                break;
            index++;
        }
        return index;
    }

    @Override
    public String toString() {
        return "SplitPlan" + breaks;
    }
}
