/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Map;

/**
 * Side data of {@link Capability#TIME_SPANNING}: a {@link TimePoint} extended by an end element
 */
public class TimeSpan extends TimePoint {
    private final LayerElement end;

    public TimeSpan(@NotNull LayerElement start, @NotNull LayerElement end) {
        this(start, end, null);
    }

    public TimeSpan(@NotNull LayerElement start, @NotNull LayerElement end, List<Integer> staffNs) {
        super(start, staffNs);
        this.end = end;
    }

    public LayerElementView getEnd() {
        return end;
    }

    public MeasureView getEndMeasure() {
        Node measure = end.getFirstAncestor(NodeKind.MEASURE);
        return measure == null ? null : measure.asMeasure();
    }

    public boolean isSpanningMeasures() {
        return getStartMeasure() != getEndMeasure();
    }

    /**
     * @return a span with the same staves pointing to the copies of its start and end elements, where there are any
     */
    @Override
    public TimeSpan remapElements(Map<Node, Node> copies) {
        return new TimeSpan(remap(start(), copies), remap(end, copies), getStaffNs());
    }
}
