/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Side data of {@link Capability#TIME_POINT}: the element a node is attached to and the staves it applies to.
 * References to elements are non-owning and only handed out as views, so the side data can't be used to change the
 * tree.
 */
public class TimePoint {
    private final LayerElement start;
    private final List<Integer> staffNs;

    public TimePoint(@NotNull LayerElement start, List<Integer> staffNs) {
        this.start = start;
        this.staffNs = staffNs == null ? Collections.emptyList() : List.copyOf(staffNs);
    }

    public LayerElementView getStart() {
        return start;
    }

    LayerElement start() {
        return start;
    }

    public List<Integer> getStaffNs() {
        return staffNs;
    }

    public MeasureView getStartMeasure() {
        Node measure = start.getFirstAncestor(NodeKind.MEASURE);
        return measure == null ? null : measure.asMeasure();
    }

    /**
     * @return true if the node applies to the staff with number n. Without explicit staff numbers, this is the staff
     * of the start element
     */
    public boolean isOnStaff(int n) {
        if (!staffNs.isEmpty())
            return staffNs.contains(n);
        Node staff = start.getFirstAncestor(NodeKind.STAFF);
        return staff != null && staff.asStaff().getN() == n;
    }

    /**
     * @param copies copied elements keyed by their originals
     * @return a time point with the same staves pointing to the copy of the start element, if there is one
     */
    public TimePoint remapElements(Map<Node, Node> copies) {
        return new TimePoint(remap(start, copies), staffNs);
    }

    static LayerElement remap(LayerElement element, Map<Node, Node> copies) {
        Node copy = copies.get(element);
        return copy == null ? element : copy.asLayerElement();
    }
}
