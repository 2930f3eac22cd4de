/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

import java.util.*;

/**
 * Copy of the geometry a renderer reads from a laid out document, keyed by node identifier: drawing Y and ledger
 * lines of each staff and the stem direction of each layer. Two snapshots are equal if the layouts they were taken
 * from are identical.
 */
public class LayoutSnapshot {
    private final Map<String, Integer> staffDrawingYs = new LinkedHashMap<>();
    private final Map<String, Map<LedgerLinePlacement, List<List<Dash>>>> ledgerLines = new LinkedHashMap<>();
    private final Map<String, StemDirection> stemDirections = new LinkedHashMap<>();

    public void addStaff(StaffView staff) {
        staffDrawingYs.put(staff.getId(), staff.getDrawingY());
        Map<LedgerLinePlacement, List<List<Dash>>> buffers = new EnumMap<>(LedgerLinePlacement.class);
        for (LedgerLinePlacement placement : LedgerLinePlacement.values()) {
            List<List<Dash>> lines = new ArrayList<>();
            for (LedgerLine line : staff.getLedgerLines(placement)) {
                lines.add(List.copyOf(line.getDashes()));
            }
            buffers.put(placement, Collections.unmodifiableList(lines));
        }
        ledgerLines.put(staff.getId(), buffers);
    }

    public void addLayer(LayerView layer) {
        stemDirections.put(layer.getId(), layer.getDrawingStemDir());
    }

    public Set<String> getStaffIds() {
        return Collections.unmodifiableSet(staffDrawingYs.keySet());
    }

    /**
     * @return the drawing Y of the staff, null if the snapshot has no such staff
     */
    public Integer getStaffDrawingY(String staffId) {
        return staffDrawingYs.get(staffId);
    }

    public List<List<Dash>> getLedgerLines(String staffId, LedgerLinePlacement placement) {
        Map<LedgerLinePlacement, List<List<Dash>>> buffers = ledgerLines.get(staffId);
        return buffers == null ? Collections.emptyList() : buffers.get(placement);
    }

    public StemDirection getStemDirection(String layerId) {
        return stemDirections.get(layerId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LayoutSnapshot that = (LayoutSnapshot) o;
        return staffDrawingYs.equals(that.staffDrawingYs) && ledgerLines.equals(that.ledgerLines)
                && stemDirections.equals(that.stemDirections);
    }

    @Override
    public int hashCode() {
        return Objects.hash(staffDrawingYs, ledgerLines, stemDirections);
    }

    @Override
    public String toString() {
        return "LayoutSnapshot{staffDrawingYs=" + staffDrawingYs + ", stemDirections=" + stemDirections + "}";
    }
}
