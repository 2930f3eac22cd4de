/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving.functors;

import net.scoreworks.engraving.LayerView;
import net.scoreworks.engraving.LayoutSnapshot;
import net.scoreworks.engraving.StaffView;

/**
 * Collect the geometry of all visible staves and their layers into a {@link LayoutSnapshot}
 */
public class GeometrySnapshotFunctor extends ConstFunctor {
    private final LayoutSnapshot snapshot = new LayoutSnapshot();

    public GeometrySnapshotFunctor(PassContext context) {
        super(context);
    }

    @Override
    public FunctorCode visitStaff(StaffView staff) {
        if (!staff.isVisible())
            return FunctorCode.SKIP_CHILDREN;
        snapshot.addStaff(staff);
        return FunctorCode.CONTINUE;
    }

    @Override
    public FunctorCode visitLayer(LayerView layer) {
        snapshot.addLayer(layer);
        return FunctorCode.SKIP_CHILDREN;
    }

    public LayoutSnapshot getSnapshot() {
        return snapshot;
    }
}
