/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

/**
 * Typed tag declaring an optional behavior set a {@link Node} supports. Capabilities are enabled explicitly when a node
 * is built or imported, together with their side data, and are queried by tag instead of probing the node's class.
 * @param <T> class-type of the side data stored with the capability
 */
public final class Capability<T> {

    /** The node can be positioned by a facsimile {@link Zone} */
    public static final Capability<Zone> FACSIMILE = new Capability<>("facsimile", Zone.class);

    /** The node is attached to a point in time, see {@link TimePoint} */
    public static final Capability<TimePoint> TIME_POINT = new Capability<>("time-point", TimePoint.class);

    /** The node spans from one element to another one, possibly across measures, see {@link TimeSpan} */
    public static final Capability<TimeSpan> TIME_SPANNING = new Capability<>("time-spanning", TimeSpan.class);

    private final String name;
    private final Class<T> dataType;

    private Capability(String name, Class<T> dataType) {
        this.name = name;
        this.dataType = dataType;
    }

    public String getName() {
        return name;
    }

    public Class<T> getDataType() {
        return dataType;
    }

    @Override
    public String toString() {
        return name;
    }
}
