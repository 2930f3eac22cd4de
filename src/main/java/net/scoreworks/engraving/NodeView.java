/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

import net.scoreworks.engraving.functors.ConstFunctor;
import net.scoreworks.engraving.functors.FunctorCode;

import java.util.List;

/**
 * Read-only access to a node of the document tree. This is all a {@link ConstFunctor} gets to see, so read-only
 * traversals can't change the tree structure.
 */
public interface NodeView {

    NodeKind getKind();

    String getId();

    NodeView getParent();

    /**
     * @return the children in document order. The list can't be modified
     */
    List<? extends NodeView> getChildren();

    int getChildCount(NodeKind kind);

    /**
     * @return the nearest ancestor of the given kind or null if there is none
     */
    NodeView getFirstAncestor(NodeKind kind);

    boolean hasCapability(Capability<?> capability);

    /**
     * @return side data of an enabled capability
     * @throws net.scoreworks.engraving.exceptions.IllegalDataModelException if the capability is not enabled
     */
    <T> T getCapabilityData(Capability<T> capability);

    /**
     * Run a read-only traversal starting with this node
     */
    FunctorCode process(ConstFunctor functor);
}
