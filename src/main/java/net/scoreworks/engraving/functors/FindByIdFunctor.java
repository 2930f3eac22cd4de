/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving.functors;

import net.scoreworks.engraving.NodeView;

/**
 * Look up a node by its identifier. The traversal stops at the first match.
 */
public class FindByIdFunctor extends ConstFunctor {
    private final String id;
    private NodeView found;

    public FindByIdFunctor(PassContext context, String id) {
        super(context);
        this.id = id;
    }

    @Override
    public FunctorCode visitNode(NodeView node) {
        if (id.equals(node.getId())) {
            found = node;
            return FunctorCode.STOP;
        }
        return FunctorCode.CONTINUE;
    }

    /**
     * @return the node found or null
     */
    public NodeView getFound() {
        return found;
    }
}
