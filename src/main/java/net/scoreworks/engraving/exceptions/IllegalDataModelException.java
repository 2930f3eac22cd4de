/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving.exceptions;

import net.scoreworks.engraving.NodeKind;
import net.scoreworks.engraving.NodeView;

/**
 * An exception that gets thrown if a node is used as a kind it is not, or if side data of a capability the node does
 * not carry is requested. Kind and identifier of the offending node are kept for callers that want to report it
 */
public class IllegalDataModelException extends RuntimeException {
    private final NodeKind kind;
    private final String nodeId;

    public IllegalDataModelException(NodeView node, String message) {
        super(node.getKind() + " " + node.getId() + " " + message);
        this.kind = node.getKind();
        this.nodeId = node.getId();
    }

    public NodeKind getKind() {
        return kind;
    }

    public String getNodeId() {
        return nodeId;
    }
}
