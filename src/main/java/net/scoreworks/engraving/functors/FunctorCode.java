/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving.functors;

/**
 * Traversal directive returned by every functor handler
 */
public enum FunctorCode {
    /** descend into the children of the node */
    CONTINUE,
    /** don't descend, run the end handler of the node right away */
    SKIP_CHILDREN,
    /** don't descend and abandon the remaining siblings of the node. Traversal goes on with the parent's end handler */
    SKIP_SIBLINGS,
    /** abort the whole traversal, no further handler is called */
    STOP
}
