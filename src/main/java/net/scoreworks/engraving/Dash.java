/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

import java.util.Objects;

/**
 * Horizontal interval of one ledger line dash
 */
public final class Dash {
    private final int left;
    private final int right;

    public Dash(int left, int right) {
        this.left = left;
        this.right = right;
    }

    public int getLeft() {
        return left;
    }

    public int getRight() {
        return right;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Dash)) {
            return false;
        }
        Dash other = (Dash) o;
        return left == other.left && right == other.right;
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, right);
    }

    @Override
    public String toString() {
        return "(" + left + ", " + right + ")";
    }
}
