/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

public enum StemDirection {
    NONE, UP, DOWN
}
