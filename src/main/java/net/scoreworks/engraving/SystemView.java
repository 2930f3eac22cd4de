/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

public interface SystemView extends NodeView {

    int getDrawingY();
}
