/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Quill.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.quill.quadrant;

import com.hellblazer.quill.geometry.Rectangle;

import java.util.List;

/**
 * Observer notified after a region of a {@link QuadTree} has been split and its points redistributed.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface SplitListener {

    /**
     * @param children bounds of the four new child regions, in {@link Quadrant} order
     */
    void onSplit(List<Rectangle> children);
}
