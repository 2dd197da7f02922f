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

/**
 * The four children of a split region. Declaration order matches {@link Rectangle#quadrants()}.
 *
 * @author hal.hildebrand
 */
public enum Quadrant {
    NE, NW, SE, SW;

    /**
     * The bounds this quadrant occupies within a parent region
     */
    public Rectangle within(Rectangle parent) {
        return parent.quadrants().get(ordinal());
    }
}
