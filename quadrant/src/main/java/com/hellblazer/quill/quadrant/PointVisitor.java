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

import javax.vecmath.Tuple2f;

/**
 * Receives the points matched by {@link QuadTree#search}.
 *
 * @param <P> the point type
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface PointVisitor<P extends Tuple2f> {

    /**
     * Visit one matched point.
     *
     * @param point the indexed point
     * @param id    the owning id, or null for an anonymous point
     * @return true to stop scanning the point list currently being iterated. Other lists of the same leaf, and other
     * leaves, are still searched.
     */
    boolean visit(P point, String id);
}
