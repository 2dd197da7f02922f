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
package com.hellblazer.quill.quadrant.debug;

/**
 * Structural statistics of a quad tree.
 *
 * @author hal.hildebrand
 */
public record QuadTreeStats(int leafCount, int internalCount, int maxDepth, int pointCount, int anonymousPointCount,
                            int distinctIdCount, int emptyLeafCount) {

    public double averagePointsPerLeaf() {
        return leafCount > 0 ? (double) pointCount / leafCount : 0;
    }

    public int regionCount() {
        return leafCount + internalCount;
    }
}
