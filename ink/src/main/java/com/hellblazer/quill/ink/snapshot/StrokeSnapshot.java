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
package com.hellblazer.quill.ink.snapshot;

import com.hellblazer.quill.ink.InkPoint;
import com.hellblazer.quill.ink.Pen;

import java.util.List;
import java.util.Objects;

/**
 * Serializable state of one stroke. Bounds are null for a stroke without points.
 *
 * @author hal.hildebrand
 */
public record StrokeSnapshot(String id, List<InkPoint> points, Pen pen, Bound loBound, Bound hiBound,
                             boolean inactive) {
    public StrokeSnapshot {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(pen, "pen cannot be null");
        points = points == null ? List.of() : List.copyOf(points);
    }

    /**
     * A corner of a stroke's bounding box
     */
    public record Bound(float x, float y) {
    }
}
