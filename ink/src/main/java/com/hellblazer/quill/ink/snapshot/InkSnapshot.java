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

import java.util.List;

/**
 * Serializable state of an ink document: its fixed extent and every stroke, erased ones included, in creation order.
 * The stroke index is not part of a snapshot; it is rebuilt from the strokes on load.
 *
 * @author hal.hildebrand
 */
public record InkSnapshot(float width, float height, List<StrokeSnapshot> strokes) {
    public InkSnapshot {
        strokes = strokes == null ? List.of() : List.copyOf(strokes);
    }

    public int pointCount() {
        return strokes.stream().mapToInt(s -> s.points().size()).sum();
    }
}
