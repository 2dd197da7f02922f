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
package com.hellblazer.quill.ink.operation;

import com.hellblazer.quill.ink.InkPoint;

import java.util.Objects;

/**
 * Appends one point to a stroke.
 *
 * @param id    the stroke appended to
 * @param point the appended point
 * @author hal.hildebrand
 */
public record StylusOperation(String id, InkPoint point) implements InkOperation {
    public StylusOperation {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(point, "point cannot be null");
    }

    @Override
    public OperationType type() {
        return OperationType.STYLUS;
    }
}
