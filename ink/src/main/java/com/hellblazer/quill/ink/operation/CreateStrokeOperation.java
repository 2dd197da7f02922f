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

import com.hellblazer.quill.ink.Pen;

import java.util.Objects;

/**
 * Creates an empty stroke.
 *
 * @param time milliseconds since the epoch on the originating replica
 * @param id   id of the new stroke, assigned by the originating replica
 * @param pen  pen of the new stroke
 * @author hal.hildebrand
 */
public record CreateStrokeOperation(long time, String id, Pen pen) implements InkOperation {
    public CreateStrokeOperation {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(pen, "pen cannot be null");
    }

    @Override
    public OperationType type() {
        return OperationType.CREATE_STROKE;
    }
}
