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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * An operation on an ink document. Operations are immutable records that fully describe a mutation, so that every
 * replica applying the same operations in the same order reaches the same state.
 * <p>
 * On the wire an operation is a JSON object whose {@code type} property holds its {@link OperationType} wire name.
 *
 * @author hal.hildebrand
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({ @JsonSubTypes.Type(value = CreateStrokeOperation.class, name = "createStroke"),
                @JsonSubTypes.Type(value = StylusOperation.class, name = "stylus"),
                @JsonSubTypes.Type(value = EraseStrokesOperation.class, name = "eraseStrokes"),
                @JsonSubTypes.Type(value = ClearOperation.class, name = "clear") })
public sealed interface InkOperation
permits CreateStrokeOperation, StylusOperation, EraseStrokesOperation, ClearOperation {

    OperationType type();
}
