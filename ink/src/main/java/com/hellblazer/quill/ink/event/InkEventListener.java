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
package com.hellblazer.quill.ink.event;

import com.hellblazer.quill.ink.operation.InkOperation;

/**
 * Receives document events. Each event carries the operation that caused it and is delivered synchronously, after
 * the document has finished applying the operation, to listeners in registration order.
 * <p>
 * Exceptions thrown by listeners are caught and logged by the document, so one failing listener doesn't affect
 * others or the document state.
 *
 * Example usage:
 * <pre>
 * document.addListener(OperationType.STYLUS, operation -> {
 *     var stylus = (StylusOperation) operation;
 *     renderer.drawSegment(stylus.id(), stylus.point());
 * });
 * </pre>
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface InkEventListener {

    void onEvent(InkOperation operation);
}
