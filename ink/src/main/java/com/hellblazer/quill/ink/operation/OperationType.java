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

import java.util.Arrays;

/**
 * The kinds of ink operation, each with the name used for it on the wire and for its document event.
 *
 * @author hal.hildebrand
 */
public enum OperationType {
    CREATE_STROKE("createStroke"), STYLUS("stylus"), ERASE_STROKES("eraseStrokes"), CLEAR("clear");

    private final String wireName;

    OperationType(String wireName) {
        this.wireName = wireName;
    }

    public static OperationType fromWireName(String wireName) {
        return Arrays.stream(values())
                     .filter(t -> t.wireName.equals(wireName))
                     .findFirst()
                     .orElseThrow(() -> new IllegalArgumentException("Unknown operation type: " + wireName));
    }

    public String wireName() {
        return wireName;
    }
}
