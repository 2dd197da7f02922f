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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class OperationTypeTest {

    @ParameterizedTest
    @EnumSource(OperationType.class)
    void testWireNameRoundTrip(OperationType type) {
        assertSame(type, OperationType.fromWireName(type.wireName()));
    }

    @Test
    void testWireNames() {
        assertEquals("createStroke", OperationType.CREATE_STROKE.wireName());
        assertEquals("stylus", OperationType.STYLUS.wireName());
        assertEquals("eraseStrokes", OperationType.ERASE_STROKES.wireName());
        assertEquals("clear", OperationType.CLEAR.wireName());
        assertThrows(IllegalArgumentException.class, () -> OperationType.fromWireName("smudge"));
    }

    @Test
    void testEraseCopiesIds() {
        var ids = new ArrayList<>(List.of("a", "b"));
        var erase = new EraseStrokesOperation(ids);
        ids.add("c");
        assertEquals(List.of("a", "b"), erase.ids());
        assertSame(OperationType.ERASE_STROKES, erase.type());
    }
}
