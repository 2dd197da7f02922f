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
package com.hellblazer.quill.ink.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.quill.ink.Color;
import com.hellblazer.quill.ink.InkPoint;
import com.hellblazer.quill.ink.Pen;
import com.hellblazer.quill.ink.operation.ClearOperation;
import com.hellblazer.quill.ink.operation.CreateStrokeOperation;
import com.hellblazer.quill.ink.operation.EraseStrokesOperation;
import com.hellblazer.quill.ink.operation.InkOperation;
import com.hellblazer.quill.ink.operation.StylusOperation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class OperationCodecTest {
    private final OperationCodec codec  = new OperationCodec();
    private final ObjectMapper   mapper = new ObjectMapper();

    static Stream<InkOperation> operations() {
        return Stream.of(new CreateStrokeOperation(17L, "a", new Pen(new Color(10, 20, 30, 1.0f), 3.5f)),
                         new StylusOperation("a", new InkPoint(1.5f, 2.25f, 99L, 0.5f)),
                         new EraseStrokesOperation(List.of("a", "b")), new ClearOperation(1234L));
    }

    @ParameterizedTest
    @MethodSource("operations")
    void testTypeDiscriminatorUsesWireName(InkOperation operation) throws Exception {
        var json = codec.encode(operation);
        assertEquals(operation.type().wireName(), mapper.readTree(json).get("type").asText());
        assertEquals(operation, codec.decode(json));
    }

    @Test
    void testStylusWireShape() throws Exception {
        var node = mapper.readTree(codec.encode(new StylusOperation("s", new InkPoint(3, 4, 5L, 0.25f))));
        assertEquals("s", node.get("id").asText());
        var point = node.get("point");
        assertEquals(3.0, point.get("x").asDouble());
        assertEquals(4.0, point.get("y").asDouble());
        assertEquals(5L, point.get("time").asLong());
        assertEquals(0.25, point.get("pressure").asDouble());
    }

    @Test
    void testDecodeDefaultsMissingPointFields() {
        var decoded = codec.decode("{\"type\":\"stylus\",\"id\":\"s\",\"point\":{\"x\":7,\"y\":8}}");
        assertEquals(new StylusOperation("s", InkPoint.at(7, 8)), decoded);
    }

    @Test
    void testDecodeIgnoresUnknownProperties() {
        var decoded = codec.decode("{\"type\":\"clear\",\"time\":5,\"origin\":\"elsewhere\"}");
        assertEquals(new ClearOperation(5L), decoded);
    }

    @Test
    void testMalformedInput() {
        assertThrows(InkCodecException.class, () -> codec.decode("{\"type\":\"smudge\"}"));
        assertThrows(InkCodecException.class, () -> codec.decode("{\"type\":\"stylus\",\"id\":\"s\",\"point\":{}}"));
        assertThrows(InkCodecException.class, () -> codec.decode("not json"));
    }
}
