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

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.hellblazer.quill.ink.InkPoint;

import java.io.IOException;

/**
 * Jackson configuration shared by the ink codecs. Ink points are written as {@code {x, y, time, pressure}} objects.
 *
 * @author hal.hildebrand
 */
public final class InkJson {

    private InkJson() {
    }

    /**
     * Create a mapper configured for ink operations and snapshots
     */
    public static ObjectMapper newMapper() {
        var mapper = new ObjectMapper();
        mapper.registerModule(module());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    static SimpleModule module() {
        var module = new SimpleModule("quill-ink");
        module.addSerializer(InkPoint.class, new InkPointSerializer());
        module.addDeserializer(InkPoint.class, new InkPointDeserializer());
        return module;
    }

    static class InkPointDeserializer extends JsonDeserializer<InkPoint> {
        @Override
        public InkPoint deserialize(JsonParser parser, DeserializationContext context) throws IOException {
            JsonNode node = parser.getCodec().readTree(parser);
            var x = node.get("x");
            var y = node.get("y");
            if (x == null || y == null) {
                throw MismatchedInputException.from(parser, InkPoint.class, "Ink point requires x and y");
            }
            var time = node.path("time").asLong(0L);
            var pressure = node.has("pressure") ? node.get("pressure").floatValue() : 1.0f;
            return new InkPoint(x.floatValue(), y.floatValue(), time, pressure);
        }
    }

    static class InkPointSerializer extends JsonSerializer<InkPoint> {
        @Override
        public void serialize(InkPoint point, JsonGenerator generator, SerializerProvider serializers)
        throws IOException {
            generator.writeStartObject();
            generator.writeNumberField("x", point.x);
            generator.writeNumberField("y", point.y);
            generator.writeNumberField("time", point.getTime());
            generator.writeNumberField("pressure", point.getPressure());
            generator.writeEndObject();
        }
    }
}
