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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.quill.ink.operation.InkOperation;

/**
 * Encodes ink operations to and from their JSON wire form.
 *
 * <pre>
 * {"type":"stylus","id":"...","point":{"x":10.0,"y":20.0,"time":1700000000000,"pressure":0.5}}
 * </pre>
 *
 * @author hal.hildebrand
 */
public class OperationCodec {
    private final ObjectMapper mapper;

    public OperationCodec() {
        this(InkJson.newMapper());
    }

    public OperationCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public InkOperation decode(String json) {
        try {
            return mapper.readValue(json, InkOperation.class);
        } catch (JsonProcessingException e) {
            throw new InkCodecException("Unable to decode ink operation", e);
        }
    }

    public String encode(InkOperation operation) {
        try {
            return mapper.writerFor(InkOperation.class).writeValueAsString(operation);
        } catch (JsonProcessingException e) {
            throw new InkCodecException("Unable to encode ink operation " + operation.type(), e);
        }
    }
}
