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
import com.hellblazer.quill.ink.snapshot.InkSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes ink snapshots as a single UTF-8 JSON blob:
 *
 * <pre>
 * {"width":1000.0,"height":1000.0,"strokes":[{"id":"...","points":[{"x":1.0,"y":2.0,"time":0,"pressure":1.0}],
 *   "pen":{"color":{"r":0,"g":0,"b":0,"a":1.0},"thickness":2.0},
 *   "loBound":{"x":1.0,"y":2.0},"hiBound":{"x":1.0,"y":2.0},"inactive":false}]}
 * </pre>
 *
 * @author hal.hildebrand
 */
public class InkSnapshotCodec {
    private static final Logger log = LoggerFactory.getLogger(InkSnapshotCodec.class);

    private final ObjectMapper mapper;

    public InkSnapshotCodec() {
        this(InkJson.newMapper());
    }

    public InkSnapshotCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public InkSnapshot fromBytes(byte[] blob) {
        try {
            return mapper.readValue(blob, InkSnapshot.class);
        } catch (IOException e) {
            throw new InkCodecException("Unable to decode ink snapshot", e);
        }
    }

    public InkSnapshot fromJson(String json) {
        return fromBytes(json.getBytes(StandardCharsets.UTF_8));
    }

    public InkSnapshot read(Path file) throws IOException {
        var snapshot = fromBytes(Files.readAllBytes(file));
        log.info("Read snapshot of {} strokes from {}", snapshot.strokes().size(), file);
        return snapshot;
    }

    public byte[] toBytes(InkSnapshot snapshot) {
        try {
            return mapper.writeValueAsBytes(snapshot);
        } catch (IOException e) {
            throw new InkCodecException("Unable to encode ink snapshot", e);
        }
    }

    public String toJson(InkSnapshot snapshot) {
        return new String(toBytes(snapshot), StandardCharsets.UTF_8);
    }

    public void write(InkSnapshot snapshot, Path file) throws IOException {
        Files.write(file, toBytes(snapshot));
        log.info("Wrote snapshot of {} strokes to {}", snapshot.strokes().size(), file);
    }
}
