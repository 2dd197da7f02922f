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
package com.hellblazer.quill.ink;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates the ids of new strokes. Ids must be unique across every replica of a document.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface StrokeIdGenerator {

    /**
     * Random UUID ids, unique across replicas without coordination
     */
    static StrokeIdGenerator uuid() {
        return () -> UUID.randomUUID().toString();
    }

    /**
     * Sequential ids with a replica specific prefix, e.g. {@code "a-0", "a-1"}. Unique across replicas only if every
     * replica uses a distinct prefix.
     */
    static StrokeIdGenerator sequential(String prefix) {
        var next = new AtomicLong();
        return () -> prefix + "-" + next.getAndIncrement();
    }

    String generateId();
}
