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

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class InkConfigTest {

    @Test
    void testDefaults() {
        var config = InkConfig.defaults();
        assertEquals(1000, config.getWidth());
        assertEquals(1000, config.getHeight());
        assertEquals(256, config.getRegionCapacity());
        assertEquals(24, config.getMaxDepth());
    }

    @Test
    void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class, () -> InkConfig.builder().width(0).build());
        assertThrows(IllegalArgumentException.class, () -> InkConfig.builder().height(-5).build());
        assertThrows(IllegalArgumentException.class, () -> InkConfig.builder().width(Float.NaN).build());
        assertThrows(IllegalArgumentException.class, () -> InkConfig.builder().regionCapacity(0).build());
        assertThrows(IllegalArgumentException.class, () -> InkConfig.builder().maxDepth(-1).build());
    }

    @Test
    void testToBuilderCopies() {
        var config = InkConfig.builder().width(300).regionCapacity(8).maxDepth(6).build();
        var copy = config.toBuilder().height(200).build();
        assertEquals(300, copy.getWidth());
        assertEquals(200, copy.getHeight());
        assertEquals(8, copy.getRegionCapacity());
        assertEquals(6, copy.getMaxDepth());
    }

    @Test
    void testFromProperties() {
        var properties = new Properties();
        properties.setProperty(InkConfig.PROP_WIDTH, " 640 ");
        properties.setProperty(InkConfig.PROP_MAX_DEPTH, "10");
        var config = InkConfig.fromProperties(properties);
        assertEquals(640, config.getWidth());
        assertEquals(1000, config.getHeight());
        assertEquals(10, config.getMaxDepth());

        properties.setProperty(InkConfig.PROP_CAPACITY, "lots");
        assertThrows(IllegalArgumentException.class, () -> InkConfig.fromProperties(properties));
    }

    @Test
    void testLoadFromClasspathAndSystemProperties() {
        var config = InkConfig.load();
        assertEquals(2048, config.getWidth());
        assertEquals(1536, config.getHeight());
        assertEquals(64, config.getRegionCapacity());

        System.setProperty(InkConfig.PROP_HEIGHT, "768");
        try {
            var overridden = InkConfig.load();
            assertEquals(2048, overridden.getWidth());
            assertEquals(768, overridden.getHeight());
        } finally {
            System.clearProperty(InkConfig.PROP_HEIGHT);
        }
    }
}
