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

import com.hellblazer.quill.quadrant.QuadTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Configuration of an ink document.
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>Meaning</th><th>Default</th></tr>
 *   <tr><td>quill.width</td><td>document width</td><td>1000</td></tr>
 *   <tr><td>quill.height</td><td>document height</td><td>1000</td></tr>
 *   <tr><td>quill.regionCapacity</td><td>points per index region before it splits</td><td>256</td></tr>
 *   <tr><td>quill.maxDepth</td><td>deepest index region</td><td>24</td></tr>
 * </table>
 * <p>
 * {@link #load()} reads {@code quill.properties} from the classpath when present, then applies system property
 * overrides such as {@code -Dquill.width=2048}.
 *
 * @author hal.hildebrand
 */
public final class InkConfig {
    public static final String PROPERTIES_FILE = "quill.properties";
    public static final String PROP_WIDTH      = "quill.width";
    public static final String PROP_HEIGHT     = "quill.height";
    public static final String PROP_CAPACITY   = "quill.regionCapacity";
    public static final String PROP_MAX_DEPTH  = "quill.maxDepth";

    private static final Logger log = LoggerFactory.getLogger(InkConfig.class);

    private static final float DEFAULT_WIDTH  = 1000.0f;
    private static final float DEFAULT_HEIGHT = 1000.0f;

    private final float width;
    private final float height;
    private final int   regionCapacity;
    private final int   maxDepth;

    private InkConfig(Builder builder) {
        this.width = builder.width;
        this.height = builder.height;
        this.regionCapacity = builder.regionCapacity;
        this.maxDepth = builder.maxDepth;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static InkConfig defaults() {
        return builder().build();
    }

    /**
     * Build a configuration from properties; missing keys take their defaults.
     *
     * @throws IllegalArgumentException if a value is malformed or out of range
     */
    public static InkConfig fromProperties(Properties properties) {
        var builder = builder();
        try {
            var width = properties.getProperty(PROP_WIDTH);
            if (width != null) {
                builder.width(Float.parseFloat(width.trim()));
            }
            var height = properties.getProperty(PROP_HEIGHT);
            if (height != null) {
                builder.height(Float.parseFloat(height.trim()));
            }
            var capacity = properties.getProperty(PROP_CAPACITY);
            if (capacity != null) {
                builder.regionCapacity(Integer.parseInt(capacity.trim()));
            }
            var maxDepth = properties.getProperty(PROP_MAX_DEPTH);
            if (maxDepth != null) {
                builder.maxDepth(Integer.parseInt(maxDepth.trim()));
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed ink configuration: " + e.getMessage(), e);
        }
        return builder.build();
    }

    /**
     * Resolve configuration from {@code quill.properties} on the classpath and {@code quill.*} system properties,
     * system properties taking precedence.
     */
    public static InkConfig load() {
        var properties = new Properties();
        try (var in = InkConfig.class.getClassLoader().getResourceAsStream(PROPERTIES_FILE)) {
            if (in != null) {
                properties.load(in);
                log.debug("Loaded {} from classpath", PROPERTIES_FILE);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + PROPERTIES_FILE, e);
        }
        for (var key : new String[] { PROP_WIDTH, PROP_HEIGHT, PROP_CAPACITY, PROP_MAX_DEPTH }) {
            var value = System.getProperty(key);
            if (value != null) {
                properties.setProperty(key, value);
            }
        }
        return fromProperties(properties);
    }

    public float getHeight() {
        return height;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * Number of points an index region holds before it is split
     */
    public int getRegionCapacity() {
        return regionCapacity;
    }

    public float getWidth() {
        return width;
    }

    /**
     * A builder initialized from this configuration
     */
    public Builder toBuilder() {
        return builder().width(width).height(height).regionCapacity(regionCapacity).maxDepth(maxDepth);
    }

    @Override
    public String toString() {
        return "InkConfig[width=" + width + ", height=" + height + ", regionCapacity=" + regionCapacity
        + ", maxDepth=" + maxDepth + "]";
    }

    public static class Builder {
        private float width          = DEFAULT_WIDTH;
        private float height         = DEFAULT_HEIGHT;
        private int   regionCapacity = QuadTree.DEFAULT_CAPACITY;
        private int   maxDepth       = QuadTree.DEFAULT_MAX_DEPTH;

        private Builder() {
        }

        /**
         * @throws IllegalArgumentException if the configured extent or capacity is not positive
         */
        public InkConfig build() {
            if (!(width > 0) || !(height > 0)) {
                throw new IllegalArgumentException("Document extent must be positive: " + width + "x" + height);
            }
            if (regionCapacity <= 0) {
                throw new IllegalArgumentException("Region capacity must be positive: " + regionCapacity);
            }
            if (maxDepth < 0) {
                throw new IllegalArgumentException("Max depth must be non-negative: " + maxDepth);
            }
            return new InkConfig(this);
        }

        public Builder height(float height) {
            this.height = height;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder regionCapacity(int regionCapacity) {
            this.regionCapacity = regionCapacity;
            return this;
        }

        public Builder width(float width) {
            this.width = width;
            return this;
        }
    }
}
