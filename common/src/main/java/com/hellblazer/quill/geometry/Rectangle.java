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
package com.hellblazer.quill.geometry;

import javax.vecmath.Tuple2f;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Axis-aligned rectangle in the plane, defined by its origin (minimum corner) and extents. Containment is half-open:
 * a rectangle owns its minimum edges but not its maximum edges, so the four quadrants produced by
 * {@link #quadrants()} partition the parent without sharing boundary points.
 *
 * @author hal.hildebrand
 */
public record Rectangle(float x, float y, float width, float height) {

    /**
     * Create a rectangle of the given extents centered on a point
     */
    public static Rectangle around(Tuple2f center, float width, float height) {
        return new Rectangle(center.x - width / 2.0f, center.y - height / 2.0f, width, height);
    }

    /**
     * Create a rectangle from its minimum and maximum corners
     */
    public static Rectangle fromCorners(float minX, float minY, float maxX, float maxY) {
        return new Rectangle(minX, minY, maxX - minX, maxY - minY);
    }

    public float area() {
        return width * height;
    }

    /**
     * Half-open containment: {@code x in [x, x + width)} and {@code y in [y, y + height)}
     */
    public boolean containsPoint(float px, float py) {
        return px >= x && px < x + width && py >= y && py < y + height;
    }

    public boolean containsPoint(Tuple2f p) {
        return containsPoint(p.x, p.y);
    }

    /**
     * Compute the overlapping region of this rectangle and another.
     *
     * @return the overlap, or empty if the rectangles are disjoint or only share an edge or corner
     */
    public Optional<Rectangle> intersection(Rectangle other) {
        var minX = Math.max(x, other.x);
        var minY = Math.max(y, other.y);
        var w = Math.min(maxX(), other.maxX()) - minX;
        var h = Math.min(maxY(), other.maxY()) - minY;
        if (w <= 0 || h <= 0) {
            return Optional.empty();
        }
        return Optional.of(new Rectangle(minX, minY, w, h));
    }

    /**
     * True if the rectangles share an area greater than zero
     */
    public boolean intersects(Rectangle other) {
        return Math.min(maxX(), other.maxX()) - Math.max(x, other.x) > 0
        && Math.min(maxY(), other.maxY()) - Math.max(y, other.y) > 0;
    }

    public float maxX() {
        return x + width;
    }

    public float maxY() {
        return y + height;
    }

    /**
     * The four half-size sub-rectangles tiling this one, in {@code ne, nw, se, sw} order. Offsets are relative to this
     * rectangle's origin; {@code ne}/{@code nw} share the minimum y edge.
     */
    public List<Rectangle> quadrants() {
        var halfW = width / 2.0f;
        var halfH = height / 2.0f;
        return List.of(new Rectangle(x + halfW, y, halfW, halfH), new Rectangle(x, y, halfW, halfH),
                       new Rectangle(x + halfW, y + halfH, halfW, halfH), new Rectangle(x, y + halfH, halfW, halfH));
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "Rectangle[(%.2f,%.2f) %.2fx%.2f]", x, y, width, height);
    }
}
