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

import javax.vecmath.Point2f;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One continuous ink gesture: an append-only sequence of points drawn with a single pen. The stroke tracks the
 * smallest axis-aligned box enclosing every point ever appended; the box only widens. An erased stroke is marked
 * inactive but keeps its points and bounds.
 * <p>
 * Strokes are mutated only by the {@link InkDocument} that owns them.
 *
 * @author hal.hildebrand
 */
public class Stroke {
    private final String         id;
    private final Pen            pen;
    private final List<InkPoint> points;
    private final Point2f        loBound;
    private final Point2f        hiBound;
    private       boolean        inactive;

    Stroke(String id, Pen pen) {
        this(id, pen, List.of(), new Point2f(Float.POSITIVE_INFINITY, Float.POSITIVE_INFINITY),
             new Point2f(Float.NEGATIVE_INFINITY, Float.NEGATIVE_INFINITY), false);
    }

    Stroke(String id, Pen pen, List<InkPoint> points, Point2f loBound, Point2f hiBound, boolean inactive) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.pen = Objects.requireNonNull(pen, "pen cannot be null");
        this.points = new ArrayList<>(points);
        this.loBound = new Point2f(loBound);
        this.hiBound = new Point2f(hiBound);
        this.inactive = inactive;
    }

    /**
     * Maximum x and y over the stroke's points; negative infinity while the stroke is empty
     */
    public Point2f getHiBound() {
        return new Point2f(hiBound);
    }

    public String getId() {
        return id;
    }

    /**
     * Minimum x and y over the stroke's points; positive infinity while the stroke is empty
     */
    public Point2f getLoBound() {
        return new Point2f(loBound);
    }

    public Pen getPen() {
        return pen;
    }

    public List<InkPoint> getPoints() {
        return Collections.unmodifiableList(points);
    }

    public boolean hasBounds() {
        return !points.isEmpty();
    }

    /**
     * True once the stroke has been erased. Renderers skip inactive strokes.
     */
    public boolean isInactive() {
        return inactive;
    }

    public int size() {
        return points.size();
    }

    @Override
    public String toString() {
        return "Stroke[" + id + ", points=" + points.size() + (inactive ? ", inactive" : "") + "]";
    }

    void append(InkPoint point) {
        points.add(point);
        if (point.x > hiBound.x) {
            hiBound.x = point.x;
        }
        if (point.y > hiBound.y) {
            hiBound.y = point.y;
        }
        if (point.x < loBound.x) {
            loBound.x = point.x;
        }
        if (point.y < loBound.y) {
            loBound.y = point.y;
        }
    }

    void setInactive(boolean inactive) {
        this.inactive = inactive;
    }
}
