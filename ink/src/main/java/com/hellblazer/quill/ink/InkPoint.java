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
import javax.vecmath.Tuple2f;
import java.util.Locale;
import java.util.Objects;

/**
 * A sampled point of an ink stroke: a position plus the time it was produced on the originating device and the pen
 * pressure at that instant.
 * <p>
 * Ink points are shared between a stroke and the stroke index; consumers must treat them as read-only. The document
 * copies every point it is handed, so callers may reuse their own instances.
 * <p>
 * Equality includes time and pressure, so an ink point never equals a plain {@link Tuple2f}. The inherited
 * {@code Tuple2f} equality compares coordinates only, so {@code tuple.equals(inkPoint)} may still be true; do not mix
 * ink points and plain tuples in one hashed collection.
 *
 * @author hal.hildebrand
 */
public class InkPoint extends Point2f {
    private static final long serialVersionUID = 1L;

    private final long  time;
    private final float pressure;

    public InkPoint(float x, float y, long time, float pressure) {
        super(x, y);
        this.time = time;
        this.pressure = pressure;
    }

    public InkPoint(InkPoint point) {
        this(point.x, point.y, point.time, point.pressure);
    }

    /**
     * A point with no timing information and full pressure
     */
    public static InkPoint at(float x, float y) {
        return new InkPoint(x, y, 0L, 1.0f);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof InkPoint that)) {
            return false;
        }
        return Float.compare(x, that.x) == 0 && Float.compare(y, that.y) == 0 && time == that.time
        && Float.compare(pressure, that.pressure) == 0;
    }

    @Override
    public boolean equals(Tuple2f t) {
        return equals((Object) t);
    }

    /**
     * Pen pressure in [0, 1]
     */
    public float getPressure() {
        return pressure;
    }

    /**
     * Milliseconds since the epoch on the originating device
     */
    public long getTime() {
        return time;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, time, pressure);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "InkPoint[(%.2f,%.2f) t=%d p=%.2f]", x, y, time, pressure);
    }
}
