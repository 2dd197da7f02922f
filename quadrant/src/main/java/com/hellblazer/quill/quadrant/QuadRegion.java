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
package com.hellblazer.quill.quadrant;

import com.hellblazer.quill.geometry.Rectangle;

import javax.vecmath.Tuple2f;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A node of a {@link QuadTree}. A region is either a {@link Leaf}, which stores points, or an {@link Internal} node,
 * which stores exactly four child regions and no points of its own. Regions are owned by their parent (or by the tree
 * for the root) and are only restructured by the tree that owns them.
 *
 * @param <P> the point type
 * @author hal.hildebrand
 */
public sealed interface QuadRegion<P extends Tuple2f> permits QuadRegion.Leaf, QuadRegion.Internal {

    Rectangle bounds();

    /**
     * Depth of this region, 0 for the root
     */
    int depth();

    /**
     * Leaf storage. Anonymous points and id-owned points are kept apart; the id map preserves the order in which each
     * id was first recorded in this leaf.
     */
    final class Leaf<P extends Tuple2f> implements QuadRegion<P> {
        private final Rectangle             bounds;
        private final int                   depth;
        private final List<P>               anonymous = new ArrayList<>();
        private final Map<String, List<P>>  byId      = new LinkedHashMap<>();
        private       int                   count;

        Leaf(Rectangle bounds, int depth) {
            this.bounds = bounds;
            this.depth = depth;
        }

        /**
         * Points stored without an owning id
         */
        public List<P> anonymousPoints() {
            return Collections.unmodifiableList(anonymous);
        }

        @Override
        public Rectangle bounds() {
            return bounds;
        }

        public int count() {
            return count;
        }

        @Override
        public int depth() {
            return depth;
        }

        public Set<String> ids() {
            return Collections.unmodifiableSet(byId.keySet());
        }

        public boolean isEmpty() {
            return count == 0;
        }

        /**
         * Points owned by the id that fall inside this leaf, in insertion order
         */
        public List<P> pointsOf(String id) {
            var points = byId.get(id);
            return points == null ? List.of() : Collections.unmodifiableList(points);
        }

        @Override
        public String toString() {
            return "Leaf[" + bounds + ", depth=" + depth + ", count=" + count + ", ids=" + byId.size() + "]";
        }

        /**
         * Store a point.
         *
         * @return true if this is the first point recorded in this leaf for the id
         */
        boolean add(P point, String id) {
            count++;
            if (id == null) {
                anonymous.add(point);
                return false;
            }
            var points = byId.get(id);
            var first = points == null;
            if (first) {
                points = new ArrayList<>();
                byId.put(id, points);
            }
            points.add(point);
            return first;
        }

        Collection<P> anonymousStorage() {
            return anonymous;
        }

        Map<String, List<P>> idStorage() {
            return byId;
        }
    }

    /**
     * A split region holding four children that tile its bounds.
     */
    final class Internal<P extends Tuple2f> implements QuadRegion<P> {
        private final Rectangle            bounds;
        private final int                  depth;
        private final List<QuadRegion<P>>  children;

        Internal(Rectangle bounds, int depth) {
            this.bounds = bounds;
            this.depth = depth;
            children = new ArrayList<>(Quadrant.values().length);
            for (var quadrant : Quadrant.values()) {
                children.add(new Leaf<>(quadrant.within(bounds), depth + 1));
            }
        }

        @Override
        public Rectangle bounds() {
            return bounds;
        }

        public QuadRegion<P> child(Quadrant quadrant) {
            return children.get(quadrant.ordinal());
        }

        /**
         * Children in {@link Quadrant} order
         */
        public List<QuadRegion<P>> children() {
            return Collections.unmodifiableList(children);
        }

        @Override
        public int depth() {
            return depth;
        }

        /**
         * The quadrant whose bounds contain the point, or null if none does
         */
        public Quadrant quadrantOf(Tuple2f point) {
            for (var quadrant : Quadrant.values()) {
                if (child(quadrant).bounds().containsPoint(point)) {
                    return quadrant;
                }
            }
            return null;
        }

        @Override
        public String toString() {
            return "Internal[" + bounds + ", depth=" + depth + "]";
        }

        void replace(Quadrant quadrant, QuadRegion<P> region) {
            children.set(quadrant.ordinal(), region);
        }
    }
}
