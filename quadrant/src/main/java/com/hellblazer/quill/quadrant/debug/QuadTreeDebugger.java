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
package com.hellblazer.quill.quadrant.debug;

import com.hellblazer.quill.quadrant.QuadRegion;
import com.hellblazer.quill.quadrant.QuadTree;
import com.hellblazer.quill.quadrant.Quadrant;

import javax.vecmath.Tuple2f;
import java.util.HashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Debug utilities for visualizing and measuring the partitioning of a {@link QuadTree}.
 *
 * @param <P> the point type
 * @author hal.hildebrand
 */
public class QuadTreeDebugger<P extends Tuple2f> {
    private static final int MAX_IDS_SHOWN = 3;

    private final QuadTree<P> tree;

    public QuadTreeDebugger(QuadTree<P> tree) {
        this.tree = Objects.requireNonNull(tree);
    }

    public QuadTreeStats getStats() {
        var counter = new Counter();
        count(tree.root(), counter);
        return new QuadTreeStats(counter.leaves, counter.internals, counter.maxDepth, counter.points,
                                 counter.anonymous, counter.ids.size(), counter.emptyLeaves);
    }

    /**
     * Generate an indented ASCII outline of the region hierarchy
     *
     * @param maxDepth deepest level to print
     */
    public String toAsciiArt(int maxDepth) {
        var stats = getStats();
        var builder = new StringBuilder();
        builder.append("QuadTree Structure Visualization\n");
        builder.append("================================\n");
        builder.append(String.format(Locale.ROOT, "Bounds: %s, Capacity: %d\n", tree.bounds(), tree.capacity()));
        builder.append(String.format(Locale.ROOT, "Leaves: %d, Internal: %d, Max Depth: %d\n", stats.leafCount(),
                                     stats.internalCount(), stats.maxDepth()));
        builder.append(String.format(Locale.ROOT, "Points: %d (anonymous %d), Ids: %d, Avg Points/Leaf: %.2f\n\n",
                                     stats.pointCount(), stats.anonymousPointCount(), stats.distinctIdCount(),
                                     stats.averagePointsPerLeaf()));
        outline(tree.root(), "root", maxDepth, builder);
        return builder.toString();
    }

    private void count(QuadRegion<P> region, Counter counter) {
        counter.maxDepth = Math.max(counter.maxDepth, region.depth());
        if (region instanceof QuadRegion.Internal<P> internal) {
            counter.internals++;
            for (var child : internal.children()) {
                count(child, counter);
            }
            return;
        }
        var leaf = (QuadRegion.Leaf<P>) region;
        counter.leaves++;
        counter.points += leaf.count();
        counter.anonymous += leaf.anonymousPoints().size();
        counter.ids.addAll(leaf.ids());
        if (leaf.isEmpty()) {
            counter.emptyLeaves++;
        }
    }

    private void outline(QuadRegion<P> region, String label, int maxDepth, StringBuilder builder) {
        if (region.depth() > maxDepth) {
            return;
        }
        builder.append("  ".repeat(region.depth())).append("├─ ").append(label).append(' ').append(region.bounds());
        if (region instanceof QuadRegion.Internal<P> internal) {
            builder.append('\n');
            for (var quadrant : Quadrant.values()) {
                outline(internal.child(quadrant), quadrant.name().toLowerCase(Locale.ROOT), maxDepth, builder);
            }
            return;
        }
        var leaf = (QuadRegion.Leaf<P>) region;
        builder.append(String.format(Locale.ROOT, " [%d points]", leaf.count()));
        if (!leaf.ids().isEmpty()) {
            var ids = leaf.ids().stream().limit(MAX_IDS_SHOWN).collect(Collectors.joining(", "));
            if (leaf.ids().size() > MAX_IDS_SHOWN) {
                ids += ", ...";
            }
            builder.append(" {").append(ids).append('}');
        }
        builder.append('\n');
    }

    private static class Counter {
        final Set<String> ids = new HashSet<>();
        int leaves;
        int internals;
        int maxDepth;
        int points;
        int anonymous;
        int emptyLeaves;
    }
}
