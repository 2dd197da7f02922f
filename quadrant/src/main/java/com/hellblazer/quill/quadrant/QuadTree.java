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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Tuple2f;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Quad-partitioned point store. Points are kept in leaf regions, each optionally tagged with the id of the object
 * that owns it. A leaf that has reached the capacity threshold is split into four children of half width and height
 * on the next insertion and its points are redistributed; splitting never drops or duplicates a point. The points of
 * one id are not kept together: they live in whichever leaves contain them.
 * <p>
 * The tree records, per id, the bounds of every leaf in which that id's points were first recorded (the partition
 * registry). Listeners may observe splits and id registrations; neither is needed for correct operation.
 * <p>
 * Thread Safety: not thread-safe. A tree is owned and mutated by a single writer.
 *
 * @param <P> the point type
 * @author hal.hildebrand
 */
public class QuadTree<P extends Tuple2f> {
    public static final int DEFAULT_CAPACITY  = 256;
    public static final int DEFAULT_MAX_DEPTH = 24;

    private static final Logger log = LoggerFactory.getLogger(QuadTree.class);

    private final Rectangle                    bounds;
    private final int                          capacity;
    private final int                          maxDepth;
    private final Map<String, List<Rectangle>> partitions = new HashMap<>();
    private       QuadRegion<P>                root;
    private       int                          size;
    private       SplitListener                splitListener;
    private       IdRegistrationListener<P>    idRegistrationListener;

    /**
     * Create a tree with the default capacity and depth limit
     */
    public QuadTree(Rectangle bounds) {
        this(bounds, DEFAULT_CAPACITY, DEFAULT_MAX_DEPTH);
    }

    /**
     * Create a tree
     *
     * @param bounds   the region covered by the root
     * @param capacity number of points a leaf holds before it is split
     * @param maxDepth depth at which leaves stop splitting and grow past capacity instead
     */
    public QuadTree(Rectangle bounds, int capacity, int maxDepth) {
        this.bounds = Objects.requireNonNull(bounds, "bounds cannot be null");
        if (bounds.width() <= 0 || bounds.height() <= 0) {
            throw new IllegalArgumentException("Bounds must have a positive area: " + bounds);
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive");
        }
        if (maxDepth < 0) {
            throw new IllegalArgumentException("Max depth must be non-negative");
        }
        this.capacity = capacity;
        this.maxDepth = maxDepth;
        this.root = new QuadRegion.Leaf<>(bounds, 0);
    }

    public Rectangle bounds() {
        return bounds;
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Collect the distinct ids owning at least one point inside the box, in the order they are first visited
     */
    public Set<String> collectIds(Rectangle box) {
        var ids = new LinkedHashSet<String>();
        search(box, (p, id) -> {
            if (id == null) {
                return false;
            }
            ids.add(id);
            return true;
        });
        return ids;
    }

    /**
     * Depth of the deepest region, 0 while the root is a leaf
     */
    public int depth() {
        return depth(root);
    }

    /**
     * Append, for every leaf intersecting the box, the part of the leaf inside the box
     */
    public void gatherIntersecting(Rectangle box, Collection<Rectangle> result) {
        gatherIntersecting(root, box, result);
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * Insert an anonymous point
     */
    public boolean insert(P point) {
        return insert(point, null);
    }

    /**
     * Insert a point owned by an id.
     *
     * @param point the point
     * @param id    the owning id, or null for an anonymous point
     * @return false if no region contains the point, in which case it is logged and dropped
     */
    public boolean insert(P point, String id) {
        Objects.requireNonNull(point, "point cannot be null");
        if (!bounds.containsPoint(point)) {
            log.warn("Point {} for id {} is outside index bounds {}; dropped", point, id, bounds);
            return false;
        }

        QuadRegion.Internal<P> parent = null;
        Quadrant slot = null;
        var region = root;
        while (true) {
            if (region instanceof QuadRegion.Internal<P> internal) {
                var quadrant = internal.quadrantOf(point);
                if (quadrant == null) {
                    log.warn("No child of {} contains point {} for id {}; dropped", internal.bounds(), point, id);
                    return false;
                }
                parent = internal;
                slot = quadrant;
                region = internal.child(quadrant);
            } else {
                var leaf = (QuadRegion.Leaf<P>) region;
                if (leaf.count() < capacity || leaf.depth() >= maxDepth) {
                    addPoint(leaf, point, id);
                    size++;
                    return true;
                }
                var split = split(leaf);
                if (parent == null) {
                    root = split;
                } else {
                    parent.replace(slot, split);
                }
                region = split;
            }
        }
    }

    public int leafCount() {
        return leafCount(root);
    }

    /**
     * The bounds of the leaves in which the id's points were first recorded, in registration order. Leaves that were
     * later split remain in the registry.
     */
    public List<Rectangle> partitionsOf(String id) {
        var registered = partitions.get(id);
        return registered == null ? List.of() : Collections.unmodifiableList(registered);
    }

    public QuadRegion<P> root() {
        return root;
    }

    /**
     * Visit every indexed point inside the box. The visitor's return value stops the scan of the point list being
     * iterated only; remaining lists and leaves are still visited.
     */
    public void search(Rectangle box, PointVisitor<P> visitor) {
        search(root, box, visitor);
    }

    public void setIdRegistrationListener(IdRegistrationListener<P> listener) {
        this.idRegistrationListener = listener;
    }

    public void setSplitListener(SplitListener listener) {
        this.splitListener = listener;
    }

    /**
     * Total number of points stored
     */
    public int size() {
        return size;
    }

    @Override
    public String toString() {
        return "QuadTree[" + bounds + ", capacity=" + capacity + ", size=" + size + "]";
    }

    private void addPoint(QuadRegion.Leaf<P> leaf, P point, String id) {
        if (leaf.add(point, id)) {
            partitions.computeIfAbsent(id, k -> new ArrayList<>()).add(leaf.bounds());
            if (idRegistrationListener != null) {
                idRegistrationListener.onRegistered(id, leaf, point);
            }
        }
    }

    private int depth(QuadRegion<P> region) {
        if (region instanceof QuadRegion.Internal<P> internal) {
            var deepest = 0;
            for (var child : internal.children()) {
                deepest = Math.max(deepest, depth(child));
            }
            return deepest;
        }
        return region.depth();
    }

    private void distribute(QuadRegion.Internal<P> internal, P point, String id) {
        var quadrant = internal.quadrantOf(point);
        if (quadrant == null) {
            log.warn("No child of {} contains point {} for id {} during split; dropped", internal.bounds(), point,
                     id);
            size--;
            return;
        }
        // children of a fresh split hold at most the parent's capacity
        addPoint((QuadRegion.Leaf<P>) internal.child(quadrant), point, id);
    }

    private void gatherIntersecting(QuadRegion<P> region, Rectangle box, Collection<Rectangle> result) {
        region.bounds().intersection(box).ifPresent(isect -> {
            if (region instanceof QuadRegion.Internal<P> internal) {
                for (var child : internal.children()) {
                    gatherIntersecting(child, isect, result);
                }
            } else {
                result.add(isect);
            }
        });
    }

    private int leafCount(QuadRegion<P> region) {
        if (region instanceof QuadRegion.Internal<P> internal) {
            var count = 0;
            for (var child : internal.children()) {
                count += leafCount(child);
            }
            return count;
        }
        return 1;
    }

    private void search(QuadRegion<P> region, Rectangle box, PointVisitor<P> visitor) {
        var intersection = region.bounds().intersection(box);
        if (intersection.isEmpty()) {
            return;
        }
        var isect = intersection.get();
        if (region instanceof QuadRegion.Internal<P> internal) {
            for (var child : internal.children()) {
                search(child, isect, visitor);
            }
            return;
        }
        var leaf = (QuadRegion.Leaf<P>) region;
        for (var p : leaf.anonymousPoints()) {
            if (isect.containsPoint(p) && visitor.visit(p, null)) {
                break;
            }
        }
        for (var id : leaf.ids()) {
            for (var p : leaf.pointsOf(id)) {
                if (isect.containsPoint(p) && visitor.visit(p, id)) {
                    break;
                }
            }
        }
    }

    private QuadRegion.Internal<P> split(QuadRegion.Leaf<P> leaf) {
        var internal = new QuadRegion.Internal<P>(leaf.bounds(), leaf.depth());
        for (var p : leaf.anonymousStorage()) {
            distribute(internal, p, null);
        }
        for (var entry : leaf.idStorage().entrySet()) {
            for (var p : entry.getValue()) {
                distribute(internal, p, entry.getKey());
            }
        }
        log.debug("Split {} holding {} points at depth {}", leaf.bounds(), leaf.count(), leaf.depth());
        if (splitListener != null) {
            var children = new ArrayList<Rectangle>(Quadrant.values().length);
            for (var child : internal.children()) {
                children.add(child.bounds());
            }
            splitListener.onSplit(Collections.unmodifiableList(children));
        }
        return internal;
    }
}
