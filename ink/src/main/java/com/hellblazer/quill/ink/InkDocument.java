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

import com.hellblazer.quill.geometry.Rectangle;
import com.hellblazer.quill.ink.event.InkEventListener;
import com.hellblazer.quill.ink.operation.ClearOperation;
import com.hellblazer.quill.ink.operation.CreateStrokeOperation;
import com.hellblazer.quill.ink.operation.EraseStrokesOperation;
import com.hellblazer.quill.ink.operation.InkOperation;
import com.hellblazer.quill.ink.operation.OperationType;
import com.hellblazer.quill.ink.operation.StylusOperation;
import com.hellblazer.quill.ink.replication.DetachedSequencer;
import com.hellblazer.quill.ink.replication.OperationSequencer;
import com.hellblazer.quill.ink.replication.SequencedOperationHandler;
import com.hellblazer.quill.ink.snapshot.InkSnapshot;
import com.hellblazer.quill.ink.snapshot.StrokeSnapshot;
import com.hellblazer.quill.quadrant.IdRegistrationListener;
import com.hellblazer.quill.quadrant.QuadTree;
import com.hellblazer.quill.quadrant.SplitListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point2f;
import javax.vecmath.Tuple2f;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.LongSupplier;

/**
 * A replicated document of ink strokes. Every mutation is expressed as an {@link InkOperation} and applied through
 * {@link #apply(InkOperation)}: immediately on the replica that issues it, and again on every other replica when the
 * {@link OperationSequencer} delivers the sequenced copy. Locally issued operations are not re-applied on delivery
 * and are never rolled back.
 * <p>
 * The document feeds every appended point into a {@link QuadTree} tagged with its stroke id, for hit-testing and
 * viewport queries. Erasing marks strokes inactive and leaves their points indexed; clearing rebuilds the index.
 * <p>
 * Thread Safety: not thread-safe. A replica applies operations one at a time on the thread that owns it. Readers must
 * not mutate returned strokes or points.
 *
 * @author hal.hildebrand
 */
public class InkDocument implements SequencedOperationHandler, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(InkDocument.class);

    private final InkConfig                                   config;
    private final StrokeIdGenerator                           idGenerator;
    private final LongSupplier                                clock;
    private final Map<String, Stroke>                         strokes   = new LinkedHashMap<>();
    private final Map<OperationType, List<InkEventListener>>  listeners = new EnumMap<>(OperationType.class);
    private final OperationSequencer.Connection               connection;
    private       QuadTree<InkPoint>                          strokeIndex;
    private       SplitListener                               splitListener;
    private       IdRegistrationListener<InkPoint>            partitionListener;
    private       boolean                                     closed;

    /**
     * Create an empty document connected to a sequencer, using random stroke ids and the system clock
     */
    public InkDocument(InkConfig config, OperationSequencer sequencer) {
        this(config, sequencer, StrokeIdGenerator.uuid(), System::currentTimeMillis);
    }

    /**
     * Create an empty document connected to a sequencer
     *
     * @param config      document extent and index tuning
     * @param sequencer   the ordering substrate shared with other replicas
     * @param idGenerator ids for strokes created by this replica
     * @param clock       timestamps for operations issued by this replica
     */
    public InkDocument(InkConfig config, OperationSequencer sequencer, StrokeIdGenerator idGenerator,
                       LongSupplier clock) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        for (var type : OperationType.values()) {
            listeners.put(type, new CopyOnWriteArrayList<>());
        }
        initStrokeIndex();
        this.connection = Objects.requireNonNull(sequencer, "sequencer cannot be null").connect(this);
    }

    /**
     * Create a document that is not shared with any other replica
     */
    public static InkDocument detached(InkConfig config) {
        return new InkDocument(config, DetachedSequencer.INSTANCE);
    }

    /**
     * Reconstruct a detached document by applying an operation log in order
     */
    public static InkDocument fromLog(InkConfig config, List<? extends InkOperation> operations) {
        var document = detached(config);
        for (var operation : operations) {
            document.apply(operation);
        }
        return document;
    }

    /**
     * Load a document from a snapshot. The snapshot's extent replaces the configured one; the stroke index is rebuilt
     * by re-inserting every stroke's points.
     */
    public static InkDocument load(InkSnapshot snapshot, InkConfig config, OperationSequencer sequencer) {
        var sized = config.toBuilder().width(snapshot.width()).height(snapshot.height()).build();
        var document = new InkDocument(sized, sequencer);
        document.restore(snapshot);
        return document;
    }

    /**
     * Load a detached document from a snapshot using default index tuning
     */
    public static InkDocument load(InkSnapshot snapshot) {
        return load(snapshot, InkConfig.defaults(), DetachedSequencer.INSTANCE);
    }

    /**
     * Register a listener for every event kind
     */
    public void addListener(InkEventListener listener) {
        for (var type : OperationType.values()) {
            addListener(type, listener);
        }
    }

    /**
     * Register a listener for one event kind. Listeners are called in registration order.
     */
    public void addListener(OperationType type, InkEventListener listener) {
        listeners.get(type).add(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    /**
     * Append a point to a stroke, and submit the operation for replication.
     *
     * @return the stroke, or empty if no stroke has that id (for instance because a clear was applied first)
     */
    public Optional<Stroke> appendPointToStroke(InkPoint point, String strokeId) {
        checkOpen();
        var operation = new StylusOperation(strokeId, new InkPoint(point));
        var stroke = executeStylus(operation);
        connection.submit(operation);
        return stroke;
    }

    /**
     * Apply an operation to this replica's state. This is the single mutation path, used for operations issued here
     * and for operations received from other replicas.
     */
    public void apply(InkOperation operation) {
        if (operation instanceof CreateStrokeOperation create) {
            executeCreateStroke(create);
        } else if (operation instanceof StylusOperation stylus) {
            executeStylus(new StylusOperation(stylus.id(), new InkPoint(stylus.point())));
        } else if (operation instanceof EraseStrokesOperation erase) {
            executeEraseStrokes(erase);
        } else if (operation instanceof ClearOperation clear) {
            executeClear(clear);
        } else {
            throw new IllegalArgumentException("Unknown operation: " + operation);
        }
    }

    /**
     * Discard all strokes and rebuild an empty stroke index, and submit the operation for replication
     */
    public void clear() {
        checkOpen();
        var operation = new ClearOperation(clock.getAsLong());
        executeClear(operation);
        connection.submit(operation);
    }

    /**
     * Disconnect from the sequencer. The document remains readable, but issuing further operations fails with
     * {@link IllegalStateException}.
     */
    @Override
    public void close() {
        closed = true;
        connection.close();
    }

    /**
     * Create a new empty stroke, and submit the operation for replication
     */
    public Stroke createStroke(Pen pen) {
        checkOpen();
        var operation = new CreateStrokeOperation(clock.getAsLong(), idGenerator.generateId(), pen);
        var stroke = executeCreateStroke(operation);
        connection.submit(operation);
        return stroke;
    }

    /**
     * Erase the active strokes that have a point inside the eraser box, whose minimum corner is at the eraser position.
     *
     * @return the ids erased, empty if nothing was hit (in which case no operation is issued)
     */
    public List<String> eraseNear(Tuple2f position, float width, float height) {
        var hit = new LinkedHashSet<String>();
        strokeIndex.search(new Rectangle(position.x, position.y, width, height), (p, id) -> {
            if (id == null) {
                return false;
            }
            var stroke = strokes.get(id);
            if (stroke != null && !stroke.isInactive()) {
                hit.add(id);
            }
            return true;
        });
        if (hit.isEmpty()) {
            return List.of();
        }
        var ids = List.copyOf(hit);
        eraseStrokes(ids);
        return ids;
    }

    /**
     * Mark strokes inactive, and submit the operation for replication. Points, bounds and index entries are kept.
     */
    public void eraseStrokes(List<String> ids) {
        checkOpen();
        var operation = new EraseStrokesOperation(ids);
        executeEraseStrokes(operation);
        connection.submit(operation);
    }

    /**
     * Append, for every index leaf intersecting the viewport, the part of the leaf inside the viewport
     */
    public void gatherViewportRects(Rectangle viewport, Collection<Rectangle> result) {
        strokeIndex.gatherIntersecting(viewport, result);
    }

    public InkConfig getConfig() {
        return config;
    }

    public float getHeight() {
        return config.getHeight();
    }

    public Optional<Stroke> getStroke(String id) {
        return Optional.ofNullable(strokes.get(id));
    }

    /**
     * Read access to the stroke index, for hit-testing. Callers must not insert into it.
     */
    public QuadTree<InkPoint> getStrokeIndex() {
        return strokeIndex;
    }

    /**
     * Bounds of the index leaves in which the stroke's points were first recorded
     */
    public List<Rectangle> getStrokePartitions(String id) {
        return strokeIndex.partitionsOf(id);
    }

    /**
     * All strokes, erased ones included, in creation order
     */
    public List<Stroke> getStrokes() {
        return Collections.unmodifiableList(new ArrayList<>(strokes.values()));
    }

    public float getWidth() {
        return config.getWidth();
    }

    @Override
    public void onSequenced(InkOperation operation, boolean isLocalOrigin) {
        if (isLocalOrigin) {
            log.trace("Sequenced local {}", operation.type());
            return;
        }
        apply(operation);
    }

    public void removeListener(InkEventListener listener) {
        for (var registered : listeners.values()) {
            registered.remove(listener);
        }
    }

    /**
     * Observe strokes being registered with index leaves as their points spread across partitions. The listener stays
     * attached across clears.
     */
    public void setPartitionListener(IdRegistrationListener<InkPoint> listener) {
        this.partitionListener = listener;
        strokeIndex.setIdRegistrationListener(listener);
    }

    /**
     * Observe splits of the stroke index. The listener stays attached across clears.
     */
    public void setSplitListener(SplitListener listener) {
        this.splitListener = listener;
        strokeIndex.setSplitListener(listener);
    }

    /**
     * Capture the strokes and extent of this document
     */
    public InkSnapshot snapshot() {
        var captured = new ArrayList<StrokeSnapshot>(strokes.size());
        for (var stroke : strokes.values()) {
            StrokeSnapshot.Bound lo = null;
            StrokeSnapshot.Bound hi = null;
            if (stroke.hasBounds()) {
                var loBound = stroke.getLoBound();
                var hiBound = stroke.getHiBound();
                lo = new StrokeSnapshot.Bound(loBound.x, loBound.y);
                hi = new StrokeSnapshot.Bound(hiBound.x, hiBound.y);
            }
            captured.add(new StrokeSnapshot(stroke.getId(), copyOf(stroke.getPoints()), stroke.getPen(), lo, hi,
                                            stroke.isInactive()));
        }
        return new InkSnapshot(getWidth(), getHeight(), captured);
    }

    /**
     * Ids of strokes, erased ones included, with at least one point inside the box
     */
    public Set<String> strokesIn(Rectangle box) {
        return strokeIndex.collectIds(box);
    }

    @Override
    public String toString() {
        return "InkDocument[" + getWidth() + "x" + getHeight() + ", strokes=" + strokes.size() + ", points="
        + strokeIndex.size() + "]";
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Document is closed");
        }
    }

    private static List<InkPoint> copyOf(List<InkPoint> points) {
        var copies = new ArrayList<InkPoint>(points.size());
        for (var point : points) {
            copies.add(new InkPoint(point));
        }
        return copies;
    }

    private void emit(InkOperation operation) {
        for (var listener : listeners.get(operation.type())) {
            try {
                listener.onEvent(operation);
            } catch (RuntimeException e) {
                log.error("Listener failed handling {} event", operation.type().wireName(), e);
            }
        }
    }

    private void executeClear(ClearOperation operation) {
        var discarded = strokes.size();
        strokes.clear();
        initStrokeIndex();
        log.info("Cleared {} strokes", discarded);
        emit(operation);
    }

    private Stroke executeCreateStroke(CreateStrokeOperation operation) {
        var stroke = new Stroke(operation.id(), operation.pen());
        if (strokes.putIfAbsent(operation.id(), stroke) != null) {
            log.warn("Stroke {} already exists; create ignored", operation.id());
            return strokes.get(operation.id());
        }
        emit(operation);
        return stroke;
    }

    private void executeEraseStrokes(EraseStrokesOperation operation) {
        for (var id : operation.ids()) {
            var stroke = strokes.get(id);
            if (stroke == null) {
                log.warn("Cannot erase unknown stroke {}", id);
                continue;
            }
            stroke.setInactive(true);
        }
        emit(operation);
    }

    private Optional<Stroke> executeStylus(StylusOperation operation) {
        var stroke = strokes.get(operation.id());
        if (stroke == null) {
            log.warn("Point appended to unknown stroke {}; ignored", operation.id());
            return Optional.empty();
        }
        stroke.append(operation.point());
        strokeIndex.insert(operation.point(), operation.id());
        emit(operation);
        return Optional.of(stroke);
    }

    private void initStrokeIndex() {
        strokeIndex = new QuadTree<>(new Rectangle(0, 0, config.getWidth(), config.getHeight()),
                                     config.getRegionCapacity(), config.getMaxDepth());
        strokeIndex.setSplitListener(splitListener);
        strokeIndex.setIdRegistrationListener(partitionListener);
    }

    private void restore(InkSnapshot snapshot) {
        strokes.clear();
        initStrokeIndex();
        for (var captured : snapshot.strokes()) {
            var lo = captured.loBound() == null ? new Point2f(Float.POSITIVE_INFINITY, Float.POSITIVE_INFINITY)
                                                : new Point2f(captured.loBound().x(), captured.loBound().y());
            var hi = captured.hiBound() == null ? new Point2f(Float.NEGATIVE_INFINITY, Float.NEGATIVE_INFINITY)
                                                : new Point2f(captured.hiBound().x(), captured.hiBound().y());
            strokes.put(captured.id(), new Stroke(captured.id(), captured.pen(), copyOf(captured.points()), lo, hi,
                                                  captured.inactive()));
        }
        for (var stroke : strokes.values()) {
            for (var point : stroke.getPoints()) {
                strokeIndex.insert(point, stroke.getId());
            }
        }
        log.info("Loaded {} strokes, {} points indexed", strokes.size(), strokeIndex.size());
    }
}
