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
package com.hellblazer.quill.ink.replication;

import com.hellblazer.quill.geometry.Rectangle;
import com.hellblazer.quill.ink.Color;
import com.hellblazer.quill.ink.InkConfig;
import com.hellblazer.quill.ink.InkDocument;
import com.hellblazer.quill.ink.InkPoint;
import com.hellblazer.quill.ink.Pen;
import com.hellblazer.quill.ink.StrokeIdGenerator;
import com.hellblazer.quill.ink.codec.InkSnapshotCodec;
import com.hellblazer.quill.ink.operation.ClearOperation;
import com.hellblazer.quill.ink.operation.CreateStrokeOperation;
import com.hellblazer.quill.ink.operation.InkOperation;
import com.hellblazer.quill.ink.operation.StylusOperation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for documents kept consistent through an in-memory sequencer
 *
 * @author hal.hildebrand
 */
public class ReplicationTest {
    private static final Pen RED  = new Pen(Color.parse("rgb(255, 0, 0)"), 2);
    private static final Pen BLUE = new Pen(Color.parse("rgb(0, 0, 255)"), 4);

    private InMemorySequencer sequencer;
    private InkConfig         config;
    private InkDocument       alice;
    private InkDocument       bob;

    @BeforeEach
    void setUp() {
        sequencer = new InMemorySequencer();
        config = InkConfig.builder().regionCapacity(4).build();
        alice = new InkDocument(config, sequencer, StrokeIdGenerator.sequential("alice"), () -> 100L);
        bob = new InkDocument(config, sequencer, StrokeIdGenerator.sequential("bob"), () -> 200L);
    }

    @Test
    void testLocalApplyIsImmediateAndRemoteWaitsForDelivery() {
        var stroke = alice.createStroke(RED);
        alice.appendPointToStroke(InkPoint.at(10, 10), stroke.getId());

        assertEquals(1, alice.getStroke(stroke.getId()).orElseThrow().size());
        assertTrue(bob.getStrokes().isEmpty());
        assertEquals(2, sequencer.pendingCount());

        assertEquals(2, sequencer.deliverAll());
        assertEquals(0, sequencer.pendingCount());
        var replica = bob.getStroke(stroke.getId()).orElseThrow();
        assertEquals(List.of(InkPoint.at(10, 10)), replica.getPoints());
        assertEquals(RED, replica.getPen());
        // the origin does not apply its own sequenced copy a second time
        assertEquals(1, alice.getStroke(stroke.getId()).orElseThrow().size());
    }

    @Test
    void testReplicasConvergeToIdenticalSnapshots() {
        var a = alice.createStroke(RED);
        for (int i = 0; i < 20; i++) {
            alice.appendPointToStroke(new InkPoint(10 + i * 7, 20 + i * 3, i, 0.5f), a.getId());
        }
        sequencer.deliverAll();

        var b = bob.createStroke(BLUE);
        for (int i = 0; i < 20; i++) {
            bob.appendPointToStroke(new InkPoint(900 - i * 11, 500 + i * 5, i, 0.75f), b.getId());
        }
        sequencer.deliverAll();

        bob.eraseNear(InkPoint.at(12, 18), 10, 10);
        alice.appendPointToStroke(InkPoint.at(600, 600), b.getId());
        sequencer.deliverAll();

        assertTrue(alice.getStroke(a.getId()).orElseThrow().isInactive());
        assertEquals(21, bob.getStroke(b.getId()).orElseThrow().size());

        var codec = new InkSnapshotCodec();
        assertArrayEquals(codec.toBytes(alice.snapshot()), codec.toBytes(bob.snapshot()));

        // a late joiner replays the sequenced log to the same state
        var late = InkDocument.fromLog(config, sequencer.sequenced());
        assertArrayEquals(codec.toBytes(alice.snapshot()), codec.toBytes(late.snapshot()));
        assertEquals(alice.getStrokeIndex().size(), late.getStrokeIndex().size());
    }

    @Test
    void testReusedInputPointDoesNotDivergeReplicas() {
        var stroke = alice.createStroke(RED);
        var reused = InkPoint.at(100, 100);
        alice.appendPointToStroke(reused, stroke.getId());
        sequencer.deliverAll();

        reused.x = 900;
        reused.y = 900;
        alice.appendPointToStroke(reused, stroke.getId());
        sequencer.deliverAll();

        var codec = new InkSnapshotCodec();
        assertArrayEquals(codec.toBytes(alice.snapshot()), codec.toBytes(bob.snapshot()));
        assertEquals(List.of(InkPoint.at(100, 100), InkPoint.at(900, 900)),
                     alice.getStroke(stroke.getId()).orElseThrow().getPoints());
        assertEquals(alice.strokesIn(new Rectangle(50, 50, 100, 100)),
                     bob.strokesIn(new Rectangle(50, 50, 100, 100)));
        assertEquals(Set.of(stroke.getId()), alice.strokesIn(new Rectangle(50, 50, 100, 100)));
    }

    @Test
    void testConcurrentCreatesConvergeOnStrokeSet() {
        var a = alice.createStroke(RED);
        var b = bob.createStroke(BLUE);
        alice.appendPointToStroke(InkPoint.at(1, 1), a.getId());
        bob.appendPointToStroke(InkPoint.at(2, 2), b.getId());
        sequencer.deliverAll();

        var aliceIds = new HashSet<String>();
        alice.getStrokes().forEach(s -> aliceIds.add(s.getId()));
        var bobIds = new HashSet<String>();
        bob.getStrokes().forEach(s -> bobIds.add(s.getId()));
        assertEquals(aliceIds, bobIds);
        assertEquals(alice.strokesIn(alice.getStrokeIndex().bounds()), bob.strokesIn(bob.getStrokeIndex().bounds()));
    }

    @Test
    void testClearReplicates() {
        var stroke = alice.createStroke(RED);
        alice.appendPointToStroke(InkPoint.at(50, 50), stroke.getId());
        sequencer.deliverAll();
        assertEquals(1, bob.getStrokes().size());

        bob.clear();
        sequencer.deliverAll();

        assertTrue(alice.getStrokes().isEmpty());
        assertEquals(0, alice.getStrokeIndex().size());
        assertEquals(new ClearOperation(200L), sequencer.sequenced().get(sequencer.sequenced().size() - 1));
    }

    @Test
    void testOriginFlag() {
        var observer = mock(SequencedOperationHandler.class);
        var connection = sequencer.connect(observer);

        var stroke = alice.createStroke(RED);
        connection.submit(new StylusOperation(stroke.getId(), InkPoint.at(3, 3)));
        sequencer.deliverAll();

        verify(observer).onSequenced(new CreateStrokeOperation(100L, stroke.getId(), RED), false);
        verify(observer).onSequenced(new StylusOperation(stroke.getId(), InkPoint.at(3, 3)), true);
        assertEquals(1, bob.getStroke(stroke.getId()).orElseThrow().size());
    }

    @Test
    void testDeliveryPreservesSubmissionOrderPerOrigin() {
        var stroke = alice.createStroke(RED);
        for (int i = 0; i < 5; i++) {
            alice.appendPointToStroke(new InkPoint(i, i, i, 1), stroke.getId());
        }
        var other = bob.createStroke(BLUE);
        bob.appendPointToStroke(InkPoint.at(9, 9), other.getId());
        sequencer.deliverAll();

        List<InkOperation> log = sequencer.sequenced();
        assertEquals(8, log.size());
        assertInstanceOf(CreateStrokeOperation.class, log.get(0));
        for (int i = 0; i < 5; i++) {
            assertEquals(new StylusOperation(stroke.getId(), new InkPoint(i, i, i, 1)), log.get(i + 1));
        }
        assertEquals(alice.getStroke(stroke.getId()).orElseThrow().getPoints(),
                     bob.getStroke(stroke.getId()).orElseThrow().getPoints());
    }

    @Test
    void testAppendBeforeCreateIsDropped() {
        // the sequencer must deliver a stroke's create before its appends; out of order appends are not buffered
        bob.apply(new StylusOperation("ghost", InkPoint.at(1, 1)));
        bob.apply(new CreateStrokeOperation(1L, "ghost", RED));

        assertEquals(0, bob.getStroke("ghost").orElseThrow().size());
        assertEquals(0, bob.getStrokeIndex().size());
    }

    @Test
    void testClosedReplicaStopsReceiving() {
        bob.close();
        bob.close();

        var stroke = alice.createStroke(RED);
        sequencer.deliverAll();

        assertTrue(bob.getStroke(stroke.getId()).isEmpty());
        assertThrows(IllegalStateException.class, () -> bob.createStroke(BLUE));
        assertTrue(bob.getStrokes().isEmpty());
        assertEquals(1, alice.getStrokes().size());
    }

    @Test
    void testDeliveredCopiesAreIndependent() {
        var handler = mock(SequencedOperationHandler.class);
        sequencer.connect(handler);
        var stroke = alice.createStroke(RED);
        alice.appendPointToStroke(InkPoint.at(5, 5), stroke.getId());
        sequencer.deliverAll();

        verify(handler, times(2)).onSequenced(any(), eq(false));
        verify(handler, never()).onSequenced(any(), eq(true));
        var bobPoint = bob.getStroke(stroke.getId()).orElseThrow().getPoints().get(0);
        var alicePoint = alice.getStroke(stroke.getId()).orElseThrow().getPoints().get(0);
        assertEquals(alicePoint, bobPoint);
        assertNotSame(alicePoint, bobPoint);
    }
}
