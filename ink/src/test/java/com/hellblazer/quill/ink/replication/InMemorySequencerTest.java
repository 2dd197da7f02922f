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

import com.hellblazer.quill.ink.operation.ClearOperation;
import com.hellblazer.quill.ink.operation.InkOperation;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class InMemorySequencerTest {

    @Test
    void testSubmitDoesNotDeliverSynchronously() {
        var sequencer = new InMemorySequencer();
        var received = new ArrayList<InkOperation>();
        var connection = sequencer.connect((operation, local) -> received.add(operation));

        connection.submit(new ClearOperation(1));
        assertTrue(received.isEmpty());
        assertEquals(1, sequencer.pendingCount());

        assertTrue(sequencer.deliver());
        assertFalse(sequencer.deliver());
        assertEquals(List.of(new ClearOperation(1)), received);
        assertEquals(List.of(new ClearOperation(1)), sequencer.sequenced());
    }

    @Test
    void testSingleGlobalOrderAcrossOrigins() {
        var sequencer = new InMemorySequencer();
        var first = new ArrayList<Long>();
        var second = new ArrayList<Long>();
        var a = sequencer.connect((operation, local) -> first.add(((ClearOperation) operation).time()));
        var b = sequencer.connect((operation, local) -> second.add(((ClearOperation) operation).time()));

        a.submit(new ClearOperation(1));
        b.submit(new ClearOperation(2));
        a.submit(new ClearOperation(3));
        assertEquals(3, sequencer.deliverAll());

        assertEquals(List.of(1L, 2L, 3L), first);
        assertEquals(first, second);
    }

    @Test
    void testOperationsSubmittedDuringDeliveryAreQueued() {
        var sequencer = new InMemorySequencer();
        var received = new ArrayList<InkOperation>();
        var holder = new ArrayList<OperationSequencer.Connection>();
        holder.add(sequencer.connect((operation, local) -> {
            received.add(operation);
            if (((ClearOperation) operation).time() == 1) {
                holder.get(0).submit(new ClearOperation(2));
            }
        }));

        holder.get(0).submit(new ClearOperation(1));
        assertTrue(sequencer.deliver());
        assertEquals(1, received.size());
        assertEquals(1, sequencer.pendingCount());
        sequencer.deliverAll();
        assertEquals(List.of(new ClearOperation(1), new ClearOperation(2)), received);
    }

    @Test
    void testClosedConnection() {
        var sequencer = new InMemorySequencer();
        var received = new ArrayList<InkOperation>();
        var open = sequencer.connect((operation, local) -> received.add(operation));
        var closed = sequencer.connect((operation, local) -> fail("closed replica received " + operation));
        closed.close();

        assertThrows(IllegalStateException.class, () -> closed.submit(new ClearOperation(1)));
        open.submit(new ClearOperation(2));
        sequencer.deliverAll();
        assertEquals(1, received.size());
    }
}
