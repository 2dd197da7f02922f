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

import com.hellblazer.quill.ink.codec.OperationCodec;
import com.hellblazer.quill.ink.operation.InkOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process sequencer. Submissions from all connected replicas are queued in arrival order, which is the global
 * order; since each replica submits sequentially, the queue also preserves every replica's own submission order.
 * Nothing is delivered until {@link #deliver()} or {@link #deliverAll()} is called, which lets callers interleave
 * replicas deterministically.
 * <p>
 * Every delivery is encoded and decoded through an {@link OperationCodec}, so replicas never share operation
 * instances, just as they would not across a network.
 *
 * @author hal.hildebrand
 */
public class InMemorySequencer implements OperationSequencer {
    private static final Logger log = LoggerFactory.getLogger(InMemorySequencer.class);

    private final OperationCodec         codec;
    private final List<Replica>          replicas  = new CopyOnWriteArrayList<>();
    private final Deque<Pending>         pending   = new ArrayDeque<>();
    private final List<InkOperation>     sequenced = new ArrayList<>();
    private       long                   nextSequence;

    public InMemorySequencer() {
        this(new OperationCodec());
    }

    public InMemorySequencer(OperationCodec codec) {
        this.codec = codec;
    }

    @Override
    public Connection connect(SequencedOperationHandler handler) {
        var replica = new Replica(handler);
        replicas.add(replica);
        return replica;
    }

    /**
     * Sequence and deliver the oldest pending operation to every connected replica.
     *
     * @return false if nothing was pending
     */
    public boolean deliver() {
        var next = pending.poll();
        if (next == null) {
            return false;
        }
        var sequence = nextSequence++;
        var operation = codec.decode(next.encoded);
        sequenced.add(operation);
        log.debug("Sequenced #{} {}", sequence, operation.type());
        for (var replica : replicas) {
            replica.handler.onSequenced(codec.decode(next.encoded), replica == next.origin);
        }
        return true;
    }

    /**
     * Deliver operations until none are pending.
     *
     * @return the number delivered
     */
    public int deliverAll() {
        var delivered = 0;
        while (deliver()) {
            delivered++;
        }
        return delivered;
    }

    public int pendingCount() {
        return pending.size();
    }

    /**
     * Every operation delivered so far, in sequence order
     */
    public List<InkOperation> sequenced() {
        return Collections.unmodifiableList(sequenced);
    }

    private record Pending(Replica origin, String encoded) {
    }

    private class Replica implements Connection {
        private final SequencedOperationHandler handler;
        private       boolean                   closed;

        private Replica(SequencedOperationHandler handler) {
            this.handler = handler;
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                replicas.remove(this);
            }
        }

        @Override
        public void submit(InkOperation operation) {
            if (closed) {
                throw new IllegalStateException("Connection is closed");
            }
            pending.add(new Pending(this, codec.encode(operation)));
        }
    }
}
