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

import com.hellblazer.quill.ink.operation.InkOperation;

/**
 * The ordering substrate replicas share. A sequencer assigns a single global order to the operations submitted by
 * all connected replicas and delivers every operation, exactly once and in that order, to every connected replica.
 * <p>
 * Implementations must also preserve the order in which each replica submitted its own operations. Replicas rely on
 * this to see a stroke's creation before any point appended to it.
 *
 * @author hal.hildebrand
 */
public interface OperationSequencer {

    /**
     * Connect a replica.
     *
     * @param handler receives every sequenced operation
     * @return the replica's channel for submitting operations
     */
    Connection connect(SequencedOperationHandler handler);

    /**
     * A replica's link to the sequencer.
     */
    interface Connection extends AutoCloseable {

        /**
         * Stop receiving operations. Closing twice has no effect.
         */
        @Override
        void close();

        /**
         * Enqueue an operation for ordering. Does not block and never delivers synchronously.
         *
         * @throws IllegalStateException if the connection is closed
         */
        void submit(InkOperation operation);
    }
}
