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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sequencer for a document that is not shared. Submitted operations are discarded; the document has already applied
 * them locally.
 *
 * @author hal.hildebrand
 */
public final class DetachedSequencer implements OperationSequencer {
    public static final DetachedSequencer INSTANCE = new DetachedSequencer();

    private static final Logger log = LoggerFactory.getLogger(DetachedSequencer.class);

    private DetachedSequencer() {
    }

    @Override
    public Connection connect(SequencedOperationHandler handler) {
        return new Connection() {
            @Override
            public void close() {
                // nothing to release
            }

            @Override
            public void submit(InkOperation operation) {
                log.trace("Detached, not sequencing {}", operation.type());
            }
        };
    }
}
