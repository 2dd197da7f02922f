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

import javax.vecmath.Tuple2f;

/**
 * Observer notified when the points of an id are first recorded in a leaf. A single id is typically registered with
 * many leaves as its points spread across partitions, and again with the children of a leaf that splits.
 *
 * @param <P> the point type
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface IdRegistrationListener<P extends Tuple2f> {

    void onRegistered(String id, QuadRegion.Leaf<P> leaf, P point);
}
