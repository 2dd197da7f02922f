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

import java.util.regex.Pattern;

/**
 * RGBA color. Channels r, g and b are in [0, 255]; alpha is in [0, 1].
 *
 * @author hal.hildebrand
 */
public record Color(int r, int g, int b, float a) {
    public static final Color BLACK = new Color(0, 0, 0, 1.0f);

    private static final Pattern NON_CHANNEL = Pattern.compile("[^\\d,]");

    /**
     * Parse a CSS style color such as {@code rgb(12, 34, 56)} into an opaque color. Anything but digits and commas is
     * ignored.
     *
     * @throws IllegalArgumentException if fewer than three channels are present
     */
    public static Color parse(String css) {
        var channels = NON_CHANNEL.matcher(css).replaceAll("").split(",");
        if (channels.length < 3) {
            throw new IllegalArgumentException("Not an rgb color: " + css);
        }
        try {
            return new Color(Integer.parseInt(channels[0]), Integer.parseInt(channels[1]),
                             Integer.parseInt(channels[2]), 1.0f);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not an rgb color: " + css, e);
        }
    }
}
