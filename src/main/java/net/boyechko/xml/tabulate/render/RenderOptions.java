/*
 * XML-Tabulate - Terminal-aware exploration and flattening of XML trees
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.xml.tabulate.render;

/**
 * Options for {@link TreeRenderer}.
 *
 * @param depth levels expanded below each root; null for no limit, 0 for the root line only
 * @param maxTextLength longest text shown for a terminal node before it is cut with "..."
 * @param separator line placed between the trees of a nodeset
 */
public record RenderOptions(Integer depth, int maxTextLength, String separator) {
    public static final int DEFAULT_MAX_TEXT_LENGTH = 40;

    public RenderOptions {
        if (depth != null && depth < 0) {
            throw new IllegalArgumentException("depth must be >= 0 but was " + depth);
        }
        if (maxTextLength < 4) {
            throw new IllegalArgumentException(
                    "maxTextLength must be at least 4 but was " + maxTextLength);
        }
        if (separator == null) {
            separator = "";
        }
    }

    public static RenderOptions defaults() {
        return new RenderOptions(null, DEFAULT_MAX_TEXT_LENGTH, "");
    }

    public RenderOptions withDepth(Integer newDepth) {
        return new RenderOptions(newDepth, maxTextLength, separator);
    }

    public RenderOptions withMaxTextLength(int length) {
        return new RenderOptions(depth, length, separator);
    }
}
