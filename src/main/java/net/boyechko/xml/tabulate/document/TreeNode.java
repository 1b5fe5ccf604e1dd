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
package net.boyechko.xml.tabulate.document;

import java.util.List;
import java.util.Map;

/**
 * One element of a parsed tree document.
 *
 * <p>Implementations are expected to be immutable and acyclic. Children are owned exclusively by
 * their parent; a node carries no reference back to it.
 */
public interface TreeNode {

    /** Tag name; not unique among siblings. */
    String tag();

    /** Attribute name to value. Iteration order carries no meaning. */
    Map<String, String> attributes();

    /** Plain text content, or null when the node has none. */
    String text();

    /** Element children in document order; empty for terminal nodes. */
    List<TreeNode> children();
}
