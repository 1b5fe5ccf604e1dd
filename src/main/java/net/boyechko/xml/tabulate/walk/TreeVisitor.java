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
package net.boyechko.xml.tabulate.walk;

/** Visitor interface for tree traversal. */
public interface TreeVisitor {

    /** Short human-readable name, used in log messages. */
    String name();

    /**
     * Called before the node's children are visited.
     *
     * @return false to skip the node's children; {@link #leaveNode} is still called
     */
    default boolean enterNode(VisitorContext ctx) {
        return true;
    }

    default void leaveNode(VisitorContext ctx) {}

    default void beforeTraversal() {}

    default void afterTraversal() {}
}
