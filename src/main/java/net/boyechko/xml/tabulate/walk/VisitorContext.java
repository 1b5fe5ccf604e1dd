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

import net.boyechko.xml.tabulate.document.Address;
import net.boyechko.xml.tabulate.document.TreeNode;
import net.boyechko.xml.tabulate.document.Trees;

/**
 * Immutable context passed to visitors during traversal. Carries the node's address, computed
 * from the walker's stack since nodes keep no parent pointers.
 */
public record VisitorContext(
        TreeNode node,
        Address address,
        /** Depth below the traversal root (0 = the root itself). */
        int depth,
        /** Position among the parent's children, or among the roots for a root. */
        int siblingIndex,
        boolean lastSibling,
        /** Which member of the input this node belongs to. */
        int rootIndex,
        /** Index in traversal order (1-based). */
        int globalIndex) {

    public boolean isTerminal() {
        return Trees.isTerminal(node);
    }

    public boolean isRoot() {
        return depth == 0;
    }

    public String tag() {
        return node.tag();
    }

    /** Address of the parent, or null at the traversal root. */
    public Address parentAddress() {
        return address.parent();
    }
}
