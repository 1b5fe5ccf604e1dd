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

import java.util.ArrayList;
import java.util.List;

/** Utilities for inspecting trees built from {@link TreeNode}s. */
public final class Trees {

    private Trees() {}

    /** A node is terminal iff it has no element children, whatever text it carries. */
    public static boolean isTerminal(TreeNode node) {
        return node.children().isEmpty();
    }

    /** Returns the node's text, or the empty string when it has none. */
    public static String textOf(TreeNode node) {
        String text = node.text();
        return text != null ? text : "";
    }

    /** Returns all children with the given tag, in document order. */
    public static List<TreeNode> childrenTagged(TreeNode parent, String tag) {
        List<TreeNode> out = new ArrayList<>();
        for (TreeNode kid : parent.children()) {
            if (kid.tag().equals(tag)) {
                out.add(kid);
            }
        }
        return out;
    }
}
