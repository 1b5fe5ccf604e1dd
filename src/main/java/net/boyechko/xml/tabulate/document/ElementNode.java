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

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Immutable {@link TreeNode} produced by {@link XmlTreeLoader} and used throughout the tests. */
public record ElementNode(
        String tag, Map<String, String> attributes, String text, List<TreeNode> children)
        implements TreeNode {

    public ElementNode {
        Objects.requireNonNull(tag, "tag");
        attributes =
                attributes == null || attributes.isEmpty()
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        children = children == null ? List.of() : List.copyOf(children);
    }

    /** Creates a terminal node holding the given text. */
    public static ElementNode leaf(String tag, String text) {
        return new ElementNode(tag, Map.of(), text, List.of());
    }

    /** Creates a terminal node with no text. */
    public static ElementNode empty(String tag) {
        return new ElementNode(tag, Map.of(), null, List.of());
    }

    /** Creates a node with children. */
    public static ElementNode branch(String tag, TreeNode... children) {
        return new ElementNode(tag, Map.of(), null, List.of(children));
    }

    /** Returns a compact bracket notation, e.g. {@code root[listing[price, seller[name]]]}. */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        // Holds nodes still to print and the separators between them
        Deque<Object> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            Object item = pending.pop();
            if (item instanceof String token) {
                sb.append(token);
                continue;
            }
            TreeNode node = (TreeNode) item;
            sb.append(node.tag());
            List<TreeNode> kids = node.children();
            if (kids.isEmpty()) {
                continue;
            }
            sb.append('[');
            pending.push("]");
            for (int i = kids.size() - 1; i >= 0; i--) {
                pending.push(kids.get(i));
                if (i > 0) {
                    pending.push(", ");
                }
            }
        }
        return sb.toString();
    }
}
