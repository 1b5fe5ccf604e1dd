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
import java.util.Collection;
import java.util.List;
import net.boyechko.xml.tabulate.errors.UnsupportedInputKindException;

/**
 * Either a single node or a nodeset. Every public entry point accepts this variant and works on
 * {@link #roots()}, so a lone node is just a nodeset of one.
 */
public sealed interface TreeInput permits TreeInput.SingleNode, TreeInput.NodeCollection {

    /** The traversal roots, in order. */
    List<TreeNode> roots();

    record SingleNode(TreeNode node) implements TreeInput {
        public SingleNode {
            if (node == null) {
                throw new UnsupportedInputKindException("null");
            }
        }

        @Override
        public List<TreeNode> roots() {
            return List.of(node);
        }
    }

    /** Members need not share a parent; each is treated as an independent tree. */
    record NodeCollection(List<TreeNode> nodes) implements TreeInput {
        public NodeCollection {
            nodes = List.copyOf(nodes);
        }

        @Override
        public List<TreeNode> roots() {
            return nodes;
        }
    }

    static TreeInput of(TreeNode node) {
        return new SingleNode(node);
    }

    static TreeInput of(List<? extends TreeNode> nodes) {
        return new NodeCollection(new ArrayList<>(nodes));
    }

    /**
     * Normalizes any supported source into a {@link TreeInput}: a {@link TreeNode}, a collection
     * or array of them, or a DOM handle ({@code Document}, {@code Element}, {@code NodeList}).
     *
     * @throws UnsupportedInputKindException for anything else, including null, an empty DOM
     *     document and collections holding non-node members
     */
    static TreeInput from(Object source) {
        if (source instanceof TreeInput input) {
            return input;
        }
        if (source instanceof TreeNode node) {
            return new SingleNode(node);
        }
        if (source instanceof TreeNode[] array) {
            return collectionOf(List.of(array));
        }
        if (source instanceof Collection<?> members) {
            return collectionOf(members);
        }
        if (source instanceof org.w3c.dom.Document doc) {
            if (doc.getDocumentElement() == null) {
                throw new UnsupportedInputKindException("DOM document without a document element");
            }
            return new SingleNode(XmlTreeLoader.fromDom(doc));
        }
        if (source instanceof org.w3c.dom.Element elem) {
            return new SingleNode(XmlTreeLoader.fromDom(elem));
        }
        if (source instanceof org.w3c.dom.NodeList list) {
            return new NodeCollection(XmlTreeLoader.fromNodeList(list));
        }
        throw new UnsupportedInputKindException(describe(source));
    }

    private static TreeInput collectionOf(Collection<?> members) {
        List<TreeNode> nodes = new ArrayList<>(members.size());
        for (Object member : members) {
            if (!(member instanceof TreeNode node)) {
                throw new UnsupportedInputKindException(
                        "collection member " + describe(member));
            }
            nodes.add(node);
        }
        return new NodeCollection(nodes);
    }

    private static String describe(Object source) {
        return source == null ? "null" : source.getClass().getName();
    }
}
