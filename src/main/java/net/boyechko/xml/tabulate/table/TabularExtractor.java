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
package net.boyechko.xml.tabulate.table;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.xml.tabulate.document.Address;
import net.boyechko.xml.tabulate.document.TreeInput;
import net.boyechko.xml.tabulate.document.TreeNode;
import net.boyechko.xml.tabulate.document.Trees;
import net.boyechko.xml.tabulate.walk.TreeVisitor;
import net.boyechko.xml.tabulate.walk.TreeWalker;
import net.boyechko.xml.tabulate.walk.VisitorContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the instances matching an address into table rows, one row per instance.
 *
 * <p>By default only the immediate terminal children of an instance become columns; non-terminal
 * children are skipped without visiting their subtrees. With {@link ExtractOptions#dig()} every
 * terminal descendant becomes a column instead. In both modes, terminals sharing a tag within one
 * instance are merged into a single cell, joined by the delimiter in document order.
 */
public final class TabularExtractor {
    private static final Logger logger = LoggerFactory.getLogger(TabularExtractor.class);

    private TabularExtractor() {}

    /**
     * @throws net.boyechko.xml.tabulate.errors.InvalidAddressException if the address is malformed
     * @throws net.boyechko.xml.tabulate.errors.UnsupportedInputKindException if the source is not a
     *     node, nodeset or DOM handle
     */
    public static Table extract(String address, Object source, ExtractOptions options) {
        return extract(Address.parse(address), TreeInput.from(source), options);
    }

    public static Table extract(Address address, TreeInput input, ExtractOptions options) {
        List<TreeNode> instances = resolve(address, input);
        logger.debug(
                "{} matched {} instance(s) ({} mode)",
                address,
                instances.size(),
                options.dig() ? "deep" : "shallow");
        if (instances.isEmpty()) {
            return Table.empty();
        }

        List<Table> perInstance = new ArrayList<>(instances.size());
        for (TreeNode instance : instances) {
            Map<String, String> row =
                    options.dig()
                            ? digRow(instance, options.delimiter())
                            : shallowRow(instance, options.delimiter());
            perInstance.add(Table.of(List.of(row)));
        }
        return TableBinder.bindRows(perInstance);
    }

    /** Nodes matching {@code address}, in document order. Roots match the first segment. */
    public static List<TreeNode> resolve(Address address, TreeInput input) {
        List<String> segments = address.segments();
        List<TreeNode> current = new ArrayList<>();
        for (TreeNode root : input.roots()) {
            if (root.tag().equals(segments.get(0))) {
                current.add(root);
            }
        }
        for (int i = 1; i < segments.size() && !current.isEmpty(); i++) {
            List<TreeNode> next = new ArrayList<>();
            for (TreeNode node : current) {
                next.addAll(Trees.childrenTagged(node, segments.get(i)));
            }
            current = next;
        }
        return current;
    }

    private static Map<String, String> shallowRow(TreeNode instance, String delimiter) {
        Map<String, String> row = new LinkedHashMap<>();
        for (TreeNode child : instance.children()) {
            if (Trees.isTerminal(child)) {
                merge(row, child.tag(), Trees.textOf(child), delimiter);
            }
        }
        return row;
    }

    private static Map<String, String> digRow(TreeNode instance, String delimiter) {
        TerminalCollector collector = new TerminalCollector(delimiter);
        // Walk each child as its own root so the instance itself never becomes a column
        new TreeWalker().addVisitor(collector).walk(TreeInput.of(instance.children()));
        return collector.row;
    }

    private static void merge(
            Map<String, String> row, String column, String value, String delimiter) {
        row.merge(column, value, (existing, added) -> existing + delimiter + added);
    }

    private static final class TerminalCollector implements TreeVisitor {
        private final String delimiter;
        private final Map<String, String> row = new LinkedHashMap<>();

        TerminalCollector(String delimiter) {
            this.delimiter = delimiter;
        }

        @Override
        public String name() {
            return "Terminal Collector";
        }

        @Override
        public boolean enterNode(VisitorContext ctx) {
            if (ctx.isTerminal()) {
                merge(row, ctx.tag(), Trees.textOf(ctx.node()), delimiter);
            }
            return true;
        }
    }
}
