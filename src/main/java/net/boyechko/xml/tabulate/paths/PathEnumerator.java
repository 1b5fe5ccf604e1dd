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
package net.boyechko.xml.tabulate.paths;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import net.boyechko.xml.tabulate.document.Address;
import net.boyechko.xml.tabulate.document.TreeInput;
import net.boyechko.xml.tabulate.walk.TreeVisitor;
import net.boyechko.xml.tabulate.walk.TreeWalker;
import net.boyechko.xml.tabulate.walk.VisitorContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enumerates the addresses reachable in a node or nodeset, in document order.
 *
 * <p>Nodeset members are enumerated independently and their results concatenated. Members with
 * different structures are not reconciled: with {@code onlyTerminalParent}, deduplication happens
 * within each member, so two members sharing a parent address both report it. Callers that want
 * the union across members can pass the result through {@link #distinct}.
 */
public final class PathEnumerator {
    private static final Logger logger = LoggerFactory.getLogger(PathEnumerator.class);

    private PathEnumerator() {}

    public static List<NodePath> enumerate(TreeInput input, PathOptions options) {
        PathCollector collector = new PathCollector(options.onlyTerminalParent());
        new TreeWalker().addVisitor(collector).walk(input);
        logger.debug(
                "Enumerated {} address(es) from {} root(s)",
                collector.result().size(),
                input.roots().size());
        return collector.result();
    }

    public static List<NodePath> enumerate(Object source, PathOptions options) {
        return enumerate(TreeInput.from(source), options);
    }

    /** Text form of {@link #enumerate}, with the terminal marker applied. */
    public static List<String> addresses(Object source, PathOptions options) {
        List<String> out = new ArrayList<>();
        for (NodePath path : enumerate(TreeInput.from(source), options)) {
            out.add(path.render(options.markTerminal()));
        }
        return out;
    }

    /** Drops repeated addresses, keeping first occurrences in order. */
    public static List<NodePath> distinct(List<NodePath> paths) {
        return new ArrayList<>(new LinkedHashSet<>(paths));
    }

    private static final class PathCollector implements TreeVisitor {
        private final boolean onlyTerminalParent;
        private final List<NodePath> result = new ArrayList<>();
        // Parent addresses seen in the current member; reset at each root
        private final Map<Address, NodePath> parents = new LinkedHashMap<>();

        PathCollector(boolean onlyTerminalParent) {
            this.onlyTerminalParent = onlyTerminalParent;
        }

        @Override
        public String name() {
            return "Path Collector";
        }

        @Override
        public boolean enterNode(VisitorContext ctx) {
            if (!onlyTerminalParent) {
                result.add(new NodePath(ctx.address(), ctx.isTerminal()));
                return true;
            }
            if (ctx.isRoot()) {
                flushParents();
            }
            if (ctx.isTerminal()) {
                Address parent = ctx.parentAddress();
                if (parent == null) {
                    parents.putIfAbsent(ctx.address(), new NodePath(ctx.address(), true));
                } else {
                    parents.putIfAbsent(parent, new NodePath(parent, false));
                }
            }
            return true;
        }

        @Override
        public void afterTraversal() {
            flushParents();
        }

        List<NodePath> result() {
            return result;
        }

        private void flushParents() {
            result.addAll(parents.values());
            parents.clear();
        }
    }
}
