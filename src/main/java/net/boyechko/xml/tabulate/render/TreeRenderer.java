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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import net.boyechko.xml.tabulate.document.TreeInput;
import net.boyechko.xml.tabulate.walk.TreeVisitor;
import net.boyechko.xml.tabulate.walk.TreeWalker;
import net.boyechko.xml.tabulate.walk.VisitorContext;

/**
 * Renders a node or nodeset as an ASCII tree, one line per visited node:
 *
 * <pre>
 * root
 * |-- listing
 * |   |-- payment_types: paypal
 * |   `-- shipping_info: free
 * `-- listing
 * </pre>
 */
public final class TreeRenderer {
    private static final String BRANCH = "|-- ";
    private static final String LAST_BRANCH = "`-- ";
    private static final String PIPE = "|   ";
    private static final String BLANK = "    ";
    private static final String ELLIPSIS = "...";

    private TreeRenderer() {}

    public static List<String> render(TreeInput input, RenderOptions options) {
        LineCollector collector = new LineCollector(options);
        new TreeWalker().addVisitor(collector).walk(input);
        return collector.lines;
    }

    /**
     * Renders any source accepted by {@link TreeInput#from}.
     *
     * @throws net.boyechko.xml.tabulate.errors.UnsupportedInputKindException if {@code source}
     *     is neither a node nor a nodeset
     */
    public static List<String> render(Object source, RenderOptions options) {
        return render(TreeInput.from(source), options);
    }

    /** Same as {@link #render(Object, RenderOptions)}, joined with newlines. */
    public static String renderToString(Object source, RenderOptions options) {
        return String.join("\n", render(source, options));
    }

    static String label(VisitorContext ctx, int maxTextLength) {
        String text = ctx.node().text();
        if (!ctx.isTerminal() || text == null) {
            return ctx.tag();
        }
        String collapsed = text.strip().replaceAll("\\s+", " ");
        if (collapsed.isEmpty()) {
            return ctx.tag();
        }
        if (collapsed.length() > maxTextLength) {
            int cut = maxTextLength - ELLIPSIS.length();
            // Never split a surrogate pair
            if (Character.isHighSurrogate(collapsed.charAt(cut - 1))) {
                cut--;
            }
            collapsed = collapsed.substring(0, cut) + ELLIPSIS;
        }
        return ctx.tag() + ": " + collapsed;
    }

    private static final class LineCollector implements TreeVisitor {
        private final RenderOptions options;
        private final List<String> lines = new ArrayList<>();
        // One entry per open ancestor below the root: whether it was the last of its siblings
        private final Deque<Boolean> lastFlags = new ArrayDeque<>();

        LineCollector(RenderOptions options) {
            this.options = options;
        }

        @Override
        public String name() {
            return "Tree Renderer";
        }

        @Override
        public boolean enterNode(VisitorContext ctx) {
            if (ctx.isRoot()) {
                if (ctx.rootIndex() > 0) {
                    lines.add(options.separator());
                }
                lines.add(label(ctx, options.maxTextLength()));
            } else {
                String branch = ctx.lastSibling() ? LAST_BRANCH : BRANCH;
                lines.add(prefix() + branch + label(ctx, options.maxTextLength()));
                lastFlags.addLast(ctx.lastSibling());
            }
            return options.depth() == null || ctx.depth() < options.depth();
        }

        @Override
        public void leaveNode(VisitorContext ctx) {
            if (!ctx.isRoot()) {
                lastFlags.removeLast();
            }
        }

        private String prefix() {
            StringBuilder sb = new StringBuilder();
            for (boolean last : lastFlags) {
                sb.append(last ? BLANK : PIPE);
            }
            return sb.toString();
        }
    }
}
