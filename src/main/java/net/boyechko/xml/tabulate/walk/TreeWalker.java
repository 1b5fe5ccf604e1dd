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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import net.boyechko.xml.tabulate.document.Address;
import net.boyechko.xml.tabulate.document.TreeInput;
import net.boyechko.xml.tabulate.document.TreeNode;
import net.boyechko.xml.tabulate.errors.MalformedTreeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks each root of a {@link TreeInput} depth-first, pre-order, children in document order,
 * invoking every registered visitor at each node.
 *
 * <p>A walker keeps per-walk state and is not meant to be shared between threads.
 */
public class TreeWalker {
    private static final Logger logger = LoggerFactory.getLogger(TreeWalker.class);

    private final List<TreeVisitor> visitors = new ArrayList<>();

    private Set<TreeNode> ancestors;
    private int globalIndex;

    public TreeWalker addVisitor(TreeVisitor visitor) {
        visitors.add(visitor);
        return this;
    }

    public void walk(TreeInput input) {
        this.ancestors = Collections.newSetFromMap(new IdentityHashMap<>());
        this.globalIndex = 0;

        for (TreeVisitor visitor : visitors) {
            visitor.beforeTraversal();
        }

        List<TreeNode> roots = input.roots();
        for (int i = 0; i < roots.size(); i++) {
            walkRoot(roots.get(i), i, i == roots.size() - 1);
        }
        if (logger.isDebugEnabled()) {
            logger.debug(
                    "Walked {} node(s) across {} root(s) with {}",
                    globalIndex,
                    roots.size(),
                    visitors.stream().map(TreeVisitor::name).toList());
        }

        for (TreeVisitor visitor : visitors) {
            visitor.afterTraversal();
        }
    }

    // Frames on an explicit stack rather than recursion, so depth is bounded by heap only
    private void walkRoot(TreeNode root, int rootIndex, boolean lastRoot) {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(enter(root, Address.root(root.tag()), 0, rootIndex, lastRoot, rootIndex));

        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            if (top.next < top.children.size()) {
                int i = top.next++;
                TreeNode child = top.children.get(i);
                stack.push(
                        enter(
                                child,
                                top.ctx.address().child(child.tag()),
                                top.ctx.depth() + 1,
                                i,
                                i == top.children.size() - 1,
                                rootIndex));
            } else {
                stack.pop();
                leave(top.ctx);
            }
        }
    }

    private Frame enter(
            TreeNode node,
            Address address,
            int depth,
            int siblingIndex,
            boolean lastSibling,
            int rootIndex) {
        if (!ancestors.add(node)) {
            throw new MalformedTreeException(
                    "Node <" + node.tag() + "> at " + address + " is its own ancestor");
        }
        globalIndex++;

        VisitorContext ctx =
                new VisitorContext(
                        node, address, depth, siblingIndex, lastSibling, rootIndex, globalIndex);

        // Children are visited unless any visitor declines
        boolean continueToChildren = true;
        for (TreeVisitor visitor : visitors) {
            if (!visitor.enterNode(ctx)) {
                continueToChildren = false;
            }
        }
        return new Frame(ctx, continueToChildren ? node.children() : List.of());
    }

    private void leave(VisitorContext ctx) {
        for (TreeVisitor visitor : visitors) {
            visitor.leaveNode(ctx);
        }
        ancestors.remove(ctx.node());
    }

    /** A node that has been entered, with the index of its next child to visit. */
    private static final class Frame {
        private final VisitorContext ctx;
        private final List<TreeNode> children;
        private int next;

        Frame(VisitorContext ctx, List<TreeNode> children) {
            this.ctx = ctx;
            this.children = children;
        }
    }
}
