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
package net.boyechko.xml.tabulate;

import static net.boyechko.xml.tabulate.document.ElementNode.branch;
import static net.boyechko.xml.tabulate.document.ElementNode.leaf;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import net.boyechko.xml.tabulate.document.ElementNode;
import net.boyechko.xml.tabulate.document.TreeNode;
import org.junit.jupiter.api.io.TempDir;

/** Base for tests that need the shared sample trees or files on disk. */
public abstract class TreeTestBase {

    @TempDir protected Path tempDir;

    // ── Sample trees ────────────────────────────────────────────────

    /** {@code a[b, c[d]]}: one terminal child, one branching child. */
    protected static ElementNode abcd() {
        return branch("a", leaf("b", "1"), branch("c", leaf("d", "2")));
    }

    /** Two flat listings under one root. */
    protected static ElementNode flatListings() {
        return branch(
                "root",
                branch("listing", leaf("payment_types", "paypal"), leaf("shipping_info", "free")),
                branch("listing", leaf("payment_types", "cod"), leaf("shipping_info", "paid")));
    }

    /** One listing with a nested seller_info that shallow extraction must not enter. */
    protected static ElementNode nestedListing() {
        return branch(
                "root",
                branch(
                        "listing",
                        leaf("payment_types", "paypal"),
                        leaf("shipping_info", "free"),
                        branch("seller_info", leaf("name", "Ann"), leaf("rating", "4.8"))));
    }

    /** A single chain of {@code e} elements, {@code depth} levels below the root. */
    protected static ElementNode deepChain(int depth) {
        ElementNode node = leaf("e", "bottom");
        for (int i = 0; i < depth; i++) {
            node = branch("e", node);
        }
        return node;
    }

    /** Markup for the same chain as {@link #deepChain}. */
    protected static String deepChainXml(int depth) {
        return "<e>".repeat(depth) + "<e>bottom</e>" + "</e>".repeat(depth);
    }

    /** Follows child indices down from {@code root}. */
    protected static TreeNode descendant(TreeNode root, int... indices) {
        TreeNode current = root;
        for (int idx : indices) {
            current = current.children().get(idx);
        }
        return current;
    }

    // ── File helpers ────────────────────────────────────────────────

    /** Path of a file under src/test/resources. */
    protected static Path resourcePath(String name) {
        try {
            return Path.of(TreeTestBase.class.getResource("/" + name).toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException("Bad resource URI for " + name, e);
        }
    }

    protected static String readResource(String name) {
        try {
            return Files.readString(resourcePath(name));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read resource " + name, e);
        }
    }

    protected final Path writeTempFile(String name, String content) {
        Path path = tempDir.resolve(name);
        try {
            Files.writeString(path, content);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + path, e);
        }
        return path;
    }
}
