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

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.xml.tabulate.TreeTestBase;
import org.junit.jupiter.api.Test;

class TreesTest extends TreeTestBase {

    @Test
    void terminalMeansNoElementChildren() {
        assertTrue(Trees.isTerminal(ElementNode.leaf("b", "text")));
        assertTrue(Trees.isTerminal(ElementNode.empty("b")));
        assertFalse(Trees.isTerminal(abcd()));
    }

    @Test
    void nodeWithTextAndChildrenIsNotTerminal() {
        ElementNode mixed =
                new ElementNode("p", Map.of(), "some text", List.of(ElementNode.empty("br")));
        assertFalse(Trees.isTerminal(mixed));
    }

    @Test
    void textOfMissingTextIsEmpty() {
        assertEquals("", Trees.textOf(ElementNode.empty("x")));
        assertEquals("1", Trees.textOf(ElementNode.leaf("x", "1")));
    }

    @Test
    void childLookupsFollowDocumentOrder() {
        ElementNode root = flatListings();
        List<TreeNode> listings = Trees.childrenTagged(root, "listing");
        assertEquals(2, listings.size());
        assertSame(root.children().get(1), listings.get(1));
        assertTrue(Trees.childrenTagged(root, "missing").isEmpty());
    }

    @Test
    void elementNodeCopiesItsInputs() {
        Map<String, String> attributes = new HashMap<>(Map.of("id", "7"));
        List<TreeNode> children = new ArrayList<>(List.of(ElementNode.empty("b")));
        ElementNode node = new ElementNode("a", attributes, null, children);

        attributes.put("kind", "x");
        children.add(ElementNode.empty("c"));

        assertEquals(Map.of("id", "7"), node.attributes());
        assertEquals("a[b]", node.toString());
        assertThrows(
                UnsupportedOperationException.class,
                () -> node.children().add(ElementNode.empty("c")));
    }

    @Test
    void bracketNotationNestsChildren() {
        assertEquals("a[b, c[d]]", abcd().toString());
        assertEquals("x", ElementNode.empty("x").toString());
    }

    @Test
    void bracketNotationHandlesVeryDeepTrees() {
        int depth = 10_000;
        String text = deepChain(depth).toString();
        assertEquals("e[".repeat(depth) + "e" + "]".repeat(depth), text);
    }
}
