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

import java.nio.file.Path;
import javax.xml.parsers.DocumentBuilderFactory;
import net.boyechko.xml.tabulate.TreeTestBase;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;

class XmlTreeLoaderTest extends TreeTestBase {

    @Test
    void keepsElementsAttributesAndTrimmedText() throws Exception {
        ElementNode root =
                XmlTreeLoader.fromString(
                        "<root><item id=\"7\" kind=\"x\">  hello  </item><!-- note --><empty/></root>");

        assertEquals("root[item, empty]", root.toString());
        TreeNode item = root.children().get(0);
        assertEquals("hello", item.text());
        assertEquals("7", item.attributes().get("id"));
        assertEquals("x", item.attributes().get("kind"));
        assertNull(root.children().get(1).text(), "Empty element has no text");
        assertNull(root.text(), "Whitespace between elements is not text");
    }

    @Test
    void cdataCountsAsText() throws Exception {
        ElementNode root = XmlTreeLoader.fromString("<a><![CDATA[x < y]]></a>");
        assertEquals("x < y", root.text());
    }

    @Test
    void loadsFileFromDisk() throws Exception {
        ElementNode root = XmlTreeLoader.fromFile(resourcePath("listings.xml"));
        assertEquals("root", root.tag());
        assertEquals(2, Trees.childrenTagged(root, "listing").size());
        assertEquals("Ann's Antiques", descendant(root, 0, 2, 0).text());
    }

    @Test
    void malformedMarkupIsALoadFailure() {
        TreeLoadException e =
                assertThrows(TreeLoadException.class, () -> XmlTreeLoader.fromString("<a><b></a>"));
        assertNotNull(e.getCause());
    }

    @Test
    void missingFileIsALoadFailure() {
        Path missing = tempDir.resolve("nope.xml");
        assertThrows(TreeLoadException.class, () -> XmlTreeLoader.fromFile(missing));
    }

    @Test
    void loadsVeryDeepDocuments() throws Exception {
        int depth = 10_000;
        ElementNode root = XmlTreeLoader.fromString(deepChainXml(depth));

        TreeNode node = root;
        int levels = 0;
        while (!node.children().isEmpty()) {
            node = node.children().get(0);
            levels++;
        }
        assertEquals(depth, levels);
        assertEquals("bottom", node.text());
    }

    @Test
    void documentWithoutElementIsRejected() throws Exception {
        Document empty = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
        assertThrows(IllegalArgumentException.class, () -> XmlTreeLoader.fromDom(empty));
    }

    @Test
    void doctypeIsRefused() {
        String xml =
                "<?xml version=\"1.0\"?><!DOCTYPE a [<!ENTITY e SYSTEM \"file:///etc/passwd\">]>"
                        + "<a>&e;</a>";
        assertThrows(TreeLoadException.class, () -> XmlTreeLoader.fromString(xml));
    }
}
