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

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

/**
 * Parses XML into {@link ElementNode} trees.
 *
 * <p>Only elements survive the conversion. An element's text is the trimmed concatenation of its
 * direct text and CDATA children, or null when that is blank; comments and processing
 * instructions are dropped.
 */
public final class XmlTreeLoader {
    private static final Logger logger = LoggerFactory.getLogger(XmlTreeLoader.class);

    private XmlTreeLoader() {}

    /** Parses the file at {@code path} and returns its document element. */
    public static ElementNode fromFile(Path path) throws TreeLoadException {
        logger.debug("Parsing {}", path);
        try (InputStream in = Files.newInputStream(path)) {
            return fromDom(newBuilder().parse(in, path.toUri().toString()));
        } catch (IOException | SAXException e) {
            throw new TreeLoadException("Failed to parse " + path + ": " + e.getMessage(), e);
        }
    }

    /** Parses raw markup and returns its document element. */
    public static ElementNode fromString(String xml) throws TreeLoadException {
        try {
            return fromDom(newBuilder().parse(new InputSource(new StringReader(xml))));
        } catch (IOException | SAXException e) {
            throw new TreeLoadException("Failed to parse markup: " + e.getMessage(), e);
        }
    }

    /**
     * Converts an already parsed DOM document or element.
     *
     * @throws IllegalArgumentException for other node types and for a document with no document
     *     element
     */
    public static ElementNode fromDom(Node domNode) {
        if (domNode instanceof Document doc) {
            if (doc.getDocumentElement() == null) {
                throw new IllegalArgumentException("DOM document has no document element");
            }
            return convert(doc.getDocumentElement());
        }
        if (domNode instanceof Element elem) {
            return convert(elem);
        }
        throw new IllegalArgumentException(
                "Expected a DOM Document or Element but got node type " + domNode.getNodeType());
    }

    /** Converts the element members of a DOM node list; other node kinds are skipped. */
    public static List<TreeNode> fromNodeList(NodeList list) {
        List<TreeNode> out = new ArrayList<>(list.getLength());
        for (int i = 0; i < list.getLength(); i++) {
            if (list.item(i) instanceof Element elem) {
                out.add(convert(elem));
            }
        }
        return out;
    }

    // Iterative so that deeply nested documents cannot exhaust the call stack
    private static ElementNode convert(Element root) {
        Deque<PendingElement> stack = new ArrayDeque<>();
        stack.push(new PendingElement(root));
        ElementNode result = null;

        while (!stack.isEmpty()) {
            PendingElement top = stack.peek();
            if (top.next < top.kids.getLength()) {
                Node kid = top.kids.item(top.next++);
                switch (kid.getNodeType()) {
                    case Node.ELEMENT_NODE -> stack.push(new PendingElement((Element) kid));
                    case Node.TEXT_NODE, Node.CDATA_SECTION_NODE ->
                            top.text.append(kid.getNodeValue());
                    default -> {}
                }
                continue;
            }
            stack.pop();
            ElementNode built = top.build();
            if (stack.isEmpty()) {
                result = built;
            } else {
                stack.peek().children.add(built);
            }
        }
        return result;
    }

    /** An element whose children are still being converted. */
    private static final class PendingElement {
        private final Element elem;
        private final NodeList kids;
        private final List<TreeNode> children = new ArrayList<>();
        private final StringBuilder text = new StringBuilder();
        private int next;

        PendingElement(Element elem) {
            this.elem = elem;
            this.kids = elem.getChildNodes();
        }

        ElementNode build() {
            Map<String, String> attributes = new LinkedHashMap<>();
            NamedNodeMap attrs = elem.getAttributes();
            for (int i = 0; i < attrs.getLength(); i++) {
                Attr attr = (Attr) attrs.item(i);
                attributes.put(attr.getName(), attr.getValue());
            }
            String trimmed = text.toString().trim();
            return new ElementNode(
                    elem.getTagName(), attributes, trimmed.isEmpty() ? null : trimmed, children);
        }
    }

    private static DocumentBuilder newBuilder() throws TreeLoadException {
        try {
            DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
            dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            dbf.setXIncludeAware(false);
            dbf.setExpandEntityReferences(false);
            dbf.setIgnoringComments(true);
            dbf.setCoalescing(true);
            DocumentBuilder builder = dbf.newDocumentBuilder();
            // Keeps the default reporter off stderr; fatal errors still throw.
            builder.setErrorHandler(new DefaultHandler());
            return builder;
        } catch (ParserConfigurationException e) {
            throw new TreeLoadException("XML parser is not available: " + e.getMessage(), e);
        }
    }
}
