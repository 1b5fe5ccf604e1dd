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

import java.util.List;
import java.util.Objects;
import net.boyechko.xml.tabulate.errors.InvalidAddressException;

/**
 * Structural position in a tree: the tag names from a traversal root down to a node, written
 * {@code /root/listing/seller_info}. Sibling indices are not encoded, so one address may match
 * several nodes.
 *
 * <p>Addresses share their prefixes: a child holds a reference to its parent address, so
 * extending an address during a walk costs the same at any depth.
 */
public final class Address {
    public static final String SEPARATOR = "/";

    private final Address parent;
    private final String leaf;
    private final int length;
    private final int hash;

    private Address(Address parent, String leaf) {
        this.parent = parent;
        this.leaf = Objects.requireNonNull(leaf, "segment");
        this.length = parent == null ? 1 : parent.length + 1;
        this.hash = 31 * (parent == null ? 0 : parent.hash) + leaf.hashCode();
    }

    /** Address of a traversal root. */
    public static Address root(String tag) {
        return new Address(null, tag);
    }

    /**
     * Parses {@code /segment1/segment2/...}.
     *
     * @throws InvalidAddressException if the string is null or empty, lacks the leading separator,
     *     or has an empty or blank segment
     */
    public static Address parse(String text) {
        if (text == null || text.isEmpty()) {
            throw new InvalidAddressException(String.valueOf(text), "address is empty");
        }
        if (!text.startsWith(SEPARATOR)) {
            throw new InvalidAddressException(text, "address must start with '" + SEPARATOR + "'");
        }
        // limit -1 keeps trailing empty strings so "/a/" is caught below
        String[] parts = text.substring(1).split(SEPARATOR, -1);
        Address address = null;
        for (String part : parts) {
            if (part.isBlank()) {
                throw new InvalidAddressException(text, "empty segment");
            }
            address = new Address(address, part);
        }
        return address;
    }

    public Address child(String tag) {
        return new Address(this, tag);
    }

    /** The address with its last segment dropped, or null for a root address. */
    public Address parent() {
        return parent;
    }

    public String leaf() {
        return leaf;
    }

    /** Number of segments; a root address has length 1. */
    public int length() {
        return length;
    }

    /** The segments from the root down, as a new list. */
    public List<String> segments() {
        return List.of(segmentArray());
    }

    private String[] segmentArray() {
        String[] out = new String[length];
        Address current = this;
        for (int i = length - 1; i >= 0; i--) {
            out[i] = current.leaf;
            current = current.parent;
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Address other)) {
            return false;
        }
        Address a = this;
        Address b = other;
        while (a != b) {
            if (a == null
                    || b == null
                    || a.hash != b.hash
                    || a.length != b.length
                    || !a.leaf.equals(b.leaf)) {
                return false;
            }
            a = a.parent;
            b = b.parent;
        }
        return true;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return SEPARATOR + String.join(SEPARATOR, segmentArray());
    }
}
