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

/**
 * Options for {@link TabularExtractor}.
 *
 * @param dig descend through non-terminal children and merge every terminal descendant
 * @param delimiter joins the values of same-tag terminals within one instance
 */
public record ExtractOptions(boolean dig, String delimiter) {
    public static final String DEFAULT_DELIMITER = ",";

    public ExtractOptions {
        if (delimiter == null) {
            delimiter = DEFAULT_DELIMITER;
        }
    }

    public static ExtractOptions shallow() {
        return new ExtractOptions(false, DEFAULT_DELIMITER);
    }

    public static ExtractOptions deep() {
        return new ExtractOptions(true, DEFAULT_DELIMITER);
    }

    public ExtractOptions withDig(boolean enabled) {
        return new ExtractOptions(enabled, delimiter);
    }
}
