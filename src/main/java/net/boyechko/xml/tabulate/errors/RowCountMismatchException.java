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
package net.boyechko.xml.tabulate.errors;

import java.util.List;

/** Tables being bound side by side do not have the same number of rows. */
public class RowCountMismatchException extends TabulationException {
    private final List<Integer> rowCounts;

    public RowCountMismatchException(List<Integer> rowCounts) {
        super("Cannot bind columns of tables with row counts " + rowCounts);
        this.rowCounts = List.copyOf(rowCounts);
    }

    public List<Integer> getRowCounts() {
        return rowCounts;
    }
}
