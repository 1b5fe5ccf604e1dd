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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable rows over a fixed, ordered set of columns. Every row holds a cell for every column;
 * absent values are null.
 */
public final class Table {
    private static final Table EMPTY = new Table(List.of(), List.of());

    private final List<String> columns;
    private final List<Map<String, String>> rows;

    private Table(List<String> columns, List<Map<String, String>> rows) {
        this.columns = columns;
        this.rows = rows;
    }

    public static Table empty() {
        return EMPTY;
    }

    /**
     * Builds a table from rows that may each carry a different subset of columns. Columns appear
     * in the order they are first seen; missing cells become null.
     */
    public static Table of(List<? extends Map<String, String>> rows) {
        LinkedHashSet<String> columns = new LinkedHashSet<>();
        for (Map<String, String> row : rows) {
            columns.addAll(row.keySet());
        }
        return of(new ArrayList<>(columns), rows);
    }

    /** Builds a table with an explicit column order; cells outside {@code columns} are rejected. */
    public static Table of(List<String> columns, List<? extends Map<String, String>> rows) {
        List<String> cols = List.copyOf(new LinkedHashSet<>(columns));
        if (cols.size() != columns.size()) {
            throw new IllegalArgumentException("Duplicate column names in " + columns);
        }
        List<Map<String, String>> aligned = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            for (String key : row.keySet()) {
                if (!cols.contains(key)) {
                    throw new IllegalArgumentException("Row has unknown column '" + key + "'");
                }
            }
            Map<String, String> cells = new LinkedHashMap<>();
            for (String col : cols) {
                cells.put(col, row.get(col));
            }
            aligned.add(Collections.unmodifiableMap(cells));
        }
        return new Table(cols, Collections.unmodifiableList(aligned));
    }

    public List<String> columns() {
        return columns;
    }

    public List<Map<String, String>> rows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty() && columns.isEmpty();
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    /** Cell value, or null if the cell is empty or the column does not exist. */
    public String get(int row, String column) {
        return rows.get(row).get(column);
    }

    /** All values of one column, top to bottom. */
    public List<String> column(String column) {
        if (!hasColumn(column)) {
            throw new IllegalArgumentException("No column '" + column + "' in " + columns);
        }
        List<String> values = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            values.add(row.get(column));
        }
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Table other)) return false;
        return columns.equals(other.columns) && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, rows);
    }

    @Override
    public String toString() {
        return "Table" + columns + " x " + rows.size() + " row(s)";
    }
}
