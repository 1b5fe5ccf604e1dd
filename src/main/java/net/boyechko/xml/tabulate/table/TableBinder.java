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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.boyechko.xml.tabulate.errors.RowCountMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Combines tables. Inputs are never modified; every operation returns a new {@link Table}.
 *
 * <p>Empty strings are kept as-is by {@link #bindRows} and {@link #bindColumns} so that
 * intermediate tables can still be inspected; {@link #normalizeBlanks} is meant to run once on
 * the final result.
 */
public final class TableBinder {
    private static final Logger logger = LoggerFactory.getLogger(TableBinder.class);

    private TableBinder() {}

    /** Stacks tables vertically over the union of their columns. */
    public static Table bindRows(List<Table> tables) {
        LinkedHashSet<String> columns = new LinkedHashSet<>();
        List<Map<String, String>> rows = new ArrayList<>();
        for (Table table : tables) {
            columns.addAll(table.columns());
            rows.addAll(table.rows());
        }
        if (columns.isEmpty() && rows.isEmpty()) {
            return Table.empty();
        }
        return Table.of(new ArrayList<>(columns), rows);
    }

    /**
     * Places tables side by side. Every table must have the same row count, including tables with
     * no rows at all. A column name already taken by an earlier table is renamed {@code name.1},
     * {@code name.2}, ...
     *
     * @throws RowCountMismatchException if the tables differ in row count
     */
    public static Table bindColumns(List<Table> tables) {
        if (tables.isEmpty()) {
            return Table.empty();
        }

        List<Integer> counts = tables.stream().map(Table::rowCount).toList();
        if (new HashSet<>(counts).size() > 1) {
            throw new RowCountMismatchException(counts);
        }
        int rowCount = counts.get(0);

        List<String> columns = new ArrayList<>();
        Set<String> taken = new HashSet<>();
        List<Map<String, String>> rows = new ArrayList<>(rowCount);
        for (int i = 0; i < rowCount; i++) {
            rows.add(new LinkedHashMap<>());
        }

        for (Table part : tables) {
            for (String column : part.columns()) {
                String name = uniqueName(column, taken);
                if (!name.equals(column)) {
                    logger.debug("Column '{}' already bound; renamed to '{}'", column, name);
                }
                columns.add(name);
                for (int i = 0; i < rowCount; i++) {
                    rows.get(i).put(name, part.get(i, column));
                }
            }
        }
        return Table.of(columns, rows);
    }

    /** Replaces every empty-string cell with null. Other values are left alone. */
    public static Table normalizeBlanks(Table table) {
        List<Map<String, String>> rows = new ArrayList<>(table.rowCount());
        for (Map<String, String> row : table.rows()) {
            Map<String, String> cells = new LinkedHashMap<>(row);
            cells.replaceAll((column, value) -> value != null && value.isEmpty() ? null : value);
            rows.add(cells);
        }
        return Table.of(table.columns(), rows);
    }

    private static String uniqueName(String column, Set<String> taken) {
        String name = column;
        int suffix = 0;
        while (!taken.add(name)) {
            suffix++;
            name = column + "." + suffix;
        }
        return name;
    }
}
