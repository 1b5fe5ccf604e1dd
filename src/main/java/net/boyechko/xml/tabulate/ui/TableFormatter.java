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
package net.boyechko.xml.tabulate.ui;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import net.boyechko.xml.tabulate.table.Table;

/** Prints tables either as aligned text columns or as CSV. */
public class TableFormatter {
    private static final String NULL_MARKER = "NA";
    private static final String COLUMN_GAP = "  ";

    private final PrintStream output;

    public TableFormatter(PrintStream output) {
        this.output = output;
    }

    public void printLines(List<String> lines) {
        for (String line : lines) {
            output.println(line);
        }
    }

    public void printAligned(Table table) {
        if (table.columns().isEmpty()) {
            output.println("(no columns, " + table.rowCount() + " row(s))");
            return;
        }
        List<String> columns = table.columns();
        int[] widths = new int[columns.size()];
        for (int c = 0; c < columns.size(); c++) {
            widths[c] = columns.get(c).length();
            for (Map<String, String> row : table.rows()) {
                widths[c] = Math.max(widths[c], display(row.get(columns.get(c))).length());
            }
        }

        output.println(alignedLine(columns, widths));
        List<String> rule = new ArrayList<>();
        for (int width : widths) {
            rule.add("-".repeat(width));
        }
        output.println(alignedLine(rule, widths));
        for (Map<String, String> row : table.rows()) {
            List<String> cells = columns.stream().map(col -> display(row.get(col))).toList();
            output.println(alignedLine(cells, widths));
        }
    }

    /** RFC 4180 style; null cells are left empty. */
    public void printCsv(Table table) {
        output.println(
                table.columns().stream()
                        .map(TableFormatter::csvField)
                        .collect(Collectors.joining(",")));
        for (Map<String, String> row : table.rows()) {
            output.println(
                    table.columns().stream()
                            .map(col -> csvField(row.get(col)))
                            .collect(Collectors.joining(",")));
        }
    }

    static String csvField(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n")
                || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    private static String display(String value) {
        return value == null ? NULL_MARKER : value.replaceAll("\\s+", " ");
    }

    private static String alignedLine(List<String> cells, int[] widths) {
        StringBuilder sb = new StringBuilder();
        for (int c = 0; c < cells.size(); c++) {
            if (c > 0) sb.append(COLUMN_GAP);
            String cell = cells.get(c);
            sb.append(cell);
            if (c < cells.size() - 1) {
                sb.append(" ".repeat(widths[c] - cell.length()));
            }
        }
        return sb.toString();
    }
}
