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
package net.boyechko.xml.tabulate.core;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.xml.tabulate.document.Address;
import net.boyechko.xml.tabulate.document.ElementNode;
import net.boyechko.xml.tabulate.document.TreeInput;
import net.boyechko.xml.tabulate.document.TreeLoadException;
import net.boyechko.xml.tabulate.document.XmlTreeLoader;
import net.boyechko.xml.tabulate.paths.PathEnumerator;
import net.boyechko.xml.tabulate.paths.PathOptions;
import net.boyechko.xml.tabulate.render.RenderOptions;
import net.boyechko.xml.tabulate.render.TreeRenderer;
import net.boyechko.xml.tabulate.table.ExtractOptions;
import net.boyechko.xml.tabulate.table.Table;
import net.boyechko.xml.tabulate.table.TableBinder;
import net.boyechko.xml.tabulate.table.TabularExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Front door for exploring and tabulating one source: lists addresses, renders the tree, and
 * turns a list of addresses into a single table.
 */
public class TabulationService {
    private static final Logger logger = LoggerFactory.getLogger(TabulationService.class);

    private final PathOptions pathOptions;
    private final RenderOptions renderOptions;
    private final ExtractOptions extractOptions;

    public static class TabulationServiceBuilder {
        private TabulationSettings settings;
        private String markTerminal;
        private Boolean onlyTerminalParent;
        private Integer depth;
        private Boolean dig;
        private String delimiter;

        public TabulationServiceBuilder withSettings(TabulationSettings settings) {
            this.settings = settings;
            return this;
        }

        public TabulationServiceBuilder withMarkTerminal(String marker) {
            this.markTerminal = marker;
            return this;
        }

        public TabulationServiceBuilder withOnlyTerminalParent(boolean enabled) {
            this.onlyTerminalParent = enabled;
            return this;
        }

        public TabulationServiceBuilder withDepth(Integer depth) {
            this.depth = depth;
            return this;
        }

        public TabulationServiceBuilder withDig(boolean dig) {
            this.dig = dig;
            return this;
        }

        public TabulationServiceBuilder withDelimiter(String delimiter) {
            this.delimiter = delimiter;
            return this;
        }

        public TabulationService build() {
            if (settings == null) {
                settings = TabulationSettings.loadDefault();
            }
            return new TabulationService(this);
        }
    }

    private TabulationService(TabulationServiceBuilder builder) {
        PathOptions paths = builder.settings.pathOptions();
        if (builder.markTerminal != null) {
            paths = paths.withMarkTerminal(builder.markTerminal);
        }
        if (builder.onlyTerminalParent != null) {
            paths = paths.withOnlyTerminalParent(builder.onlyTerminalParent);
        }
        this.pathOptions = paths;

        RenderOptions render = builder.settings.renderOptions();
        this.renderOptions = builder.depth != null ? render.withDepth(builder.depth) : render;

        ExtractOptions extract = builder.settings.extractOptions();
        if (builder.dig != null) {
            extract = extract.withDig(builder.dig);
        }
        if (builder.delimiter != null) {
            extract = new ExtractOptions(extract.dig(), builder.delimiter);
        }
        this.extractOptions = extract;
    }

    public static ElementNode load(Path path) throws TreeLoadException {
        return XmlTreeLoader.fromFile(path);
    }

    public static ElementNode parse(String xml) throws TreeLoadException {
        return XmlTreeLoader.fromString(xml);
    }

    /** Addresses in the source, text form, using the configured path options. */
    public List<String> paths(Object source) {
        return PathEnumerator.addresses(source, pathOptions);
    }

    public List<String> tree(Object source) {
        return TreeRenderer.render(source, renderOptions);
    }

    public Table extract(String address, Object source) {
        return TabularExtractor.extract(address, source, extractOptions);
    }

    /** {@link #tabulate(List, Object, boolean)} with the configured dig setting. */
    public Table tabulate(List<String> addresses, Object source) {
        return tabulate(addresses, source, extractOptions.dig());
    }

    /**
     * Extracts every address from {@code source}, places the per-address tables side by side in
     * request order, and turns empty strings into nulls.
     *
     * <p>Addresses are parsed before any extraction, so a malformed one fails the call without
     * doing any work. Each address must match the same number of instances, except addresses
     * matching nothing, which contribute no columns.
     *
     * @throws net.boyechko.xml.tabulate.errors.RowCountMismatchException if instance counts differ
     */
    public Table tabulate(List<String> addresses, Object source, boolean dig) {
        List<Address> parsed = new ArrayList<>(addresses.size());
        for (String address : addresses) {
            parsed.add(Address.parse(address));
        }
        TreeInput input = TreeInput.from(source);
        ExtractOptions options = extractOptions.withDig(dig);

        List<Table> tables = new ArrayList<>(parsed.size());
        for (Address address : parsed) {
            Table table = TabularExtractor.extract(address, input, options);
            logger.info(
                    "Extracted {} row(s) x {} column(s) from {}",
                    table.rowCount(),
                    table.columns().size(),
                    address);
            tables.add(table);
        }
        return TableBinder.normalizeBlanks(TableBinder.bindColumns(tables));
    }

    public PathOptions pathOptions() {
        return pathOptions;
    }

    public RenderOptions renderOptions() {
        return renderOptions;
    }

    public ExtractOptions extractOptions() {
        return extractOptions;
    }
}
