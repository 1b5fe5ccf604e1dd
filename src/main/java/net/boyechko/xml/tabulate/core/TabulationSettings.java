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

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.xml.tabulate.paths.PathOptions;
import net.boyechko.xml.tabulate.render.RenderOptions;
import net.boyechko.xml.tabulate.table.ExtractOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/** Default option values, loaded from YAML. Field names follow the YAML keys. */
public final class TabulationSettings {
    private static final String DEFAULT_SETTINGS_RESOURCE = "/xml-tabulate.yaml";
    private static final Logger logger = LoggerFactory.getLogger(TabulationSettings.class);

    public Paths paths = new Paths();
    public Render render = new Render();
    public Extract extract = new Extract();

    public static final class Paths {
        /** Suffix for terminal addresses; null leaves them unmarked. */
        public String mark_terminal;

        public boolean only_terminal_parent;
    }

    public static final class Render {
        /** Null means unlimited. */
        public Integer depth;

        public int max_text_length = RenderOptions.DEFAULT_MAX_TEXT_LENGTH;
        public String separator = "";
    }

    public static final class Extract {
        public boolean dig;
        public String delimiter = ExtractOptions.DEFAULT_DELIMITER;
    }

    /**
     * Load settings from a classpath resource (e.g., from src/main/resources/)
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static TabulationSettings fromResource(String resourcePath) {
        String source = "resource " + resourcePath;
        try (var inputStream = TabulationSettings.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }
            return load(inputStream, source);
        } catch (Exception e) {
            throw loadFailure(source, e);
        }
    }

    /** Load settings from a YAML file on disk, such as one named with {@code --config}. */
    public static TabulationSettings fromFile(Path path) {
        String source = "file " + path;
        try (InputStream inputStream = Files.newInputStream(path)) {
            return load(inputStream, source);
        } catch (Exception e) {
            throw loadFailure(source, e);
        }
    }

    private static TabulationSettings load(InputStream inputStream, String source) {
        var yaml = new Yaml(new Constructor(TabulationSettings.class, new LoaderOptions()));
        TabulationSettings settings = yaml.load(inputStream);
        if (settings == null) {
            settings = new TabulationSettings();
        }
        settings.fillMissingSections();

        var warnings = settings.validate();
        if (!warnings.isEmpty()) {
            logger.warn("Settings loaded from {} have {} warning(s):", source, warnings.size());
            for (String warning : warnings) {
                logger.warn("  - {}", warning);
            }
        }
        logger.debug("Loaded settings from {}", source);
        return settings;
    }

    private static IllegalStateException loadFailure(String source, Exception e) {
        logger.error("Failed to load settings from {}: {}", source, e.getMessage());
        return new IllegalStateException(
                "Failed to load settings from " + source + ": " + e.getMessage(), e);
    }

    /** Load default settings from standard location */
    public static TabulationSettings loadDefault() {
        return fromResource(DEFAULT_SETTINGS_RESOURCE);
    }

    public PathOptions pathOptions() {
        return new PathOptions(paths.mark_terminal, paths.only_terminal_parent);
    }

    public RenderOptions renderOptions() {
        return new RenderOptions(render.depth, render.max_text_length, render.separator);
    }

    public ExtractOptions extractOptions() {
        return new ExtractOptions(extract.dig, extract.delimiter);
    }

    private void fillMissingSections() {
        if (paths == null) paths = new Paths();
        if (render == null) render = new Render();
        if (extract == null) extract = new Extract();
    }

    /**
     * Checks the settings for values the option records would reject or that make output
     * ambiguous, returning one message per problem. Invalid values are reset to their defaults.
     */
    public List<String> validate() {
        List<String> warnings = new ArrayList<>();

        if (render.depth != null && render.depth < 0) {
            warnings.add("render.depth=" + render.depth + " is negative; using unlimited depth");
            render.depth = null;
        }
        if (render.max_text_length < 4) {
            warnings.add(
                    "render.max_text_length="
                            + render.max_text_length
                            + " is too short; using "
                            + RenderOptions.DEFAULT_MAX_TEXT_LENGTH);
            render.max_text_length = RenderOptions.DEFAULT_MAX_TEXT_LENGTH;
        }
        if (extract.delimiter == null || extract.delimiter.isEmpty()) {
            warnings.add(
                    "extract.delimiter is empty; merged values would run together, using '"
                            + ExtractOptions.DEFAULT_DELIMITER
                            + "'");
            extract.delimiter = ExtractOptions.DEFAULT_DELIMITER;
        }
        if (paths.mark_terminal != null && paths.mark_terminal.contains("/")) {
            warnings.add(
                    "paths.mark_terminal '"
                            + paths.mark_terminal
                            + "' contains '/' and will be mistaken for an extra segment");
        }

        return warnings;
    }
}
