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
package net.boyechko.xml.tabulate.ui.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.xml.tabulate.core.TabulationService;
import net.boyechko.xml.tabulate.core.TabulationSettings;
import net.boyechko.xml.tabulate.core.VerbosityLevel;
import net.boyechko.xml.tabulate.document.ElementNode;
import net.boyechko.xml.tabulate.document.TreeLoadException;
import net.boyechko.xml.tabulate.errors.TabulationException;
import net.boyechko.xml.tabulate.table.Table;
import net.boyechko.xml.tabulate.ui.TableFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class XmlTabulateCLI {
    private static Logger logger;

    // Configuration record to hold parsed CLI arguments
    public record CLIConfig(
            Path inputPath,
            boolean printPaths,
            boolean onlyTerminalParent,
            String markTerminal,
            boolean printTree,
            Integer depth,
            List<String> addresses,
            boolean dig,
            String delimiter,
            boolean csv,
            Path settingsPath,
            VerbosityLevel verbosity) {
        public CLIConfig {
            if (inputPath == null) {
                throw new IllegalArgumentException("Input path is required");
            }
            if (verbosity == null) {
                throw new IllegalArgumentException("Verbosity level is required");
            }
            addresses = List.copyOf(addresses);
        }
    }

    // Custom exception for CLI errors
    public static class CLIException extends Exception {
        public CLIException(String message) {
            super(message);
        }
    }

    /** Mutable builder that accumulates parsed CLI arguments. */
    static class CLIConfigBuilder {
        Path inputPath;
        boolean printPaths;
        boolean onlyTerminalParent;
        String markTerminal;
        boolean printTree;
        Integer depth;
        List<String> addresses = new ArrayList<>();
        boolean dig;
        String delimiter;
        boolean csv;
        Path settingsPath;
        VerbosityLevel verbosity = VerbosityLevel.NORMAL;

        CLIConfig build() throws CLIException {
            if (inputPath == null) {
                throw new CLIException("No input file specified");
            }
            if (!Files.exists(inputPath)) {
                throw new CLIException("File not found: " + inputPath);
            }
            if (settingsPath != null && !Files.exists(settingsPath)) {
                throw new CLIException("Settings file not found: " + settingsPath);
            }
            // With nothing requested, show the structure
            if (!printPaths && addresses.isEmpty()) {
                printTree = true;
            }
            return new CLIConfig(
                    inputPath,
                    printPaths,
                    onlyTerminalParent,
                    markTerminal,
                    printTree,
                    depth,
                    addresses,
                    dig,
                    delimiter,
                    csv,
                    settingsPath,
                    verbosity);
        }
    }

    public static void main(String[] args) {
        try {
            if (isHelpRequested(args)) {
                System.out.println(usageMessage());
                return;
            }
            CLIConfig config = parseArguments(args);
            configureLogging(config.verbosity());
            logger().info(
                            "Starting processing of {} with verbosity level {}",
                            config.inputPath(),
                            config.verbosity());
            int status = run(config, System.out, System.err);
            if (status != 0) {
                System.exit(status);
            }
        } catch (CLIException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    static CLIConfig parseArguments(String[] args) throws CLIException {
        if (args.length == 0) {
            throw new CLIException("No input file specified\n" + usageMessage());
        }

        CLIConfigBuilder b = new CLIConfigBuilder();

        for (int i = 0; i < args.length; i++) {
            if (args[i].startsWith("--mark=")) {
                b.markTerminal = args[i].substring("--mark=".length());
            } else if (args[i].startsWith("--depth=")) {
                b.depth = parseDepth(args[i].substring("--depth=".length()));
            } else if (args[i].startsWith("--address=")) {
                b.addresses.add(args[i].substring("--address=".length()));
            } else if (args[i].startsWith("--delimiter=")) {
                b.delimiter = args[i].substring("--delimiter=".length());
            } else if (args[i].startsWith("--config=")) {
                b.settingsPath = Paths.get(args[i].substring("--config=".length()));
            } else {
                switch (args[i]) {
                    case "-x", "--address" -> {
                        if (i + 1 < args.length) {
                            b.addresses.add(args[++i]);
                        } else {
                            throw new CLIException("Address not specified after " + args[i]);
                        }
                    }
                    case "-d", "--depth" -> {
                        if (i + 1 < args.length) {
                            b.depth = parseDepth(args[++i]);
                        } else {
                            throw new CLIException("Depth not specified after " + args[i]);
                        }
                    }
                    case "-q", "--quiet" -> b.verbosity = VerbosityLevel.QUIET;
                    case "-v", "--verbose" -> b.verbosity = VerbosityLevel.VERBOSE;
                    case "-vv", "--debug" -> b.verbosity = VerbosityLevel.DEBUG;
                    case "-p", "--paths" -> b.printPaths = true;
                    case "--terminal-parent" -> {
                        b.printPaths = true;
                        b.onlyTerminalParent = true;
                    }
                    case "-t", "--tree" -> b.printTree = true;
                    case "--dig" -> b.dig = true;
                    case "--csv" -> b.csv = true;
                    default -> {
                        if (args[i].startsWith("-")) {
                            throw new CLIException("Unknown option: " + args[i]);
                        } else if (b.inputPath == null) {
                            b.inputPath = Paths.get(args[i]);
                        } else {
                            throw new CLIException("Multiple input files specified");
                        }
                    }
                }
            }
        }

        return b.build();
    }

    private static Integer parseDepth(String value) throws CLIException {
        try {
            int depth = Integer.parseInt(value.trim());
            if (depth < 0) {
                throw new CLIException("Depth must not be negative: " + value);
            }
            return depth;
        } catch (NumberFormatException e) {
            throw new CLIException("Depth is not a number: " + value);
        }
    }

    static void configureLogging(VerbosityLevel verbosity) {
        Level level =
                switch (verbosity) {
                    case QUIET -> Level.ERROR;
                    case NORMAL -> Level.WARN;
                    case VERBOSE -> Level.INFO;
                    case DEBUG -> Level.DEBUG;
                };
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ctx.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
    }

    private static Logger logger() {
        if (logger == null) {
            logger = LoggerFactory.getLogger(XmlTabulateCLI.class);
        }
        return logger;
    }

    /** Runs the requested actions and returns the process exit status. */
    static int run(CLIConfig config, PrintStream out, PrintStream err) {
        TabulationService service;
        try {
            service = buildService(config);
        } catch (IllegalStateException e) {
            err.println("✗ " + e.getMessage());
            return 1;
        }
        TableFormatter formatter = new TableFormatter(out);

        try {
            ElementNode root = TabulationService.load(config.inputPath());

            if (config.printTree()) {
                logger().info("Rendering tree");
                formatter.printLines(service.tree(root));
            }
            if (config.printPaths()) {
                logger().info("Enumerating paths");
                formatter.printLines(service.paths(root));
            }
            if (!config.addresses().isEmpty()) {
                logger().info("Tabulating {} address(es)", config.addresses().size());
                Table table = service.tabulate(config.addresses(), root);
                if (config.csv()) {
                    formatter.printCsv(table);
                } else {
                    formatter.printAligned(table);
                }
            }
            return 0;
        } catch (TreeLoadException e) {
            err.println("✗ Failed to read XML: " + e.getMessage());
            return 1;
        } catch (TabulationException e) {
            err.println("✗ " + e.getMessage());
            return 1;
        } finally {
            out.flush();
        }
    }

    // Flags only override the settings when given
    private static TabulationService buildService(CLIConfig config) {
        TabulationSettings settings =
                config.settingsPath() != null
                        ? TabulationSettings.fromFile(config.settingsPath())
                        : TabulationSettings.loadDefault();
        TabulationService.TabulationServiceBuilder builder =
                new TabulationService.TabulationServiceBuilder()
                        .withSettings(settings)
                        .withMarkTerminal(config.markTerminal())
                        .withDepth(config.depth())
                        .withDelimiter(config.delimiter());
        if (config.onlyTerminalParent()) {
            builder.withOnlyTerminalParent(true);
        }
        if (config.dig()) {
            builder.withDig(true);
        }
        return builder.build();
    }

    private static boolean isHelpRequested(String[] args) {
        for (String arg : args) {
            if ("-h".equals(arg) || "--help".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    private static String usageMessage() {
        return "Usage: java XmlTabulateCLI [-q|-v|-vv] [-t [-d N]] [-p [--mark=S] [--terminal-parent]] [-x address ...] [--dig] [--csv] [--config=FILE] <inputpath>\n"
                + "  -h, --help            Show this help message\n"
                + "  -q, --quiet           Only show errors\n"
                + "  -v, --verbose         Show processing steps\n"
                + "  -vv, --debug          Show all debug information\n"
                + "  -t, --tree            Print the element tree (default when nothing else is asked)\n"
                + "  -d, --depth N         Expand the tree at most N levels below the root\n"
                + "  -p, --paths           Print every address in the document\n"
                + "  --terminal-parent     Print only the parents of terminal elements\n"
                + "  --mark=S              Suffix terminal addresses with S\n"
                + "  -x, --address ADDR    Tabulate the elements at ADDR (repeatable)\n"
                + "  --dig                 Include nested terminal elements, merging repeated tags\n"
                + "  --delimiter=S         Separator for merged values (default ',')\n"
                + "  --csv                 Print the table as CSV\n"
                + "  --config=FILE         Read default options from a YAML settings file\n"
                + "Examples:\n"
                + "  java XmlTabulateCLI -t -d 2 listings.xml\n"
                + "  java XmlTabulateCLI --terminal-parent listings.xml\n"
                + "  java XmlTabulateCLI -x /root/listing -x /root/listing/seller_info --csv listings.xml";
    }
}
