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

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import net.boyechko.xml.tabulate.TreeTestBase;
import net.boyechko.xml.tabulate.core.VerbosityLevel;
import net.boyechko.xml.tabulate.ui.cli.XmlTabulateCLI.CLIConfig;
import net.boyechko.xml.tabulate.ui.cli.XmlTabulateCLI.CLIException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class XmlTabulateCLITest extends TreeTestBase {

    private Path input;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @BeforeEach
    void writeInput() {
        input = writeTempFile("listings.xml", readResource("listings.xml"));
    }

    @Test
    void treeIsDefaultAction() throws Exception {
        CLIConfig config = XmlTabulateCLI.parseArguments(new String[] {input.toString()});

        assertTrue(config.printTree());
        assertFalse(config.printPaths());
        assertTrue(config.addresses().isEmpty());
        assertEquals(VerbosityLevel.NORMAL, config.verbosity());
    }

    @Test
    void parsesTabulationOptions() throws Exception {
        CLIConfig config =
                XmlTabulateCLI.parseArguments(
                        new String[] {
                            "-x", "/root/listing",
                            "--address=/root/listing/seller_info",
                            "--dig", "--csv", "--delimiter=;", "-v",
                            input.toString()
                        });

        assertFalse(config.printTree());
        assertEquals(List.of("/root/listing", "/root/listing/seller_info"), config.addresses());
        assertTrue(config.dig());
        assertTrue(config.csv());
        assertEquals(";", config.delimiter());
        assertEquals(VerbosityLevel.VERBOSE, config.verbosity());
    }

    @Test
    void terminalParentImpliesPaths() throws Exception {
        CLIConfig config =
                XmlTabulateCLI.parseArguments(
                        new String[] {"--terminal-parent", "--mark=*", input.toString()});
        assertTrue(config.printPaths());
        assertTrue(config.onlyTerminalParent());
        assertEquals("*", config.markTerminal());
    }

    @ParameterizedTest
    @ValueSource(strings = {"--bogus", "--depth=-1", "--depth=two"})
    void rejectsBadOptions(String option) {
        assertThrows(
                CLIException.class,
                () -> XmlTabulateCLI.parseArguments(new String[] {option, input.toString()}));
    }

    @Test
    void rejectsMissingAndExtraInputs() {
        CLIException missing =
                assertThrows(
                        CLIException.class,
                        () ->
                                XmlTabulateCLI.parseArguments(
                                        new String[] {tempDir.resolve("nope.xml").toString()}));
        assertTrue(missing.getMessage().startsWith("File not found"));

        CLIException extra =
                assertThrows(
                        CLIException.class,
                        () ->
                                XmlTabulateCLI.parseArguments(
                                        new String[] {input.toString(), input.toString()}));
        assertEquals("Multiple input files specified", extra.getMessage());
    }

    @Test
    void printsTree() throws Exception {
        CLIConfig config = XmlTabulateCLI.parseArguments(new String[] {input.toString()});

        assertEquals(0, XmlTabulateCLI.run(config, new PrintStream(out), new PrintStream(err)));
        assertEquals(readResource("listings.tree.txt").lines().toList(), lines(out));
    }

    @Test
    void printsCsvTable() throws Exception {
        CLIConfig config =
                XmlTabulateCLI.parseArguments(
                        new String[] {
                            "-x", "/root/listing", "-x", "/root/listing/seller_info", "--csv",
                            input.toString()
                        });

        assertEquals(0, XmlTabulateCLI.run(config, new PrintStream(out), new PrintStream(err)));
        assertEquals(
                List.of(
                        "payment_types,shipping_info,name,rating",
                        "paypal,free,Ann's Antiques,4.8",
                        "cod,,Bob,3.9"),
                lines(out));
    }

    @Test
    void reportsUnreadableXml() throws Exception {
        Path broken = writeTempFile("broken.xml", "<root><unclosed></root>");
        CLIConfig config = XmlTabulateCLI.parseArguments(new String[] {broken.toString()});

        assertEquals(1, XmlTabulateCLI.run(config, new PrintStream(out), new PrintStream(err)));
        assertTrue(err.toString().contains("Failed to read XML"));
    }

    @Test
    void reportsRowCountMismatch() throws Exception {
        Path uneven =
                writeTempFile(
                        "uneven.xml", "<root><a><x>1</x></a><a><x>2</x></a><b><y>3</y></b></root>");
        CLIConfig config =
                XmlTabulateCLI.parseArguments(
                        new String[] {"-x", "/root/a", "-x", "/root/b", uneven.toString()});

        assertEquals(1, XmlTabulateCLI.run(config, new PrintStream(out), new PrintStream(err)));
        assertTrue(err.toString().startsWith("✗ "));
    }

    @Test
    void settingsFileSuppliesDefaults() throws Exception {
        Path settings =
                writeTempFile(
                        "settings.yaml",
                        "paths:\n  mark_terminal: \" <<\"\nextract:\n  dig: true\n");
        CLIConfig config =
                XmlTabulateCLI.parseArguments(
                        new String[] {
                            "-p", "-x", "/root/listing", "--csv",
                            "--config=" + settings, input.toString()
                        });

        assertEquals(0, XmlTabulateCLI.run(config, new PrintStream(out), new PrintStream(err)));
        List<String> printed = lines(out);
        assertTrue(printed.contains("/root/listing/payment_types <<"));
        assertTrue(
                printed.contains("payment_types,shipping_info,name,rating"),
                "dig from the settings file is not reset by the absent --dig flag");
    }

    @Test
    void unreadableSettingsAreReported() throws Exception {
        Path settings = writeTempFile("broken.yaml", "render:\n  depth: [1, 2]\n");
        CLIConfig config =
                XmlTabulateCLI.parseArguments(
                        new String[] {"--config=" + settings, input.toString()});

        assertEquals(1, XmlTabulateCLI.run(config, new PrintStream(out), new PrintStream(err)));
        assertTrue(err.toString().startsWith("✗ Failed to load settings from file"));
        assertTrue(out.toString().isEmpty());
    }

    @Test
    void missingSettingsFileIsAnArgumentError() {
        CLIException e =
                assertThrows(
                        CLIException.class,
                        () ->
                                XmlTabulateCLI.parseArguments(
                                        new String[] {
                                            "--config=" + tempDir.resolve("none.yaml"),
                                            input.toString()
                                        }));
        assertTrue(e.getMessage().startsWith("Settings file not found"));
    }

    private static List<String> lines(ByteArrayOutputStream buffer) {
        return buffer.toString().replace("\r\n", "\n").lines().toList();
    }
}
