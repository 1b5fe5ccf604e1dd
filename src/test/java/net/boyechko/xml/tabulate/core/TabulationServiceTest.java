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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.xml.tabulate.TreeTestBase;
import net.boyechko.xml.tabulate.document.ElementNode;
import net.boyechko.xml.tabulate.errors.InvalidAddressException;
import net.boyechko.xml.tabulate.errors.RowCountMismatchException;
import net.boyechko.xml.tabulate.table.Table;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TabulationServiceTest extends TreeTestBase {

    private ElementNode listings;

    @BeforeEach
    void loadListings() throws Exception {
        listings = TabulationService.load(resourcePath("listings.xml"));
    }

    private static TabulationService defaultService() {
        return new TabulationService.TabulationServiceBuilder().build();
    }

    @Test
    void tabulatesAcrossAddressGroups() {
        Table table =
                defaultService()
                        .tabulate(
                                List.of("/root/listing", "/root/listing/seller_info"), listings);

        assertEquals(2, table.rowCount());
        assertEquals(List.of("payment_types", "shipping_info", "name", "rating"), table.columns());
        assertEquals("Ann's Antiques", table.get(0, "name"));
        assertEquals("cod", table.get(1, "payment_types"));
    }

    @Test
    void emptyCellsBecomeNullAfterBinding() {
        Table table = defaultService().tabulate(List.of("/root/listing"), listings);
        assertNull(table.get(1, "shipping_info"), "Empty <shipping_info/> is normalized");
        assertEquals("free", table.get(0, "shipping_info"));
    }

    @Test
    void digOverridesConfiguredDefault() {
        TabulationService service = defaultService();
        Table shallow = service.tabulate(List.of("/root/listing"), listings, false);
        Table deep = service.tabulate(List.of("/root/listing"), listings, true);

        assertFalse(shallow.hasColumn("name"));
        assertTrue(deep.hasColumn("name"));
        assertEquals("4.8", deep.get(0, "rating"));
    }

    @Test
    void mismatchedInstanceCountsFail() throws Exception {
        ElementNode root =
                TabulationService.parse(
                        "<root><a><x>1</x></a><a><x>2</x></a><b><y>3</y></b></root>");
        assertThrows(
                RowCountMismatchException.class,
                () -> defaultService().tabulate(List.of("/root/a", "/root/b"), root));
    }

    @Test
    void unmatchedAddressCountsAsZeroRows() {
        RowCountMismatchException e =
                assertThrows(
                        RowCountMismatchException.class,
                        () ->
                                defaultService()
                                        .tabulate(
                                                List.of("/root/listing", "/root/missing"),
                                                listings));
        assertEquals(List.of(2, 0), e.getRowCounts());

        assertTrue(defaultService().tabulate(List.of("/root/missing"), listings).isEmpty());
    }

    @Test
    void malformedAddressFailsBeforeExtraction() {
        assertThrows(
                InvalidAddressException.class,
                () -> defaultService().tabulate(List.of("/root/listing", "root"), listings));
    }

    @Test
    void builderOverridesReachEveryOperation() {
        TabulationService service =
                new TabulationService.TabulationServiceBuilder()
                        .withMarkTerminal("*")
                        .withOnlyTerminalParent(true)
                        .withDepth(1)
                        .withDig(true)
                        .withDelimiter("|")
                        .build();

        assertEquals(List.of("/root/listing", "/root/listing/seller_info"), service.paths(listings));
        assertEquals(List.of("root", "|-- listing", "`-- listing"), service.tree(listings));
        assertTrue(service.extractOptions().dig());
        assertEquals("|", service.extractOptions().delimiter());
        assertEquals("Bob", service.extract("/root/listing", listings).get(1, "name"));
    }

    @Test
    void pathsUseMarkerFromSettings() {
        TabulationService service =
                new TabulationService.TabulationServiceBuilder()
                        .withSettings(TabulationSettings.fromResource("/settings-custom.yaml"))
                        .build();
        assertTrue(service.paths(listings).contains("/root/listing/payment_types <<"));
        assertEquals(1, service.renderOptions().depth());
    }
}
