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
package net.boyechko.xml.tabulate.paths;

/**
 * Options for {@link PathEnumerator}.
 *
 * @param markTerminal suffix appended to the text form of terminal addresses, or null for none
 * @param onlyTerminalParent emit the deduplicated parents of terminal nodes instead of every node
 */
public record PathOptions(String markTerminal, boolean onlyTerminalParent) {

    public static PathOptions defaults() {
        return new PathOptions(null, false);
    }

    public PathOptions withMarkTerminal(String marker) {
        return new PathOptions(marker, onlyTerminalParent);
    }

    public PathOptions withOnlyTerminalParent(boolean enabled) {
        return new PathOptions(markTerminal, enabled);
    }
}
