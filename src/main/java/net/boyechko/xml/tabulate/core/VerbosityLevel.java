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

/**
 * Defines the verbosity levels for output control.
 *
 * <p>Levels (from least to most verbose):
 *
 * <ul>
 *   <li>QUIET - Only errors
 *   <li>NORMAL - Warnings and results (default)
 *   <li>VERBOSE - Processing steps
 *   <li>DEBUG - All information including traversal details
 * </ul>
 */
public enum VerbosityLevel {
    QUIET,
    NORMAL,
    VERBOSE,
    DEBUG
}
