/*
 * Copyright (c) "Neo4j"
 * Neo4j Sweden AB [https://neo4j.com]
 *
 * This file is part of Neo4j.
 *
 * Neo4j is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package org.neo4j.codematching.model;

import static java.lang.String.format;

/**
 * Thrown when a graph, tree, pattern or mapping handed over by a builder breaks the structural rules of its type,
 * e.g. an edge pointing to a node that doesn't exist. This is a bug in whoever built the structure, never a
 * "no match" outcome.
 */
public class MalformedStructureException extends IllegalArgumentException {
    public MalformedStructureException(String message) {
        super(message);
    }

    public MalformedStructureException(String messageFormat, Object... arguments) {
        super(format(messageFormat, arguments));
    }
}
