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
package org.neo4j.codematching;

import static java.lang.String.format;

import org.neo4j.codematching.model.Node;

/**
 * Thrown when a variable node of a pattern reaches the suffix aware {@link NodeCompatibility} without a suffix
 * hint. Whoever built the pattern was supposed to compute one, so the pattern is broken.
 */
public class MissingCompatibilityHintException extends IllegalStateException {
    private final long patternNodeId;

    public MissingCompatibilityHintException(Node patternNode) {
        super(format(
                "Variable pattern node %s has no suffix hint, variable nodes of a pattern must be built with one",
                patternNode));
        this.patternNodeId = patternNode.id();
    }

    public long patternNodeId() {
        return patternNodeId;
    }
}
