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

import static java.util.Objects.requireNonNull;

import java.util.List;

/**
 * A change pattern in tree form: the syntax tree fragments of one logical pattern, as mined from different
 * examples. The fragments usually differ slightly in shape.
 */
public final class TreePattern {
    private final String key;
    private final List<LabeledTree> fragments;

    /**
     * @param key identifies the pattern in results.
     * @param fragments the candidate fragments, in the order they were mined.
     * @throws MalformedStructureException if there are no fragments.
     */
    public TreePattern(String key, List<LabeledTree> fragments) {
        this.key = requireNonNull(key);
        requireNonNull(fragments);
        if (fragments.isEmpty()) {
            throw new MalformedStructureException("Pattern '%s' has no fragments", key);
        }
        this.fragments = List.copyOf(fragments);
    }

    public String key() {
        return key;
    }

    public List<LabeledTree> fragments() {
        return fragments;
    }

    @Override
    public String toString() {
        return "TreePattern{" + key + ", fragments=" + fragments.size() + "}";
    }
}
