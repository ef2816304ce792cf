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

/**
 * A change pattern in graph form. Every node is tagged with the {@link Phase} it belongs to, and only the
 * {@link Phase#BEFORE} half, the {@link #query() query}, is searched for in a target graph.
 */
public final class GraphPattern {
    private final String key;
    private final LabeledGraph graph;
    private final LabeledGraph query;

    /**
     * @param key identifies the pattern in results, e.g. the location it was loaded from.
     * @param graph the full pattern graph.
     * @throws MalformedStructureException if a node isn't tagged with a phase.
     */
    public GraphPattern(String key, LabeledGraph graph) {
        this.key = requireNonNull(key);
        this.graph = requireNonNull(graph);
        for (Node node : graph.nodes()) {
            if (node.phase() == null) {
                throw new MalformedStructureException(
                        "Node %d of pattern '%s' has no phase tag, pattern nodes must be either BEFORE or AFTER",
                        node.id(), key);
            }
        }
        this.query = graph.restrictTo(Phase.BEFORE);
    }

    public String key() {
        return key;
    }

    public LabeledGraph graph() {
        return graph;
    }

    /**
     * @return the node-induced subgraph of the {@link Phase#BEFORE} nodes.
     */
    public LabeledGraph query() {
        return query;
    }

    /**
     * @return node count of the whole pattern, both halves, which is what the pattern is ranked by.
     */
    public int size() {
        return graph.nodeCount();
    }

    @Override
    public String toString() {
        return "GraphPattern{" + key + ", size=" + size() + ", query=" + query.nodeCount() + "}";
    }
}
