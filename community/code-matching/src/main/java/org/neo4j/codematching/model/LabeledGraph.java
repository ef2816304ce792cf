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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.eclipse.collections.api.factory.primitive.LongSets;
import org.eclipse.collections.api.map.primitive.MutableLongObjectMap;
import org.eclipse.collections.api.map.primitive.MutableObjectIntMap;
import org.eclipse.collections.api.map.primitive.ObjectIntMap;
import org.eclipse.collections.api.set.primitive.LongSet;
import org.eclipse.collections.api.set.primitive.MutableLongSet;
import org.eclipse.collections.impl.map.mutable.primitive.LongObjectHashMap;
import org.eclipse.collections.impl.map.mutable.primitive.ObjectIntHashMap;
import org.eclipse.collections.impl.set.mutable.primitive.LongHashSet;

/**
 * A directed multigraph of labeled {@link Node nodes}, e.g. the flow graph of a method or a mined change pattern.
 * Instances are immutable once {@link Builder#build() built}. Every edge endpoint is guaranteed to reference a node
 * of the graph, and parallel edges are kept and counted individually.
 */
public final class LabeledGraph {
    private static final ObjectIntMap<String> NO_EDGES = new ObjectIntHashMap<String>().toImmutable();

    private final MutableLongObjectMap<Node> nodes;
    private final long[] nodeIds;
    private final List<Edge> edges;
    private final MutableLongObjectMap<MutableLongObjectMap<MutableObjectIntMap<String>>> outgoing =
            new LongObjectHashMap<>();
    private final MutableLongObjectMap<MutableLongSet> neighbours = new LongObjectHashMap<>();

    private LabeledGraph(MutableLongObjectMap<Node> nodes, List<Edge> edges) {
        this.nodes = nodes;
        this.nodeIds = nodes.keySet().toSortedArray();
        this.edges = Collections.unmodifiableList(edges);
        for (Edge edge : edges) {
            outgoing.getIfAbsentPut(edge.source(), LongObjectHashMap::new)
                    .getIfAbsentPut(edge.target(), ObjectIntHashMap::new)
                    .addToValue(edge.kind(), 1);
            neighbours.getIfAbsentPut(edge.source(), LongHashSet::new).add(edge.target());
            neighbours.getIfAbsentPut(edge.target(), LongHashSet::new).add(edge.source());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public int nodeCount() {
        return nodeIds.length;
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean containsNode(long id) {
        return nodes.containsKey(id);
    }

    /**
     * @param id the node id.
     * @return the node with the given id.
     * @throws MalformedStructureException if there's no such node in this graph.
     */
    public Node node(long id) {
        Node node = nodes.get(id);
        if (node == null) {
            throw new MalformedStructureException("Node %d is not part of this graph", id);
        }
        return node;
    }

    /**
     * @return ids of all nodes, in ascending order.
     */
    public long[] nodeIds() {
        return nodeIds.clone();
    }

    /**
     * @return all nodes, in ascending id order.
     */
    public List<Node> nodes() {
        List<Node> result = new ArrayList<>(nodeIds.length);
        for (long id : nodeIds) {
            result.add(nodes.get(id));
        }
        return result;
    }

    public List<Edge> edges() {
        return edges;
    }

    /**
     * @param source id of the source node.
     * @param target id of the target node.
     * @return how many {@code source -> target} edges there are of each kind, empty if there are none.
     */
    public ObjectIntMap<String> edgeKinds(long source, long target) {
        MutableLongObjectMap<MutableObjectIntMap<String>> fromSource = outgoing.get(source);
        if (fromSource == null) {
            return NO_EDGES;
        }
        MutableObjectIntMap<String> kinds = fromSource.get(target);
        return kinds == null ? NO_EDGES : kinds;
    }

    public int edgeCount(long source, long target, String kind) {
        return edgeKinds(source, target).getIfAbsent(kind, 0);
    }

    /**
     * @param id the node id.
     * @return ids of nodes connected to the given node by an edge in either direction. A node with a self-loop is
     * its own neighbour.
     */
    public LongSet neighbours(long id) {
        MutableLongSet result = neighbours.get(id);
        return result == null ? LongSets.immutable.empty() : result;
    }

    /**
     * Node-induced subgraph of the nodes tagged with the given phase: those nodes and the edges running between them.
     *
     * @param phase the phase to keep.
     * @return a new graph, which may be empty.
     */
    public LabeledGraph restrictTo(Phase phase) {
        requireNonNull(phase);
        Builder builder = builder();
        for (long id : nodeIds) {
            Node node = nodes.get(id);
            if (node.phase() == phase) {
                builder.addNode(node);
            }
        }
        for (Edge edge : edges) {
            if (nodes.get(edge.source()).phase() == phase
                    && nodes.get(edge.target()).phase() == phase) {
                builder.addEdge(edge);
            }
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return "LabeledGraph{nodes=" + nodeIds.length + ", edges=" + edges.size() + "}";
    }

    public static final class Builder {
        private final MutableLongObjectMap<Node> nodes = new LongObjectHashMap<>();
        private final List<Edge> edges = new ArrayList<>();

        private Builder() {}

        /**
         * @param node the node to add.
         * @return this builder.
         * @throws MalformedStructureException if a node with the same id was added before.
         */
        public Builder addNode(Node node) {
            requireNonNull(node);
            if (nodes.containsKey(node.id())) {
                throw new MalformedStructureException("Duplicate node id %d", node.id());
            }
            nodes.put(node.id(), node);
            return this;
        }

        public Builder addNodes(Node... nodes) {
            for (Node node : nodes) {
                addNode(node);
            }
            return this;
        }

        /**
         * Adds an edge. Endpoints are validated by {@link #build()}, so edges may be added before their nodes.
         */
        public Builder addEdge(long source, long target, String kind) {
            return addEdge(new Edge(source, target, requireNonNull(kind, "edge kind")));
        }

        public Builder addEdge(Edge edge) {
            edges.add(requireNonNull(edge));
            return this;
        }

        /**
         * @return the graph.
         * @throws MalformedStructureException if an edge references a node that was never added.
         */
        public LabeledGraph build() {
            for (Edge edge : edges) {
                if (!nodes.containsKey(edge.source()) || !nodes.containsKey(edge.target())) {
                    throw new MalformedStructureException("Edge %s has a dangling endpoint", edge);
                }
            }
            MutableLongObjectMap<Node> copy = new LongObjectHashMap<>();
            copy.putAll(nodes);
            return new LabeledGraph(copy, new ArrayList<>(edges));
        }
    }
}
