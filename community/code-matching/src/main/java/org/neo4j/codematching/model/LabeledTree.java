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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.primitive.MutableLongLongMap;
import org.eclipse.collections.api.map.primitive.MutableLongObjectMap;
import org.eclipse.collections.impl.map.mutable.primitive.LongLongHashMap;
import org.eclipse.collections.impl.map.mutable.primitive.LongObjectHashMap;

/**
 * A rooted tree of labeled {@link Node nodes} with ordered children, e.g. the syntax tree of a method or one mined
 * fragment of a pattern. Sibling order is meaningful. The tree is connected and acyclic by construction, since
 * {@link Builder#addChild(long, Node)} only attaches new nodes below nodes that are already part of the tree.
 */
public final class LabeledTree {
    private final Node root;
    private final MutableLongObjectMap<Node> nodes;
    private final MutableLongObjectMap<MutableList<Node>> children;
    private final MutableLongLongMap parents;
    private final List<Node> preOrder;

    private LabeledTree(
            Node root,
            MutableLongObjectMap<Node> nodes,
            MutableLongObjectMap<MutableList<Node>> children,
            MutableLongLongMap parents) {
        this.root = root;
        this.nodes = nodes;
        this.children = children;
        this.parents = parents;
        this.preOrder = Collections.unmodifiableList(computePreOrder());
    }

    public static Builder builder(Node root) {
        return new Builder(root);
    }

    /**
     * @return a tree consisting of the given node only.
     */
    public static LabeledTree leaf(Node root) {
        return builder(root).build();
    }

    public Node root() {
        return root;
    }

    public int size() {
        return nodes.size();
    }

    public boolean containsNode(long id) {
        return nodes.containsKey(id);
    }

    public Node node(long id) {
        Node node = nodes.get(id);
        if (node == null) {
            throw new MalformedStructureException("Node %d is not part of this tree", id);
        }
        return node;
    }

    /**
     * @param id the node id.
     * @return the ordered children of the node, empty for a leaf.
     */
    public List<Node> children(long id) {
        node(id);
        MutableList<Node> result = children.get(id);
        return result == null ? List.of() : result.asUnmodifiable();
    }

    /**
     * @param id the node id.
     * @return the parent of the node, or {@code null} for the root.
     */
    public Node parent(long id) {
        node(id);
        return parents.containsKey(id) ? nodes.get(parents.get(id)) : null;
    }

    /**
     * @return all nodes, parents before their children and siblings in order.
     */
    public List<Node> preOrder() {
        return preOrder;
    }

    private List<Node> computePreOrder() {
        List<Node> result = new ArrayList<>(nodes.size());
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Node current = stack.pop();
            result.add(current);
            MutableList<Node> kids = children.get(current.id());
            if (kids != null) {
                for (int i = kids.size() - 1; i >= 0; i--) {
                    stack.push(kids.get(i));
                }
            }
        }
        return result;
    }

    @Override
    public String toString() {
        var builder = new StringBuilder();
        appendTo(builder, root);
        return builder.toString();
    }

    private void appendTo(StringBuilder builder, Node node) {
        builder.append(node.label());
        MutableList<Node> kids = children.get(node.id());
        if (kids != null && !kids.isEmpty()) {
            builder.append('(');
            for (int i = 0; i < kids.size(); i++) {
                if (i > 0) {
                    builder.append(' ');
                }
                appendTo(builder, kids.get(i));
            }
            builder.append(')');
        }
    }

    public static final class Builder {
        private final Node root;
        private final MutableLongObjectMap<Node> nodes = new LongObjectHashMap<>();
        private final MutableLongObjectMap<MutableList<Node>> children = new LongObjectHashMap<>();
        private final MutableLongLongMap parents = new LongLongHashMap();

        private Builder(Node root) {
            this.root = requireNonNull(root);
            nodes.put(root.id(), root);
        }

        /**
         * Appends a child to the end of the children list of an existing node.
         *
         * @param parentId id of a node already in the tree.
         * @param child the new node.
         * @return this builder.
         * @throws MalformedStructureException if the parent is unknown or the child id is already in use.
         */
        public Builder addChild(long parentId, Node child) {
            requireNonNull(child);
            if (!nodes.containsKey(parentId)) {
                throw new MalformedStructureException(
                        "Cannot attach node %d, parent %d is not part of the tree", child.id(), parentId);
            }
            if (nodes.containsKey(child.id())) {
                throw new MalformedStructureException(
                        "Node %d is already part of the tree, a node can only have one parent", child.id());
            }
            nodes.put(child.id(), child);
            children.getIfAbsentPut(parentId, Lists.mutable::empty).add(child);
            parents.put(child.id(), parentId);
            return this;
        }

        public Builder addChildren(long parentId, Node... children) {
            for (Node child : children) {
                addChild(parentId, child);
            }
            return this;
        }

        public LabeledTree build() {
            MutableLongObjectMap<Node> nodesCopy = new LongObjectHashMap<>();
            nodesCopy.putAll(nodes);
            MutableLongObjectMap<MutableList<Node>> childrenCopy = new LongObjectHashMap<>();
            children.forEachKeyValue((id, list) -> childrenCopy.put(id, Lists.mutable.withAll(list)));
            MutableLongLongMap parentsCopy = new LongLongHashMap();
            parentsCopy.putAll(parents);
            return new LabeledTree(root, nodesCopy, childrenCopy, parentsCopy);
        }
    }
}
