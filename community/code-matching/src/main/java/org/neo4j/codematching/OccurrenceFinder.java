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

import java.util.NoSuchElementException;
import org.eclipse.collections.api.iterator.LongIterator;
import org.eclipse.collections.api.map.primitive.MutableLongLongMap;
import org.eclipse.collections.api.map.primitive.ObjectIntMap;
import org.eclipse.collections.api.set.primitive.MutableLongSet;
import org.eclipse.collections.impl.map.mutable.primitive.LongLongHashMap;
import org.eclipse.collections.impl.set.mutable.primitive.LongHashSet;
import org.neo4j.codematching.model.LabeledGraph;
import org.neo4j.codematching.model.Mapping;

/**
 * Performs the actual search for occurrences of a query graph in a target graph.
 * <p>
 * Query nodes are mapped one at a time in ascending id order. For the query node at depth {@code d} every target
 * node is tried in ascending id order, {@code cursors[d]} remembering how far that went. The whole search state
 * lives in these arrays, which is what lets {@link #next()} return a mapping and later resume right after it.
 */
class OccurrenceFinder implements Occurrences {
    private final LabeledGraph query;
    private final LabeledGraph target;
    private final NodeCompatibility compatibility;
    private final SearchGuard guard;

    private final long[] queryIds;
    private final long[] targetIds;
    private final int[] cursors;
    private final MutableLongLongMap assigned = new LongLongHashMap();
    private final MutableLongSet usedTargets = new LongHashSet();

    private int depth;
    private boolean started;
    private boolean exhausted;
    private Mapping nextMatch;

    OccurrenceFinder(LabeledGraph query, LabeledGraph target, NodeCompatibility compatibility, SearchGuard guard) {
        this.query = query;
        this.target = target;
        this.compatibility = compatibility;
        this.guard = guard;
        this.queryIds = query.nodeIds();
        this.targetIds = target.nodeIds();
        this.cursors = new int[queryIds.length];
    }

    @Override
    public boolean hasNext() {
        if (nextMatch == null) {
            nextMatch = findNextMatch();
        }
        return nextMatch != null;
    }

    @Override
    public Mapping next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Mapping match = nextMatch;
        nextMatch = null;
        return match;
    }

    @Override
    public void close() {
        finish();
        nextMatch = null;
    }

    private Mapping findNextMatch() {
        if (exhausted) {
            return null;
        }
        if (queryIds.length == 0) {
            // The empty query occurs exactly once, as the empty mapping.
            finish();
            return Mapping.empty();
        }
        if (queryIds.length > targetIds.length) {
            finish();
            return null;
        }

        if (!started) {
            started = true;
            depth = 0;
            cursors[0] = 0;
        } else {
            // Resume after the previously returned match by undoing its last extension.
            unassign(depth);
        }

        while (true) {
            if (guard.shouldStop()) {
                int mapped = assigned.size();
                finish();
                throw new SearchInterruptedException(mapped, queryIds.length);
            }
            if (cursors[depth] >= targetIds.length) {
                if (depth == 0) {
                    finish();
                    return null;
                }
                depth--;
                unassign(depth);
                continue;
            }

            long targetId = targetIds[cursors[depth]++];
            long queryId = queryIds[depth];
            if (usedTargets.contains(targetId) || !admissible(queryId, targetId)) {
                continue;
            }
            assigned.put(queryId, targetId);
            usedTargets.add(targetId);
            if (depth == queryIds.length - 1) {
                return Mapping.of(assigned);
            }
            depth++;
            cursors[depth] = 0;
        }
    }

    private void unassign(int atDepth) {
        long queryId = queryIds[atDepth];
        usedTargets.remove(assigned.get(queryId));
        assigned.remove(queryId);
    }

    /**
     * Whether mapping {@code queryId} onto {@code targetId} is consistent with the mappings made so far: the nodes
     * must be compatible, and every edge between the query node and an already mapped query node (or itself) must
     * be matched by at least as many edges of the same kind and direction in the target.
     */
    private boolean admissible(long queryId, long targetId) {
        if (!compatibility.compatible(query.node(queryId), target.node(targetId))) {
            return false;
        }
        if (!covers(query.edgeKinds(queryId, queryId), targetId, targetId)) {
            return false;
        }
        LongIterator neighbours = query.neighbours(queryId).longIterator();
        while (neighbours.hasNext()) {
            long neighbour = neighbours.next();
            if (neighbour == queryId || !assigned.containsKey(neighbour)) {
                continue;
            }
            long mappedNeighbour = assigned.get(neighbour);
            if (!covers(query.edgeKinds(neighbour, queryId), mappedNeighbour, targetId)
                    || !covers(query.edgeKinds(queryId, neighbour), targetId, mappedNeighbour)) {
                return false;
            }
        }
        return true;
    }

    private boolean covers(ObjectIntMap<String> required, long source, long destination) {
        for (String kind : required.keysView()) {
            if (target.edgeCount(source, destination, kind) < required.get(kind)) {
                return false;
            }
        }
        return true;
    }

    private void finish() {
        exhausted = true;
        assigned.clear();
        usedTargets.clear();
    }
}
