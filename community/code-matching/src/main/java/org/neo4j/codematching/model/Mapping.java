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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.StringJoiner;
import org.eclipse.collections.api.map.primitive.LongLongMap;
import org.eclipse.collections.api.map.primitive.MutableLongLongMap;
import org.eclipse.collections.impl.map.mutable.primitive.LongLongHashMap;
import org.eclipse.collections.impl.set.mutable.primitive.LongHashSet;

/**
 * The witness of a match: an injective function from pattern node ids to target node ids.
 * <p>
 * A mapping is a value, it is immutable and holds no reference to the search that produced it.
 */
public final class Mapping {
    private static final Mapping EMPTY = new Mapping(new LongLongHashMap());

    private final LongLongMap patternToTarget;
    private final long[] patternIds;

    private Mapping(MutableLongLongMap patternToTarget) {
        this.patternToTarget = patternToTarget;
        this.patternIds = patternToTarget.keySet().toSortedArray();
    }

    public static Mapping empty() {
        return EMPTY;
    }

    /**
     * @param patternToTarget pattern node id to target node id pairs.
     * @return a mapping holding a copy of the given pairs.
     * @throws MalformedStructureException if two pattern nodes map to the same target node.
     */
    public static Mapping of(LongLongMap patternToTarget) {
        var targets = new LongHashSet();
        var copy = new LongLongHashMap();
        patternToTarget.forEachKeyValue((patternId, targetId) -> {
            if (!targets.add(targetId)) {
                throw new MalformedStructureException(
                        "Target node %d is mapped more than once, mappings must be injective", targetId);
            }
            copy.put(patternId, targetId);
        });
        return new Mapping(copy);
    }

    /**
     * Convenience factory taking alternating pattern id and target id values.
     */
    public static Mapping of(long... patternAndTargetIds) {
        if (patternAndTargetIds.length % 2 != 0) {
            throw new MalformedStructureException("Expected pattern/target id pairs, got an odd number of ids");
        }
        var map = new LongLongHashMap();
        for (int i = 0; i < patternAndTargetIds.length; i += 2) {
            long patternId = patternAndTargetIds[i];
            if (map.containsKey(patternId)) {
                throw new MalformedStructureException("Pattern node %d is mapped more than once", patternId);
            }
            map.put(patternId, patternAndTargetIds[i + 1]);
        }
        return of(map);
    }

    /**
     * @param patternId id of a pattern node.
     * @return id of the target node the pattern node is mapped to.
     * @throws NoSuchElementException if the pattern node isn't part of this mapping.
     */
    public long targetOf(long patternId) {
        if (!patternToTarget.containsKey(patternId)) {
            throw new NoSuchElementException("Pattern node " + patternId + " is not mapped");
        }
        return patternToTarget.get(patternId);
    }

    public boolean contains(long patternId) {
        return patternToTarget.containsKey(patternId);
    }

    public boolean isTargetUsed(long targetId) {
        return patternToTarget.containsValue(targetId);
    }

    /**
     * @return the mapped pattern node ids, in ascending order.
     */
    public long[] patternIds() {
        return patternIds.clone();
    }

    public int size() {
        return patternIds.length;
    }

    public boolean isEmpty() {
        return patternIds.length == 0;
    }

    /**
     * @return the pairs as a boxed map, iterating in ascending pattern id order.
     */
    public Map<Long, Long> toMap() {
        Map<Long, Long> result = new LinkedHashMap<>();
        for (long patternId : patternIds) {
            result.put(patternId, patternToTarget.get(patternId));
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return patternToTarget.equals(((Mapping) o).patternToTarget);
    }

    @Override
    public int hashCode() {
        return patternToTarget.hashCode();
    }

    @Override
    public String toString() {
        var joiner = new StringJoiner(", ", "{", "}");
        for (long patternId : patternIds) {
            joiner.add(patternId + "->" + patternToTarget.get(patternId));
        }
        return joiner.toString();
    }
}
