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

import static java.util.Objects.requireNonNull;

import java.util.Optional;
import org.neo4j.codematching.model.GraphPattern;
import org.neo4j.codematching.model.LabeledGraph;
import org.neo4j.codematching.model.Mapping;

/**
 * Finds occurrences of graph patterns in one target graph, e.g. the flow graph of a method.
 * <p>
 * An occurrence of a pattern is an injective {@link Mapping} of the pattern's {@link GraphPattern#query() query}
 * nodes onto target nodes, such that mapped nodes are {@link NodeCompatibility compatible} and every query edge
 * {@code (u, v, kind)} with multiplicity {@code m} has at least {@code m} counterparts {@code (M(u), M(v), kind)} in
 * the target. The target may have any number of additional nodes and edges.
 * <p>
 * The matcher only reads the target and keeps no state between calls, so one instance can serve many patterns and
 * threads.
 */
public class SubgraphMatcher {
    private final LabeledGraph target;
    private final NodeCompatibility compatibility;
    private final SearchGuard guard;

    public SubgraphMatcher(LabeledGraph target) {
        this(target, CommonNodeCompatibilities.suffixAware(), SearchGuard.NONE);
    }

    /**
     * @param target the graph to search in.
     * @param compatibility decides which target nodes a pattern node may be mapped onto.
     * @param guard consulted between extension attempts of every search started through this matcher.
     */
    public SubgraphMatcher(LabeledGraph target, NodeCompatibility compatibility, SearchGuard guard) {
        this.target = requireNonNull(target);
        this.compatibility = requireNonNull(compatibility);
        this.guard = requireNonNull(guard);
    }

    public LabeledGraph target() {
        return target;
    }

    /**
     * Find occurrences of the {@link org.neo4j.codematching.model.Phase#BEFORE before} half of the given pattern.
     *
     * @param pattern the pattern to look for.
     * @return a lazy enumeration of all occurrences, empty if there are none.
     */
    public Occurrences findOccurrences(GraphPattern pattern) {
        return findOccurrences(pattern.query(), guard);
    }

    /**
     * Like {@link #findOccurrences(GraphPattern)}, but with a guard for this search only.
     */
    public Occurrences findOccurrences(GraphPattern pattern, SearchGuard guard) {
        return findOccurrences(pattern.query(), guard);
    }

    /**
     * Find occurrences of the given query graph as is, all of its nodes taking part regardless of their phase.
     *
     * @param query the graph to look for.
     * @param guard consulted between extension attempts.
     * @return a lazy enumeration of all occurrences, empty if there are none.
     */
    public Occurrences findOccurrences(LabeledGraph query, SearchGuard guard) {
        return new OccurrenceFinder(requireNonNull(query), target, compatibility, requireNonNull(guard));
    }

    /**
     * @param pattern the pattern to look for.
     * @return the first occurrence in search order, if there is any.
     */
    public Optional<Mapping> findFirst(GraphPattern pattern) {
        try (Occurrences occurrences = findOccurrences(pattern)) {
            return occurrences.hasNext() ? Optional.of(occurrences.next()) : Optional.empty();
        }
    }

    public boolean hasOccurrence(GraphPattern pattern) {
        return findFirst(pattern).isPresent();
    }
}
