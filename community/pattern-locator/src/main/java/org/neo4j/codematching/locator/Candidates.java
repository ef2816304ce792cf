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
package org.neo4j.codematching.locator;

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.neo4j.codematching.CommonNodeCompatibilities;
import org.neo4j.codematching.NodeCompatibility;
import org.neo4j.codematching.Occurrences;
import org.neo4j.codematching.SearchGuard;
import org.neo4j.codematching.SubgraphMatcher;
import org.neo4j.codematching.SubtreeMatcher;
import org.neo4j.codematching.model.GraphPattern;
import org.neo4j.codematching.model.LabeledGraph;
import org.neo4j.codematching.model.LabeledTree;
import org.neo4j.codematching.model.TreePattern;

/**
 * Binds patterns to a target, one {@link Candidate} per pattern, keeping the caller's order.
 */
public final class Candidates {
    private Candidates() {}

    public static List<Candidate> forGraph(LabeledGraph target, List<GraphPattern> patterns) {
        return forGraph(target, patterns, CommonNodeCompatibilities.suffixAware());
    }

    public static List<Candidate> forGraph(
            LabeledGraph target, List<GraphPattern> patterns, NodeCompatibility compatibility) {
        var matcher = new SubgraphMatcher(target, compatibility, SearchGuard.NONE);
        List<Candidate> candidates = new ArrayList<>(patterns.size());
        for (GraphPattern pattern : patterns) {
            candidates.add(new GraphCandidate(pattern, matcher));
        }
        return candidates;
    }

    public static List<Candidate> forTree(LabeledTree target, List<TreePattern> patterns) {
        return forTree(target, patterns, CommonNodeCompatibilities.suffixAware());
    }

    public static List<Candidate> forTree(
            LabeledTree target, List<TreePattern> patterns, NodeCompatibility compatibility) {
        requireNonNull(target);
        List<Candidate> candidates = new ArrayList<>(patterns.size());
        for (TreePattern pattern : patterns) {
            candidates.add(new TreeCandidate(pattern, target, compatibility));
        }
        return candidates;
    }

    /**
     * Ranked by the node count of the whole pattern, not only of the half that was searched for.
     */
    static final class GraphCandidate implements Candidate {
        private final GraphPattern pattern;
        private final SubgraphMatcher matcher;

        GraphCandidate(GraphPattern pattern, SubgraphMatcher matcher) {
            this.pattern = requireNonNull(pattern);
            this.matcher = requireNonNull(matcher);
        }

        @Override
        public String key() {
            return pattern.key();
        }

        @Override
        public Optional<Match> match(SearchGuard guard) {
            try (Occurrences occurrences = matcher.findOccurrences(pattern, guard)) {
                if (!occurrences.hasNext()) {
                    return Optional.empty();
                }
                return Optional.of(new Match(pattern.size(), occurrences.next()));
            }
        }

        @Override
        public String toString() {
            return "GraphCandidate{" + pattern.key() + "}";
        }
    }

    /**
     * Ranked by the size of the pattern's maximal fragment, whichever fragment actually occurred.
     */
    static final class TreeCandidate implements Candidate {
        private final TreePattern pattern;
        private final LabeledTree target;
        private final NodeCompatibility compatibility;

        TreeCandidate(TreePattern pattern, LabeledTree target, NodeCompatibility compatibility) {
            this.pattern = requireNonNull(pattern);
            this.target = requireNonNull(target);
            this.compatibility = requireNonNull(compatibility);
        }

        @Override
        public String key() {
            return pattern.key();
        }

        @Override
        public Optional<Match> match(SearchGuard guard) {
            var matcher = new SubtreeMatcher(compatibility, guard);
            return matcher.findSubtree(pattern, target).map(found -> new Match(
                    SubtreeMatcher.getMaximalSubtree(pattern.fragments()).size(), found.mapping()));
        }

        @Override
        public String toString() {
            return "TreeCandidate{" + pattern.key() + "}";
        }
    }
}
