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

import java.util.List;
import java.util.Optional;
import org.eclipse.collections.api.list.primitive.MutableLongList;
import org.eclipse.collections.api.map.primitive.MutableLongLongMap;
import org.eclipse.collections.impl.list.mutable.primitive.LongArrayList;
import org.eclipse.collections.impl.map.mutable.primitive.LongLongHashMap;
import org.neo4j.codematching.model.LabeledTree;
import org.neo4j.codematching.model.MalformedStructureException;
import org.neo4j.codematching.model.Mapping;
import org.neo4j.codematching.model.Node;
import org.neo4j.codematching.model.TreePattern;

/**
 * Finds tree fragments inside a target tree, e.g. the syntax tree of a method.
 * <p>
 * A fragment occurs at target node {@code o} if the fragment root is {@link NodeCompatibility compatible} with
 * {@code o} and the fragment root's children occur, in order, at a subsequence of {@code o}'s children. Target
 * children may be skipped, pattern children may not be reordered. The rule applies recursively all the way down.
 */
public class SubtreeMatcher {
    private final NodeCompatibility compatibility;
    private final SearchGuard guard;

    public SubtreeMatcher() {
        this(CommonNodeCompatibilities.suffixAware(), SearchGuard.NONE);
    }

    public SubtreeMatcher(NodeCompatibility compatibility, SearchGuard guard) {
        this.compatibility = requireNonNull(compatibility);
        this.guard = requireNonNull(guard);
    }

    /**
     * Picks the largest fragment of a pattern.
     *
     * @param fragments the candidate fragments of one pattern.
     * @return the fragment with the most nodes, the first one of them if several share that size.
     * @throws MalformedStructureException if {@code fragments} is empty.
     */
    public static LabeledTree getMaximalSubtree(List<LabeledTree> fragments) {
        requireNonNull(fragments);
        if (fragments.isEmpty()) {
            throw new MalformedStructureException("Cannot pick the maximal subtree out of no fragments");
        }
        LabeledTree maximal = fragments.get(0);
        for (LabeledTree fragment : fragments) {
            if (fragment.size() > maximal.size()) {
                maximal = fragment;
            }
        }
        return maximal;
    }

    /**
     * Anchors are tried in pre-order of the target, so the first witness is the one closest to the target root.
     *
     * @param fragment the tree to look for.
     * @param target the tree to look in.
     * @return a mapping from fragment node ids to target node ids of the first occurrence found, if any.
     * @throws SearchInterruptedException if the guard asked to stop before the search was complete.
     */
    public Optional<Mapping> findSubtree(LabeledTree fragment, LabeledTree target) {
        requireNonNull(fragment);
        requireNonNull(target);
        if (fragment.size() > target.size()) {
            return Optional.empty();
        }
        var search = new Search(fragment, target);
        for (Node anchor : target.preOrder()) {
            if (search.matchAt(fragment.root(), anchor)) {
                return Optional.of(Mapping.of(search.mapping));
            }
        }
        return Optional.empty();
    }

    /**
     * Tries the fragments of a pattern in order and reports the first one that occurs in the target.
     *
     * @param pattern the pattern to look for.
     * @param target the tree to look in.
     * @return the occurring fragment along with its mapping, if any fragment occurs.
     */
    public Optional<FragmentMatch> findSubtree(TreePattern pattern, LabeledTree target) {
        for (LabeledTree fragment : pattern.fragments()) {
            Optional<Mapping> mapping = findSubtree(fragment, target);
            if (mapping.isPresent()) {
                return Optional.of(new FragmentMatch(fragment, mapping.get()));
            }
        }
        return Optional.empty();
    }

    /**
     * A fragment of a {@link TreePattern} together with where it was found.
     */
    public record FragmentMatch(LabeledTree fragment, Mapping mapping) {}

    /**
     * State of one search. Assignments are recorded on a trail so that a failed attempt can be undone by truncating
     * the trail back to where the attempt started.
     */
    private class Search {
        private final LabeledTree fragment;
        private final LabeledTree target;
        private final MutableLongLongMap mapping = new LongLongHashMap();
        private final MutableLongList trail = new LongArrayList();

        Search(LabeledTree fragment, LabeledTree target) {
            this.fragment = fragment;
            this.target = target;
        }

        boolean matchAt(Node patternNode, Node targetNode) {
            if (guard.shouldStop()) {
                throw new SearchInterruptedException(mapping.size(), fragment.size());
            }
            if (!compatibility.compatible(patternNode, targetNode)) {
                return false;
            }
            int mark = trail.size();
            mapping.put(patternNode.id(), targetNode.id());
            trail.add(patternNode.id());
            if (matchChildren(fragment.children(patternNode.id()), 0, target.children(targetNode.id()), 0)) {
                return true;
            }
            undoTo(mark);
            return false;
        }

        /**
         * Matches {@code patternChildren[from..]} against a subsequence of {@code targetChildren[start..]}. If the
         * earliest target child that fits a pattern child leaves the remaining pattern children unmatchable, later
         * target children are tried for it.
         */
        private boolean matchChildren(
                List<Node> patternChildren, int from, List<Node> targetChildren, int start) {
            if (from == patternChildren.size()) {
                return true;
            }
            int stillNeeded = patternChildren.size() - from;
            for (int i = start; targetChildren.size() - i >= stillNeeded; i++) {
                int mark = trail.size();
                if (matchAt(patternChildren.get(from), targetChildren.get(i))) {
                    if (matchChildren(patternChildren, from + 1, targetChildren, i + 1)) {
                        return true;
                    }
                    undoTo(mark);
                }
            }
            return false;
        }

        private void undoTo(int mark) {
            while (trail.size() > mark) {
                mapping.remove(trail.removeAtIndex(trail.size() - 1));
            }
        }
    }
}
