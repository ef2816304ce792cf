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

import org.neo4j.codematching.model.Node;

/**
 * Decides whether a pattern node may be mapped onto a target node. Used by both {@link SubgraphMatcher} and
 * {@link SubtreeMatcher}. See {@link CommonNodeCompatibilities} for the stock rules.
 */
@FunctionalInterface
public interface NodeCompatibility {
    /**
     * @param patternNode the node of the pattern.
     * @param targetNode the candidate node of the target.
     * @return {@code true} if {@code targetNode} can stand in for {@code patternNode}.
     * @throws MissingCompatibilityHintException if the pattern node lacks information the rule requires. This is a
     * defect of the pattern, not a mismatch.
     */
    boolean compatible(Node patternNode, Node targetNode);
}
