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

import java.util.Objects;
import org.apache.commons.lang3.StringUtils;
import org.neo4j.codematching.model.Node;

/**
 * Factory methods for the common {@link NodeCompatibility} rules.
 */
public final class CommonNodeCompatibilities {
    private CommonNodeCompatibilities() {}

    private static final NodeCompatibility EXACT = CommonNodeCompatibilities::sameLabels;

    private static final NodeCompatibility SUFFIX_AWARE = (patternNode, targetNode) -> {
        if (!patternNode.hasLabels() || !targetNode.hasLabels()) {
            return false;
        }
        if (patternNode.isVariable() && targetNode.isVariable()) {
            if (!patternNode.hasSuffixHint()) {
                throw new MissingCompatibilityHintException(patternNode);
            }
            return StringUtils.endsWith(targetNode.originalLabel(), patternNode.suffixHint());
        }
        return sameLabels(patternNode, targetNode);
    };

    /**
     * Nodes are compatible if both have a label and an original label and those are equal.
     *
     * @return the exact rule.
     */
    public static NodeCompatibility exact() {
        return EXACT;
    }

    /**
     * Like {@link #exact()}, except for two variables: the variable names of mined patterns are generalized over
     * several examples, so a target variable is compatible if its name ends with the suffix hint of the pattern
     * variable. A pattern variable without a suffix hint makes this rule throw
     * {@link MissingCompatibilityHintException}.
     *
     * @return the rule the matchers use by default.
     */
    public static NodeCompatibility suffixAware() {
        return SUFFIX_AWARE;
    }

    private static boolean sameLabels(Node patternNode, Node targetNode) {
        return patternNode.hasLabels()
                && targetNode.hasLabels()
                && Objects.equals(patternNode.label(), targetNode.label())
                && Objects.equals(patternNode.originalLabel(), targetNode.originalLabel());
    }
}
