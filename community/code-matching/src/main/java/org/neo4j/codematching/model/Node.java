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

import org.apache.commons.lang3.StringUtils;

/**
 * A node of a program graph or syntax tree.
 *
 * @param id unique id of the node within its graph or tree.
 * @param label the syntactic or semantic category, e.g. {@code var}, {@code call}, {@code literal}. May be {@code null}.
 * @param originalLabel the raw source text the node was built from. May be {@code null}.
 * @param phase the pattern half this node belongs to, {@code null} for target nodes.
 * @param suffixHint for variable nodes of a pattern, the suffix a target variable name must end with.
 */
public record Node(long id, String label, String originalLabel, Phase phase, String suffixHint) {
    static final String VARIABLE_LABEL_PREFIX = "var";

    public static Node of(long id, String label, String originalLabel) {
        return new Node(id, label, originalLabel, null, null);
    }

    public static Node before(long id, String label, String originalLabel) {
        return new Node(id, label, originalLabel, Phase.BEFORE, null);
    }

    public static Node after(long id, String label, String originalLabel) {
        return new Node(id, label, originalLabel, Phase.AFTER, null);
    }

    public Node withPhase(Phase phase) {
        return new Node(id, label, originalLabel, phase, suffixHint);
    }

    public Node withSuffixHint(String suffixHint) {
        return new Node(id, label, originalLabel, phase, suffixHint);
    }

    /**
     * @return {@code true} if this node stands for a variable, whose name may differ between occurrences.
     */
    public boolean isVariable() {
        return StringUtils.startsWith(label, VARIABLE_LABEL_PREFIX);
    }

    public boolean hasLabels() {
        return label != null && originalLabel != null;
    }

    public boolean hasSuffixHint() {
        return suffixHint != null;
    }

    @Override
    public String toString() {
        return id + ":" + label + "(" + originalLabel + ")";
    }
}
