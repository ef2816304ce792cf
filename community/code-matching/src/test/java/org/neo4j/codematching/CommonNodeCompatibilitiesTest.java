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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.neo4j.codematching.model.Node;

class CommonNodeCompatibilitiesTest {
    private final NodeCompatibility suffixAware = CommonNodeCompatibilities.suffixAware();
    private final NodeCompatibility exact = CommonNodeCompatibilities.exact();

    @Test
    void shouldMatchVariableBySuffixHint() {
        var patternNode = Node.before(1, "var", "idx").withSuffixHint("dx");

        assertThat(suffixAware.compatible(patternNode, Node.of(10, "var", "index"))).isFalse();
        assertThat(suffixAware.compatible(patternNode, Node.of(10, "var", "ndx"))).isTrue();
        assertThat(suffixAware.compatible(patternNode, Node.of(10, "var", "dx"))).isTrue();
    }

    @Test
    void shouldAcceptAnyVariableForEmptySuffixHint() {
        var patternNode = Node.before(1, "var", "a").withSuffixHint("");

        assertThat(suffixAware.compatible(patternNode, Node.of(10, "var", "anything"))).isTrue();
    }

    @Test
    void shouldFailForVariableWithoutSuffixHint() {
        var patternNode = Node.before(1, "var", "a");

        var e = assertThrows(
                MissingCompatibilityHintException.class,
                () -> suffixAware.compatible(patternNode, Node.of(10, "var", "a")));
        assertThat(e.patternNodeId()).isEqualTo(1);
    }

    @Test
    void shouldNotNeedSuffixHintWhenOnlyOneSideIsVariable() {
        var patternNode = Node.before(1, "var", "a");

        assertThat(suffixAware.compatible(patternNode, Node.of(10, "call", "a"))).isFalse();
    }

    @Test
    void shouldRequireEqualLabelsForOtherNodes() {
        var patternNode = Node.before(1, "call", "foo");

        assertThat(suffixAware.compatible(patternNode, Node.of(10, "call", "foo"))).isTrue();
        assertThat(suffixAware.compatible(patternNode, Node.of(10, "call", "bar"))).isFalse();
        assertThat(suffixAware.compatible(patternNode, Node.of(10, "literal", "foo"))).isFalse();
    }

    @Test
    void shouldNeverMatchNodesWithoutLabels() {
        assertThat(suffixAware.compatible(Node.before(1, null, null), Node.of(10, null, null)))
                .isFalse();
        assertThat(exact.compatible(Node.before(1, "call", null), Node.of(10, "call", null)))
                .isFalse();
    }

    @Test
    void shouldIgnoreSuffixHintForExactRule() {
        var patternNode = Node.before(1, "var", "a").withSuffixHint("a");

        assertThat(exact.compatible(patternNode, Node.of(10, "var", "ba"))).isFalse();
        assertThat(exact.compatible(patternNode, Node.of(10, "var", "a"))).isTrue();
    }
}
