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
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.neo4j.codematching.model.LabeledTree;
import org.neo4j.codematching.model.MalformedStructureException;
import org.neo4j.codematching.model.Mapping;
import org.neo4j.codematching.model.Node;
import org.neo4j.codematching.model.TreePattern;

class SubtreeMatcherTest {
    private final SubtreeMatcher matcher = new SubtreeMatcher();

    @Test
    void shouldSkipTargetChildrenBetweenMatchedOnes() {
        // given
        var target = LabeledTree.builder(Node.of(1, "block", "{}"))
                .addChildren(1, Node.of(2, "call", "p"), Node.of(3, "call", "q"), Node.of(4, "call", "s"))
                .build();
        var fragment = LabeledTree.builder(Node.before(10, "block", "{}"))
                .addChildren(10, Node.before(11, "call", "p"), Node.before(12, "call", "s"))
                .build();

        // when
        var found = matcher.findSubtree(fragment, target);

        // then
        assertThat(found).contains(Mapping.of(10, 1, 11, 2, 12, 4));
    }

    @Test
    void shouldNotReorderPatternChildren() {
        var target = LabeledTree.builder(Node.of(1, "block", "{}"))
                .addChildren(1, Node.of(2, "call", "p"), Node.of(3, "call", "q"), Node.of(4, "call", "s"))
                .build();
        var fragment = LabeledTree.builder(Node.before(10, "block", "{}"))
                .addChildren(10, Node.before(11, "call", "s"), Node.before(12, "call", "p"))
                .build();

        assertThat(matcher.findSubtree(fragment, target)).isEmpty();
    }

    @Test
    void shouldTryLaterSiblingWhenEarlierOneLacksDescendants() {
        // given
        var target = LabeledTree.builder(Node.of(1, "block", "{}"))
                .addChildren(1, Node.of(2, "if", "if"), Node.of(3, "call", "log"), Node.of(4, "if", "if"))
                .addChild(4, Node.of(5, "return", "return"))
                .build();
        var fragment = LabeledTree.builder(Node.before(10, "block", "{}"))
                .addChild(10, Node.before(11, "if", "if"))
                .addChild(11, Node.before(12, "return", "return"))
                .build();

        // when
        var found = matcher.findSubtree(fragment, target);

        // then
        assertThat(found).contains(Mapping.of(10, 1, 11, 4, 12, 5));
    }

    @Test
    void shouldAnchorBelowTargetRoot() {
        var target = LabeledTree.builder(Node.of(1, "method", "m"))
                .addChild(1, Node.of(2, "block", "{}"))
                .addChild(2, Node.of(3, "call", "close"))
                .build();
        var fragment = LabeledTree.builder(Node.before(10, "block", "{}"))
                .addChild(10, Node.before(11, "call", "close"))
                .build();

        assertThat(matcher.findSubtree(fragment, target)).contains(Mapping.of(10, 2, 11, 3));
    }

    @Test
    void shouldNotMatchGrandchildAsChild() {
        var target = LabeledTree.builder(Node.of(1, "block", "{}"))
                .addChild(1, Node.of(2, "if", "if"))
                .addChild(2, Node.of(3, "call", "close"))
                .build();
        var fragment = LabeledTree.builder(Node.before(10, "block", "{}"))
                .addChild(10, Node.before(11, "call", "close"))
                .build();

        assertThat(matcher.findSubtree(fragment, target)).isEmpty();
    }

    @Test
    void shouldMatchVariablesBySuffixHint() {
        var target = LabeledTree.builder(Node.of(1, "call", "close"))
                .addChild(1, Node.of(2, "var", "inputStream"))
                .build();

        assertThat(matcher.findSubtree(closeOf("Stream"), target)).contains(Mapping.of(10, 1, 11, 2));
        assertThat(matcher.findSubtree(closeOf("Reader"), target)).isEmpty();
    }

    @Test
    void shouldNotMatchFragmentLargerThanTarget() {
        var target = LabeledTree.leaf(Node.of(1, "call", "close"));

        assertThat(matcher.findSubtree(closeOf("x"), target)).isEmpty();
    }

    @Test
    void shouldReportFirstOccurringFragmentOfPattern() {
        // given
        var target = LabeledTree.builder(Node.of(1, "call", "close"))
                .addChild(1, Node.of(2, "var", "inputStream"))
                .build();
        var readerFragment = closeOf("Reader");
        var streamFragment = closeOf("Stream");
        var pattern = new TreePattern("close", List.of(readerFragment, streamFragment));

        // when
        var found = matcher.findSubtree(pattern, target);

        // then
        assertThat(found).hasValueSatisfying(match -> {
            assertThat(match.fragment()).isSameAs(streamFragment);
            assertThat(match.mapping()).isEqualTo(Mapping.of(10, 1, 11, 2));
        });
    }

    @Test
    void shouldPickLargestFragment() {
        // given
        var small = chain(4);
        var large = chain(7);

        // then
        assertThat(SubtreeMatcher.getMaximalSubtree(List.of(small, large))).isSameAs(large);
        assertThat(SubtreeMatcher.getMaximalSubtree(List.of(large, small))).isSameAs(large);
        assertThat(SubtreeMatcher.getMaximalSubtree(List.of(small))).isSameAs(small);
    }

    @Test
    void shouldPickFirstOfEquallyLargeFragments() {
        var first = chain(5);
        var second = chain(5);

        assertThat(SubtreeMatcher.getMaximalSubtree(List.of(chain(2), first, second))).isSameAs(first);
    }

    @Test
    void shouldRefuseToPickFromNoFragments() {
        assertThatThrownBy(() -> SubtreeMatcher.getMaximalSubtree(List.of()))
                .isInstanceOf(MalformedStructureException.class);
    }

    @Test
    void shouldStopWhenGuardSaysSo() {
        var guard = mock(SearchGuard.class);
        when(guard.shouldStop()).thenReturn(true);
        var target = LabeledTree.builder(Node.of(1, "call", "close"))
                .addChild(1, Node.of(2, "var", "inputStream"))
                .build();

        assertThatThrownBy(() -> new SubtreeMatcher(CommonNodeCompatibilities.suffixAware(), guard)
                        .findSubtree(closeOf("Stream"), target))
                .isInstanceOf(SearchInterruptedException.class);
    }

    private static LabeledTree closeOf(String suffixHint) {
        return LabeledTree.builder(Node.before(10, "call", "close"))
                .addChild(10, Node.before(11, "var", "s").withSuffixHint(suffixHint))
                .build();
    }

    private static LabeledTree chain(int size) {
        var builder = LabeledTree.builder(Node.before(0, "block", "{}"));
        for (int id = 1; id < size; id++) {
            builder.addChild(id - 1, Node.before(id, "block", "{}"));
        }
        return builder.build();
    }
}
