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

import java.util.List;
import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.MutableList;
import org.neo4j.codematching.locator.LocateResult.LocatedPattern;
import org.neo4j.codematching.model.Mapping;
import org.neo4j.util.Preconditions;

/**
 * Running maximum strength together with every pattern that reached it.
 * <p>
 * A strictly stronger match replaces the tie set, an equally strong one joins it and a weaker one is dropped. Each
 * entry remembers the index of its candidate and the tie set is kept in index order, which makes {@link #merge}
 * associative and commutative: partial rankings built by different workers can be combined in any order and
 * still produce the result a single pass in candidate order would.
 * <p>
 * Not thread safe, every worker builds its own.
 */
final class RankedMatches {
    private int strength = -1;
    private MutableList<Entry> ties = Lists.mutable.empty();

    void offer(int index, String key, int strength, Mapping mapping) {
        Preconditions.requireNonNegative(strength);
        add(new Entry(index, key, strength, mapping));
    }

    /**
     * Folds another partial ranking into this one.
     */
    void merge(RankedMatches other) {
        for (Entry entry : other.ties) {
            add(entry);
        }
    }

    boolean isEmpty() {
        return ties.isEmpty();
    }

    int strength() {
        return strength;
    }

    LocateResult toResult() {
        if (ties.isEmpty()) {
            return LocateResult.empty();
        }
        List<LocatedPattern> patterns =
                ties.collect(entry -> new LocatedPattern(entry.key(), entry.mapping()));
        return LocateResult.of(strength, patterns);
    }

    private void add(Entry entry) {
        if (entry.strength() > strength) {
            strength = entry.strength();
            ties = Lists.mutable.with(entry);
        } else if (entry.strength() == strength) {
            int position = insertionPoint(entry.index());
            ties.add(position, entry);
        }
    }

    private int insertionPoint(int index) {
        int position = ties.size();
        while (position > 0 && ties.get(position - 1).index() > index) {
            position--;
        }
        return position;
    }

    private record Entry(int index, String key, int strength, Mapping mapping) {}
}
