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

import java.util.List;
import org.neo4j.codematching.model.Mapping;
import org.neo4j.util.Preconditions;

/**
 * Outcome of locating a corpus of patterns in a target: the strongest patterns that occur, or nothing at all.
 * An empty result is different from a result of strength zero, which a matched pattern without nodes produces.
 */
public final class LocateResult {
    private static final LocateResult EMPTY = new LocateResult(-1, List.of());

    private final int strength;
    private final List<LocatedPattern> patterns;

    private LocateResult(int strength, List<LocatedPattern> patterns) {
        this.strength = strength;
        this.patterns = patterns;
    }

    public static LocateResult empty() {
        return EMPTY;
    }

    /**
     * @param strength the shared strength of all the given patterns.
     * @param patterns the patterns, in the order they were offered to the locator.
     * @return a non-empty result.
     */
    public static LocateResult of(int strength, List<LocatedPattern> patterns) {
        Preconditions.requireNonNegative(strength);
        Preconditions.checkArgument(!patterns.isEmpty(), "A located result needs at least one pattern");
        return new LocateResult(strength, List.copyOf(patterns));
    }

    /**
     * @return {@code true} if no pattern occurs in the target.
     */
    public boolean isEmpty() {
        return patterns.isEmpty();
    }

    /**
     * @return the strength shared by all {@link #patterns()}.
     * @throws IllegalStateException for an {@link #isEmpty() empty} result, which has no strength.
     */
    public int strength() {
        Preconditions.checkState(!isEmpty(), "Nothing was located, so there is no strength");
        return strength;
    }

    /**
     * @return the patterns of maximal strength with their mappings, in encounter order. Empty for an
     * {@link #isEmpty() empty} result.
     */
    public List<LocatedPattern> patterns() {
        return patterns;
    }

    @Override
    public String toString() {
        return isEmpty() ? "LocateResult{nothing found}" : "LocateResult{strength=" + strength + ", " + patterns + "}";
    }

    /**
     * A pattern that occurs in the target, reported under its key.
     */
    public record LocatedPattern(String patternKey, Mapping mapping) {
        public LocatedPattern {
            requireNonNull(patternKey);
            requireNonNull(mapping);
        }
    }
}
