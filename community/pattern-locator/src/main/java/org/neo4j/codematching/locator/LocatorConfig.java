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

import java.time.Duration;
import org.neo4j.util.Preconditions;

/**
 * Configuration of a {@link PatternLocator}.
 *
 * @param parallelism number of worker threads evaluating candidates, {@code 1} evaluates them on the calling thread.
 * @param candidateTimeout how long the search for a single candidate may take before the candidate is skipped,
 * {@link Duration#ZERO} for no limit.
 */
public record LocatorConfig(int parallelism, Duration candidateTimeout) {
    public LocatorConfig {
        Preconditions.requirePositive(parallelism);
        requireNonNull(candidateTimeout);
        Preconditions.checkArgument(
                !candidateTimeout.isNegative(), "Candidate timeout must not be negative, got %s", candidateTimeout);
    }

    public static LocatorConfig defaults() {
        return new LocatorConfig(1, Duration.ZERO);
    }

    public LocatorConfig withParallelism(int parallelism) {
        return new LocatorConfig(parallelism, candidateTimeout);
    }

    public LocatorConfig withCandidateTimeout(Duration candidateTimeout) {
        return new LocatorConfig(parallelism, candidateTimeout);
    }

    public boolean hasCandidateTimeout() {
        return !candidateTimeout.isZero();
    }
}
