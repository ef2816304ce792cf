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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Consulted by the matchers before every extension attempt. Once it asks to stop, the search ends without
 * producing any further mappings. A search that isn't stopped behaves exactly as if there were no guard.
 */
@FunctionalInterface
public interface SearchGuard {
    SearchGuard NONE = () -> false;

    /**
     * Stops when the current thread has been interrupted. The interrupt flag is left as is.
     */
    SearchGuard INTERRUPTIBLE = () -> Thread.currentThread().isInterrupted();

    boolean shouldStop();

    default SearchGuard or(SearchGuard other) {
        requireNonNull(other);
        return () -> shouldStop() || other.shouldStop();
    }

    /**
     * @param clock the clock to read.
     * @param budget how long the search may run, counted from now. A budget reaching past {@link Instant#MAX} never
     * runs out.
     * @return a guard that stops once the budget is used up.
     */
    static SearchGuard deadline(Clock clock, Duration budget) {
        requireNonNull(clock);
        requireNonNull(budget);
        Instant now = clock.instant();
        Instant deadline =
                budget.compareTo(Duration.between(now, Instant.MAX)) >= 0 ? Instant.MAX : now.plus(budget);
        return () -> clock.instant().isAfter(deadline);
    }
}
