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

import java.util.Optional;
import org.neo4j.codematching.SearchGuard;
import org.neo4j.codematching.SearchInterruptedException;
import org.neo4j.codematching.model.Mapping;

/**
 * A pattern bound to the target it is to be located in, ready to be evaluated by the {@link PatternLocator}.
 * See {@link Candidates} for the graph and tree flavours.
 */
public interface Candidate {
    /**
     * @return the key the pattern is reported under.
     */
    String key();

    /**
     * @param guard consulted between extension attempts of the search.
     * @return where and how strongly the pattern occurs, or empty if it doesn't occur.
     * @throws SearchInterruptedException if the guard stopped the search.
     */
    Optional<Match> match(SearchGuard guard);

    /**
     * @param strength the node count the occurrence is ranked by.
     * @param mapping the witness of the occurrence.
     */
    record Match(int strength, Mapping mapping) {}
}
