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

import java.util.Iterator;
import org.neo4j.codematching.model.Mapping;

/**
 * Lazily enumerated occurrences of a pattern. Each call to {@link #next()} resumes the search where the previous
 * mapping was found, so a caller only pays for the mappings it pulls. This is a single-pass view,
 * {@link #iterator()} returns the instance itself.
 * <p>
 * Simply stop pulling to abandon the search. {@link #close()} drops the search state right away. If the
 * {@link SearchGuard} of the search asks to stop, {@link #hasNext()} throws {@link SearchInterruptedException}.
 */
public interface Occurrences extends Iterable<Mapping>, Iterator<Mapping>, AutoCloseable {
    @Override
    default Iterator<Mapping> iterator() {
        return this;
    }

    @Override
    void close();
}
