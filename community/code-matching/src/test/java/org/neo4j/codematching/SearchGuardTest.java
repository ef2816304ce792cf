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
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class SearchGuardTest {
    @Test
    void shouldStopOnceDeadlinePassed() {
        // given
        var start = Instant.parse("2024-01-01T00:00:00Z");
        var clock = mock(Clock.class);
        when(clock.instant()).thenReturn(start, start.plusSeconds(1), start.plusSeconds(5), start.plusSeconds(6));

        // when
        var guard = SearchGuard.deadline(clock, Duration.ofSeconds(5));

        // then
        assertThat(guard.shouldStop()).isFalse();
        assertThat(guard.shouldStop()).isFalse();
        assertThat(guard.shouldStop()).isTrue();
    }

    @Test
    void shouldNeverStopForBudgetBeyondLastInstant() {
        var clock = mock(Clock.class);
        when(clock.instant()).thenReturn(Instant.parse("2024-01-01T00:00:00Z"), Instant.MAX);

        var guard = SearchGuard.deadline(clock, Duration.ofSeconds(Long.MAX_VALUE));

        assertThat(guard.shouldStop()).isFalse();
    }

    @Test
    void shouldStopOnInterruptedThread() {
        try {
            Thread.currentThread().interrupt();
            assertThat(SearchGuard.INTERRUPTIBLE.shouldStop()).isTrue();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
        assertThat(SearchGuard.INTERRUPTIBLE.shouldStop()).isFalse();
    }

    @Test
    void shouldStopWhenEitherGuardStops() {
        assertThat(SearchGuard.NONE.or(SearchGuard.NONE).shouldStop()).isFalse();
        assertThat(SearchGuard.NONE.or(() -> true).shouldStop()).isTrue();
        SearchGuard always = () -> true;
        assertThat(always.or(SearchGuard.NONE).shouldStop()).isTrue();
    }
}
