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

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.neo4j.codematching.SearchGuard;
import org.neo4j.codematching.SearchInterruptedException;
import org.neo4j.codematching.model.GraphPattern;
import org.neo4j.codematching.model.LabeledGraph;
import org.neo4j.codematching.model.LabeledTree;
import org.neo4j.codematching.model.TreePattern;
import org.neo4j.internal.helpers.NamedThreadFactory;
import org.neo4j.logging.InternalLog;
import org.neo4j.logging.InternalLogProvider;
import org.neo4j.util.Preconditions;

/**
 * Finds which patterns of a corpus occur in a target, keeping only the strongest ones.
 * <p>
 * Every pattern that occurs is ranked by its strength. A pattern stronger than everything seen so far replaces the
 * result, a pattern as strong as the best joins it, weaker ones are ignored. Patterns that tie are reported in the
 * order they were given, also when they are evaluated by several workers.
 * <p>
 * With a {@link LocatorConfig#candidateTimeout() candidate timeout} a pattern whose search runs for too long is
 * skipped and logged, as if it didn't occur. Broken patterns, e.g. a variable node without a suffix hint, fail the
 * whole call.
 * <p>
 * With a {@link LocatorConfig#parallelism() parallelism} above one, candidates are evaluated on daemon pool threads,
 * so per-candidate log messages such as skip warnings are logged from those threads.
 */
public class PatternLocator implements AutoCloseable {
    private final LocatorConfig config;
    private final InternalLog log;
    private final Clock clock;
    private final ExecutorService executor;
    private volatile boolean closed;

    public PatternLocator(LocatorConfig config, InternalLogProvider logProvider) {
        this(config, logProvider, Clock.systemUTC());
    }

    public PatternLocator(LocatorConfig config, InternalLogProvider logProvider, Clock clock) {
        this.config = requireNonNull(config);
        this.log = logProvider.getLog(PatternLocator.class);
        this.clock = requireNonNull(clock);
        this.executor = config.parallelism() > 1
                ? Executors.newFixedThreadPool(config.parallelism(), NamedThreadFactory.daemon("pattern-locator"))
                : null;
    }

    public LocateResult locateBestSubgraph(LabeledGraph target, List<GraphPattern> patterns) {
        return locateBest(Candidates.forGraph(target, patterns));
    }

    public LocateResult locateBestSubtree(LabeledTree target, List<TreePattern> patterns) {
        return locateBest(Candidates.forTree(target, patterns));
    }

    /**
     * @param candidates patterns bound to their target, in encounter order.
     * @return the patterns of maximal strength, or {@link LocateResult#empty()} if none occurs.
     * @throws SearchInterruptedException if the calling thread was interrupted while searching or waiting for the
     * workers.
     */
    public LocateResult locateBest(List<? extends Candidate> candidates) {
        requireNonNull(candidates);
        Preconditions.checkState(!closed, "Locator has been closed");

        RankedMatches ranked = executor == null || candidates.size() < 2
                ? evaluate(candidates, 0, 1)
                : evaluateInParallel(candidates);
        LocateResult result = ranked.toResult();
        if (result.isEmpty()) {
            log.info("None of %d patterns occurs in the target", candidates.size());
        } else {
            log.info(
                    "Located %d of %d patterns with strength %d",
                    result.patterns().size(),
                    candidates.size(),
                    result.strength());
        }
        return result;
    }

    /**
     * Evaluates every {@code stride}th candidate starting at {@code first}.
     */
    private RankedMatches evaluate(List<? extends Candidate> candidates, int first, int stride) {
        var ranked = new RankedMatches();
        for (int index = first; index < candidates.size(); index += stride) {
            Candidate candidate = candidates.get(index);
            Optional<Candidate.Match> match;
            try {
                match = candidate.match(guard());
            } catch (SearchInterruptedException e) {
                if (Thread.currentThread().isInterrupted()) {
                    throw e;
                }
                log.warn("Skipping pattern %s, it ran out of time: %s", candidate.key(), e.getMessage());
                continue;
            }

            if (match.isPresent()) {
                var found = match.get();
                if (log.isDebugEnabled()) {
                    log.debug(
                            "Pattern %s occurs with strength %d at %s",
                            candidate.key(),
                            found.strength(),
                            found.mapping());
                }
                ranked.offer(index, candidate.key(), found.strength(), found.mapping());
            }
        }
        return ranked;
    }

    private RankedMatches evaluateInParallel(List<? extends Candidate> candidates) {
        int workers = Math.min(config.parallelism(), candidates.size());
        var completion = new ExecutorCompletionService<RankedMatches>(executor);
        List<Future<RankedMatches>> futures = new ArrayList<>(workers);
        for (int worker = 0; worker < workers; worker++) {
            int first = worker;
            futures.add(completion.submit(() -> evaluate(candidates, first, workers)));
        }

        var ranked = new RankedMatches();
        try {
            for (int i = 0; i < workers; i++) {
                ranked.merge(completion.take().get());
            }
            return ranked;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SearchInterruptedException("Interrupted while locating patterns", e);
        } catch (ExecutionException e) {
            throw unwrap(e);
        } finally {
            for (Future<RankedMatches> future : futures) {
                future.cancel(true);
            }
        }
    }

    private SearchGuard guard() {
        if (!config.hasCandidateTimeout()) {
            return SearchGuard.INTERRUPTIBLE;
        }
        return SearchGuard.INTERRUPTIBLE.or(SearchGuard.deadline(clock, config.candidateTimeout()));
    }

    private static RuntimeException unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IllegalStateException("Failed to evaluate patterns", cause);
    }

    @Override
    public void close() {
        closed = true;
        if (executor != null) {
            executor.shutdownNow();
        }
    }
}
