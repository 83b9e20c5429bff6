// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword.csp;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableSortedSet;
import net.littleredcomputer.crossword.Assignment;
import net.littleredcomputer.crossword.Crossword;
import net.littleredcomputer.crossword.Variable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fills a crossword from a vocabulary: node consistency, then AC-3 over every arc, then
 * backtracking search. Each call to {@link #run()} starts from fresh domains.
 */
public class CrosswordSolver {
    private static final Logger log = LogManager.getFormatterLogger(CrosswordSolver.class);

    private final Crossword crossword;
    private final ImmutableSortedSet<String> vocabulary;
    private SearchLimits limits = SearchLimits.unbounded();
    private Duration logInterval = Duration.ofMillis(1000);
    private boolean maintainArcConsistency = true;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public CrosswordSolver(Crossword crossword, Iterable<String> vocabulary) {
        this.crossword = Preconditions.checkNotNull(crossword);
        this.vocabulary = ImmutableSortedSet.copyOf(vocabulary);
    }

    /**
     * @return a complete, consistent assignment of words from the vocabulary to the slots
     * of the crossword, or empty if there is none
     */
    public static Optional<Assignment> solve(Crossword crossword, Iterable<String> vocabulary) {
        return new CrosswordSolver(crossword, vocabulary).run().solution();
    }

    public CrosswordSolver setLimits(SearchLimits limits) {
        this.limits = Preconditions.checkNotNull(limits);
        return this;
    }

    public CrosswordSolver setLogInterval(Duration logInterval) {
        this.logInterval = logInterval;
        return this;
    }

    public CrosswordSolver setMaintainArcConsistency(boolean maintainArcConsistency) {
        this.maintainArcConsistency = maintainArcConsistency;
        return this;
    }

    /**
     * Asks a running (or any later) search to stop. Safe to call from any thread; the
     * search notices at its next branch step and reports {@link SolveResult.Outcome#ABORTED}.
     */
    public void cancel() {
        cancelled.set(true);
    }

    public SolveResult run() {
        Stopwatch sw = Stopwatch.createStarted();
        log.info("solving %dx%d crossword: %d slots, %d crossings, %d words",
                crossword.height(), crossword.width(), crossword.variables().size(),
                crossword.overlapCount(), vocabulary.size());
        DomainStore domains = new DomainStore(crossword, vocabulary);
        ConsistencyEnforcer enforcer = new ConsistencyEnforcer(crossword);

        enforcer.enforceNodeConsistency(domains);
        if (log.isDebugEnabled()) log.debug("after node consistency:\n%s", domains);
        for (Variable v : crossword.variables()) {
            if (domains.isEmpty(v)) {
                log.info("no word of length %d for %s", v.length(), v);
                return finish(new SolveResult(SolveResult.Outcome.EMPTY_DOMAIN, null, null, 0, 0, sw.elapsed()));
            }
        }
        if (!enforcer.ac3(domains)) {
            log.info("arc consistency leaves a slot without words");
            return finish(new SolveResult(SolveResult.Outcome.ARC_INCONSISTENCY, null, null, 0, 0, sw.elapsed()));
        }
        if (log.isDebugEnabled()) log.debug("after arc consistency (%d revisions):\n%s", enforcer.revisions(), domains);

        BacktrackingSearch search = new BacktrackingSearch(domains, enforcer)
                .setLimits(limits)
                .setCancellation(cancelled::get)
                .setMaintainArcConsistency(maintainArcConsistency)
                .setLogInterval(logInterval);
        Assignment assignment = new Assignment();
        BacktrackingSearch.Status status = search.search(assignment);
        switch (status) {
            case SOLVED:
                return finish(new SolveResult(SolveResult.Outcome.SOLVED, Assignment.copyOf(assignment), null,
                        search.nodeCount(), search.backtrackCount(), sw.elapsed()));
            case ABORTED:
                return finish(new SolveResult(SolveResult.Outcome.ABORTED, null, search.abortReason(),
                        search.nodeCount(), search.backtrackCount(), sw.elapsed()));
            case FAILED:
                return finish(new SolveResult(SolveResult.Outcome.SEARCH_EXHAUSTED, null, null,
                        search.nodeCount(), search.backtrackCount(), sw.elapsed()));
            default:
                throw new IllegalStateException("unknown search status " + status);
        }
    }

    private static SolveResult finish(SolveResult r) {
        log.info("%s", r);
        return r;
    }
}
