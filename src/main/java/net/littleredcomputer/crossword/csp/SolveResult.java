// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword.csp;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import net.littleredcomputer.crossword.Assignment;

import java.time.Duration;
import java.util.Optional;

/**
 * What a solve call produced. A solution is present exactly when the outcome is
 * {@link Outcome#SOLVED}; it is always complete and consistent.
 */
public final class SolveResult {
    public enum Outcome {
        SOLVED,
        /** Some slot had no word of the right length. */
        EMPTY_DOMAIN,
        /** Arc consistency emptied a domain before any search. */
        ARC_INCONSISTENCY,
        /** Backtracking tried everything. */
        SEARCH_EXHAUSTED,
        /** A limit or a cancellation stopped the search; solvability is unknown. */
        ABORTED;

        public boolean isUnsolvable() {
            return this == EMPTY_DOMAIN || this == ARC_INCONSISTENCY || this == SEARCH_EXHAUSTED;
        }
    }

    public enum AbortReason {
        NODE_BUDGET,
        TIMEOUT,
        CANCELLED,
    }

    private final Outcome outcome;
    private final Assignment solution;
    private final AbortReason abortReason;
    private final long nodes;
    private final long backtracks;
    private final Duration elapsed;

    SolveResult(Outcome outcome, Assignment solution, AbortReason abortReason,
                long nodes, long backtracks, Duration elapsed) {
        Preconditions.checkArgument((outcome == Outcome.SOLVED) == (solution != null));
        Preconditions.checkArgument((outcome == Outcome.ABORTED) == (abortReason != null));
        this.outcome = outcome;
        this.solution = solution;
        this.abortReason = abortReason;
        this.nodes = nodes;
        this.backtracks = backtracks;
        this.elapsed = elapsed;
    }

    public Outcome outcome() { return outcome; }

    public boolean isSolved() { return outcome == Outcome.SOLVED; }

    public Optional<Assignment> solution() { return Optional.ofNullable(solution); }

    public Optional<AbortReason> abortReason() { return Optional.ofNullable(abortReason); }

    /** @return number of branch steps the search entered; 0 when consistency alone decided */
    public long nodes() { return nodes; }

    /** @return number of candidate values abandoned during search */
    public long backtracks() { return backtracks; }

    public Duration elapsed() { return elapsed; }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("outcome", outcome)
                .add("abortReason", abortReason)
                .add("nodes", nodes)
                .add("backtracks", backtracks)
                .add("elapsed", elapsed)
                .omitNullValues()
                .toString();
    }
}
