// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword.csp;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import net.littleredcomputer.crossword.Assignment;
import net.littleredcomputer.crossword.Crossword;
import net.littleredcomputer.crossword.Variable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.function.BooleanSupplier;

/**
 * Depth-first backtracking over slot assignments. Slots are chosen by
 * {@link VariableSelector}, their words tried in {@link ValueOrderer} order, and after each
 * tentative binding arc consistency is restored from the crossing slots so that dead ends
 * show up before recursing.
 *
 * <p>Whatever the search does to the domains is undone through the {@link DomainStore}
 * trail, and every binding it makes is withdrawn, unless it succeeds: after a failed or
 * aborted search the assignment and the domains are exactly as they were.
 */
public class BacktrackingSearch {
    private static final Logger log = LogManager.getFormatterLogger(BacktrackingSearch.class);
    private static final int logCheckSteps = 1000;

    public enum Status {
        SOLVED,
        FAILED,
        ABORTED,
    }

    private final Crossword crossword;
    private final DomainStore domains;
    private final ConsistencyEnforcer enforcer;
    private final VariableSelector selector;
    private final ValueOrderer orderer;

    private SearchLimits limits = SearchLimits.unbounded();
    private BooleanSupplier cancelled = () -> false;
    private boolean maintainArcConsistency = true;
    private Duration logInterval = Duration.ofMillis(1000);

    private final Stopwatch stopwatch = Stopwatch.createUnstarted();
    private Instant lastLogTime = Instant.EPOCH;
    private long lastNodeCount;
    private long nodeCount;
    private long backtrackCount;
    private SolveResult.AbortReason abortReason;

    public BacktrackingSearch(DomainStore domains, ConsistencyEnforcer enforcer) {
        this.domains = domains;
        this.crossword = domains.crossword();
        this.enforcer = enforcer;
        this.selector = new VariableSelector(crossword);
        this.orderer = new ValueOrderer(crossword);
    }

    public BacktrackingSearch setLimits(SearchLimits limits) {
        this.limits = limits;
        return this;
    }

    /** @param cancelled polled once per branch step; the search aborts once it returns true */
    public BacktrackingSearch setCancellation(BooleanSupplier cancelled) {
        this.cancelled = cancelled;
        return this;
    }

    /** With arc maintenance off, candidates are filtered by the consistency check alone. */
    public BacktrackingSearch setMaintainArcConsistency(boolean maintainArcConsistency) {
        this.maintainArcConsistency = maintainArcConsistency;
        return this;
    }

    public BacktrackingSearch setLogInterval(Duration logInterval) {
        this.logInterval = logInterval;
        return this;
    }

    public long nodeCount() { return nodeCount; }
    public long backtrackCount() { return backtrackCount; }
    public Duration elapsed() { return stopwatch.elapsed(); }

    /** @return why the last search was aborted; null unless it returned {@link Status#ABORTED} */
    public SolveResult.AbortReason abortReason() { return abortReason; }

    /**
     * Extends the assignment to a complete, consistent one. On {@link Status#SOLVED} the
     * assignment holds the solution; otherwise it is left unchanged.
     */
    public Status search(Assignment assignment) {
        nodeCount = 0;
        backtrackCount = 0;
        lastNodeCount = 0;
        abortReason = null;
        stopwatch.reset().start();
        lastLogTime = Instant.now();
        Status s = backtrack(assignment, 0);
        stopwatch.stop();
        return s;
    }

    private Status backtrack(Assignment assignment, int depth) {
        if (assignment.size() == crossword.variables().size() && assignment.isComplete(crossword)) {
            return Status.SOLVED;
        }
        ++nodeCount;
        if (exhaustedLimits()) return Status.ABORTED;
        if (nodeCount % logCheckSteps == 0) maybeReportProgress(depth);

        Variable var = selector.select(assignment, domains);
        for (String word : orderer.order(var, assignment, domains)) {
            assignment.assign(var, word);
            if (consistent(assignment, var, word)) {
                int mark = domains.mark();
                if (!maintainArcConsistency || propagate(var, word)) {
                    if (log.isTraceEnabled()) log.trace("%d: %s = %s", depth, var, word);
                    Status s = backtrack(assignment, depth + 1);
                    if (s == Status.SOLVED) return s;
                    if (s == Status.ABORTED) {
                        domains.rollback(mark);
                        assignment.unassign(var);
                        return s;
                    }
                }
                domains.rollback(mark);
            }
            assignment.unassign(var);
            ++backtrackCount;
        }
        return Status.FAILED;
    }

    /**
     * Checks the new binding of var against the slots already bound. The rest of the
     * assignment is consistent by construction, so this is enough to make all of it so.
     */
    private boolean consistent(Assignment assignment, Variable var, String word) {
        if (word.length() != var.length()) return false;
        if (assignment.isUsedElsewhere(word, var)) return false;
        for (Variable n : crossword.neighbors(var)) {
            String other = assignment.get(n).orElse(null);
            if (other == null) continue;
            if (!crossword.overlap(var, n).map(o -> o.agrees(word, other)).orElse(true)) return false;
        }
        return true;
    }

    /**
     * Narrows var to the chosen word and restores arc consistency of its neighbors.
     * @return false if some domain was emptied; the caller rolls the domains back
     */
    private boolean propagate(Variable var, String word) {
        domains.retainOnly(var, word);
        ImmutableList.Builder<ConsistencyEnforcer.Arc> arcs = ImmutableList.builder();
        for (Variable n : crossword.neighbors(var)) arcs.add(new ConsistencyEnforcer.Arc(n, var));
        return enforcer.ac3(domains, arcs.build());
    }

    private boolean exhaustedLimits() {
        if (limits.nodesExceeded(nodeCount)) {
            abortReason = SolveResult.AbortReason.NODE_BUDGET;
        } else if (limits.timeExceeded(stopwatch.elapsed())) {
            abortReason = SolveResult.AbortReason.TIMEOUT;
        } else if (cancelled.getAsBoolean()) {
            abortReason = SolveResult.AbortReason.CANCELLED;
        } else {
            return false;
        }
        log.info("search aborted (%s) after %d nodes, %s", abortReason, nodeCount, stopwatch);
        return true;
    }

    private void maybeReportProgress(int depth) {
        Instant now = Instant.now();
        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (nodeCount - lastNodeCount) / Math.max(1, tween.toMillis());
        log.info(() -> new FormattedMessage("%d nodes %d backtracks %s %.0f/sec depth %d/%d",
                nodeCount, backtrackCount, stopwatch, perSec, depth, crossword.variables().size()));
        lastLogTime = now;
        lastNodeCount = nodeCount;
    }
}
