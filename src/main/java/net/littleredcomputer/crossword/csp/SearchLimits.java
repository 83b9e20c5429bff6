// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword.csp;

import com.google.common.base.Preconditions;

import java.time.Duration;
import java.util.Optional;

/**
 * Bounds on the work a search may do before it gives up. A search stopped by a limit is
 * reported as aborted, never as unsolvable.
 */
public final class SearchLimits {
    private static final SearchLimits UNBOUNDED = new SearchLimits(0, null);

    private final long maxNodes;  // 0 means unbounded
    private final Duration timeout;  // null means unbounded

    private SearchLimits(long maxNodes, Duration timeout) {
        this.maxNodes = maxNodes;
        this.timeout = timeout;
    }

    public static SearchLimits unbounded() { return UNBOUNDED; }

    /** @param maxNodes the number of branch steps allowed; 0 removes the bound */
    public SearchLimits withNodeBudget(long maxNodes) {
        Preconditions.checkArgument(maxNodes >= 0, "node budget must not be negative: %s", maxNodes);
        return new SearchLimits(maxNodes, timeout);
    }

    /** @param timeout wall-clock time allowed for the search; null removes the bound */
    public SearchLimits withTimeout(Duration timeout) {
        Preconditions.checkArgument(timeout == null || !timeout.isNegative(), "negative timeout %s", timeout);
        return new SearchLimits(maxNodes, timeout);
    }

    public Optional<Long> nodeBudget() { return maxNodes > 0 ? Optional.of(maxNodes) : Optional.empty(); }

    public Optional<Duration> timeout() { return Optional.ofNullable(timeout); }

    boolean nodesExceeded(long nodes) { return maxNodes > 0 && nodes > maxNodes; }

    boolean timeExceeded(Duration elapsed) { return timeout != null && elapsed.compareTo(timeout) > 0; }

    @Override
    public String toString() {
        return String.format("nodes=%s timeout=%s", maxNodes > 0 ? maxNodes : "∞", timeout != null ? timeout : "∞");
    }
}
