// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword.csp;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.crossword.Crossword;
import net.littleredcomputer.crossword.Overlap;
import net.littleredcomputer.crossword.Variable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Node consistency and arc consistency (Mackworth's AC-3) for the crossword CSP.
 */
public class ConsistencyEnforcer {
    private static final Logger log = LogManager.getFormatterLogger(ConsistencyEnforcer.class);

    /** The directed constraint "every word of x has a partner in y". */
    public static final class Arc {
        final Variable x;
        final Variable y;

        public Arc(Variable x, Variable y) {
            this.x = x;
            this.y = y;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Arc)) return false;
            Arc a = (Arc) o;
            return x.equals(a.x) && y.equals(a.y);
        }

        @Override
        public int hashCode() {
            return Objects.hash(x, y);
        }

        @Override
        public String toString() {
            return x + " -> " + y;
        }
    }

    private final Crossword crossword;
    private long revisions = 0;

    public ConsistencyEnforcer(Crossword crossword) {
        this.crossword = crossword;
    }

    /** @return number of calls to {@link #revise} which removed at least one word */
    public long revisions() { return revisions; }

    /** Removes from every domain the words whose length differs from the slot's. */
    public void enforceNodeConsistency(DomainStore domains) {
        for (Variable v : crossword.variables()) {
            for (String w : domains.words(v)) {
                if (w.length() != v.length()) domains.remove(v, w);
            }
        }
    }

    /**
     * Makes x arc consistent with y: removes each word of x's domain which has no word in
     * y's domain agreeing with it at the shared cell.
     * @return true if the domain of x changed
     */
    public boolean revise(DomainStore domains, Variable x, Variable y) {
        Optional<Overlap> o = crossword.overlap(x, y);
        if (!o.isPresent()) return false;
        final int ia = o.get().first();
        final int ib = o.get().second();
        // The letters y can still supply at the shared cell.
        BitSet supported = new BitSet();
        for (String w : domains.words(y)) {
            if (ib < w.length()) supported.set(w.charAt(ib));
        }
        boolean revised = false;
        for (String w : domains.words(x)) {
            if (ia >= w.length() || !supported.get(w.charAt(ia))) {
                domains.remove(x, w);
                revised = true;
            }
        }
        if (revised) ++revisions;
        return revised;
    }

    /** @return every arc of the puzzle: (x, y) for each x and each neighbor y of x */
    public ImmutableList<Arc> allArcs() {
        ImmutableList.Builder<Arc> b = ImmutableList.builder();
        for (Variable x : crossword.variables()) {
            for (Variable y : crossword.neighbors(x)) b.add(new Arc(x, y));
        }
        return b.build();
    }

    /** Runs AC-3 starting from every arc of the puzzle. */
    public boolean ac3(DomainStore domains) {
        return ac3(domains, allArcs());
    }

    /**
     * Runs AC-3 from the given initial worklist.
     * @return false if some domain was emptied, in which case the puzzle has no solution
     * under the domains it was given; true otherwise
     */
    public boolean ac3(DomainStore domains, Iterable<Arc> arcs) {
        Deque<Arc> queue = new ArrayDeque<>();
        Set<Arc> queued = new HashSet<>();
        for (Arc a : arcs) {
            if (queued.add(a)) queue.add(a);
        }
        while (!queue.isEmpty()) {
            Arc a = queue.removeFirst();
            queued.remove(a);
            if (!revise(domains, a.x, a.y)) continue;
            if (domains.isEmpty(a.x)) {
                log.debug("domain of %s emptied by %s", a.x, a.y);
                return false;
            }
            for (Variable z : crossword.neighbors(a.x)) {
                if (z.equals(a.y)) continue;
                Arc b = new Arc(z, a.x);
                if (queued.add(b)) queue.addLast(b);
            }
        }
        return true;
    }
}
