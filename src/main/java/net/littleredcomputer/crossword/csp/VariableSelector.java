// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword.csp;

import net.littleredcomputer.crossword.Assignment;
import net.littleredcomputer.crossword.Crossword;
import net.littleredcomputer.crossword.Variable;

/**
 * Chooses the slot to branch on: fewest remaining values first, then the slot crossing
 * the most others, then the earliest slot in canonical order.
 */
public class VariableSelector {
    private final Crossword crossword;

    public VariableSelector(Crossword crossword) {
        this.crossword = crossword;
    }

    public Variable select(Assignment assignment, DomainStore domains) {
        Variable best = null;
        int bestSize = Integer.MAX_VALUE;
        int bestDegree = -1;
        // variables() is in canonical order, so strict comparisons keep the earliest of any tie.
        for (Variable v : crossword.variables()) {
            if (assignment.isAssigned(v)) continue;
            int size = domains.size(v);
            int degree = crossword.degree(v);
            if (size < bestSize || (size == bestSize && degree > bestDegree)) {
                best = v;
                bestSize = size;
                bestDegree = degree;
            }
        }
        if (best == null) throw new IllegalStateException("no unassigned variable remains");
        return best;
    }
}
