// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword.csp;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Multiset;
import net.littleredcomputer.crossword.Assignment;
import net.littleredcomputer.crossword.Crossword;
import net.littleredcomputer.crossword.Overlap;
import net.littleredcomputer.crossword.Variable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders the values of a slot least-constraining first: a word's cost is the number of
 * words it would rule out across the unassigned slots crossing it. The ordering only
 * affects how quickly a solution is found, never whether one is.
 */
public class ValueOrderer {
    private final Crossword crossword;

    public ValueOrderer(Crossword crossword) {
        this.crossword = crossword;
    }

    private static class Scored {
        final String word;
        final int cost;

        Scored(String word, int cost) {
            this.word = word;
            this.cost = cost;
        }
    }

    /** For one crossing slot: how many of its words carry each letter at the shared cell. */
    private static class Tally {
        final int ia;
        final int total;
        final Multiset<Character> letters = HashMultiset.create();

        Tally(int ia, int ib, List<String> words) {
            this.ia = ia;
            this.total = words.size();
            for (String w : words) {
                if (ib < w.length()) letters.add(w.charAt(ib));
            }
        }

        int ruledOutBy(String word) {
            return ia < word.length() ? total - letters.count(word.charAt(ia)) : total;
        }
    }

    /**
     * @return the domain of v ordered by ascending number of neighbor values ruled out;
     * words of equal cost keep their domain order
     */
    public ImmutableList<String> order(Variable v, Assignment assignment, DomainStore domains) {
        List<Tally> tallies = new ArrayList<>();
        for (Variable n : crossword.neighbors(v)) {
            if (assignment.isAssigned(n)) continue;
            Overlap o = crossword.overlap(v, n).orElseThrow(IllegalStateException::new);
            tallies.add(new Tally(o.first(), o.second(), domains.words(n)));
        }
        List<Scored> scored = new ArrayList<>();
        for (String w : domains.words(v)) {
            int cost = 0;
            for (Tally t : tallies) cost += t.ruledOutBy(w);
            scored.add(new Scored(w, cost));
        }
        // List.sort is stable.
        scored.sort(Comparator.comparingInt(s -> s.cost));
        return scored.stream().map(s -> s.word).collect(ImmutableList.toImmutableList());
    }
}
