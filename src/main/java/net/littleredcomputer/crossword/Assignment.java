// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedMap;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * A partial mapping from slots to words. An assignment is complete when it binds every
 * slot of its crossword, and consistent when each word fits its slot, no word is used
 * twice, and crossing slots agree on their shared letters.
 */
public class Assignment {
    private final TreeMap<Variable, String> words = new TreeMap<>();
    private final Map<String, Integer> uses = new HashMap<>();  // word -> number of slots bound to it

    public Assignment() {}

    private Assignment(Map<Variable, String> m) {
        m.forEach(this::assign);
    }

    public static Assignment copyOf(Assignment a) {
        return new Assignment(a.words);
    }

    /** Binds v to word, replacing any previous binding of v. */
    public void assign(Variable v, String word) {
        Preconditions.checkNotNull(word);
        unassign(v);
        words.put(v, word);
        uses.merge(word, 1, Integer::sum);
    }

    public void unassign(Variable v) {
        String w = words.remove(v);
        if (w != null) uses.computeIfPresent(w, (k, n) -> n > 1 ? n - 1 : null);
    }

    public Optional<String> get(Variable v) { return Optional.ofNullable(words.get(v)); }

    public boolean isAssigned(Variable v) { return words.containsKey(v); }

    public int size() { return words.size(); }

    /** @return true if the word is bound to some slot other than v */
    public boolean isUsedElsewhere(String word, Variable v) {
        int n = uses.getOrDefault(word, 0);
        return word.equals(words.get(v)) ? n > 1 : n > 0;
    }

    /** @return true if every slot of c is bound */
    public boolean isComplete(Crossword c) {
        return c.variables().stream().allMatch(words::containsKey);
    }

    /** Checks the three validity rules over the bound slots. */
    public boolean isConsistent(Crossword c) {
        for (Map.Entry<Variable, String> e : words.entrySet()) {
            if (e.getValue().length() != e.getKey().length()) return false;
        }
        if (uses.size() != words.size()) return false;
        for (Map.Entry<Variable, String> e : words.entrySet()) {
            Variable x = e.getKey();
            for (Variable y : c.neighbors(x)) {
                String wy = words.get(y);
                if (wy == null || x.compareTo(y) > 0) continue;
                if (!c.overlap(x, y).map(o -> o.agrees(e.getValue(), wy)).orElse(true)) return false;
            }
        }
        return true;
    }

    /** @return the bindings, in canonical slot order */
    public ImmutableSortedMap<Variable, String> asMap() { return ImmutableSortedMap.copyOfSorted(words); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Assignment)) return false;
        return words.equals(((Assignment) o).words);
    }

    @Override
    public int hashCode() {
        return Objects.hash(words);
    }

    @Override
    public String toString() {
        return words.toString();
    }
}
