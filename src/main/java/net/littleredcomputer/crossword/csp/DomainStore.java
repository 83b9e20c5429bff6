// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword.csp;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import gnu.trove.list.array.TIntArrayList;
import net.littleredcomputer.crossword.Crossword;
import net.littleredcomputer.crossword.Variable;

import java.util.BitSet;

/**
 * The candidate words of every slot. Each domain starts as the whole vocabulary and can
 * only shrink. Every removal is recorded on a trail, so that a search branch can note
 * {@link #mark()} before it prunes and later {@link #rollback(int)} to restore the store
 * exactly as it was.
 */
public class DomainStore {
    private final Crossword crossword;
    private final ImmutableList<String> words;  // word number to word, in sorted order
    private final ImmutableMap<String, Integer> wordIndex;  // inverse of above
    private final BitSet[] live;  // live[v] has bit w set iff word w is in the domain of variable v
    private final int[] size;
    // Parallel stacks: the k-th removal took word trailWord[k] from variable trailVariable[k].
    private final TIntArrayList trailVariable = new TIntArrayList();
    private final TIntArrayList trailWord = new TIntArrayList();

    public DomainStore(Crossword crossword, Iterable<String> vocabulary) {
        this.crossword = Preconditions.checkNotNull(crossword);
        words = ImmutableSortedSet.copyOf(vocabulary).asList();
        ImmutableMap.Builder<String, Integer> b = ImmutableMap.builder();
        for (int w = 0; w < words.size(); ++w) b.put(words.get(w), w);
        wordIndex = b.build();
        final int n = crossword.variables().size();
        live = new BitSet[n];
        size = new int[n];
        for (int v = 0; v < n; ++v) {
            live[v] = new BitSet(words.size());
            live[v].set(0, words.size());
            size[v] = words.size();
        }
    }

    public Crossword crossword() { return crossword; }

    public int size(Variable v) { return size[crossword.indexOf(v)]; }

    public boolean isEmpty(Variable v) { return size(v) == 0; }

    public boolean contains(Variable v, String word) {
        Integer w = wordIndex.get(word);
        return w != null && live[crossword.indexOf(v)].get(w);
    }

    /** @return the current domain of v, in vocabulary order */
    public ImmutableList<String> words(Variable v) {
        BitSet b = live[crossword.indexOf(v)];
        ImmutableList.Builder<String> r = ImmutableList.builderWithExpectedSize(b.cardinality());
        for (int w = b.nextSetBit(0); w >= 0; w = b.nextSetBit(w + 1)) r.add(words.get(w));
        return r.build();
    }

    /**
     * Removes word from the domain of v.
     * @return true if the word was present
     */
    public boolean remove(Variable v, String word) {
        Integer w = wordIndex.get(word);
        if (w == null) return false;
        int vi = crossword.indexOf(v);
        if (!live[vi].get(w)) return false;
        live[vi].clear(w);
        --size[vi];
        trailVariable.add(vi);
        trailWord.add(w);
        return true;
    }

    /**
     * Narrows the domain of v to the single given word (which need not be present).
     * @return the number of words removed
     */
    public int retainOnly(Variable v, String word) {
        int removed = 0;
        for (String w : words(v)) {
            if (!w.equals(word) && remove(v, w)) ++removed;
        }
        return removed;
    }

    /** @return a position on the trail to which {@link #rollback(int)} can later return */
    public int mark() { return trailVariable.size(); }

    /** Restores, most recent first, every word removed since the given mark. */
    public void rollback(int mark) {
        Preconditions.checkArgument(mark >= 0 && mark <= trailVariable.size(), "bad trail mark %s", mark);
        for (int k = trailVariable.size() - 1; k >= mark; --k) {
            int vi = trailVariable.get(k);
            live[vi].set(trailWord.get(k));
            ++size[vi];
        }
        if (mark == trailVariable.size()) return;
        trailVariable.remove(mark, trailVariable.size() - mark);
        trailWord.remove(mark, trailWord.size() - mark);
    }

    /** @return an immutable copy of every domain, for comparison and reporting */
    public ImmutableMap<Variable, ImmutableList<String>> snapshot() {
        ImmutableMap.Builder<Variable, ImmutableList<String>> b = ImmutableMap.builder();
        for (Variable v : crossword.variables()) b.put(v, words(v));
        return b.build();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Variable v : crossword.variables()) sb.append(v).append(": ").append(size(v)).append('\n');
        return sb.toString();
    }
}
