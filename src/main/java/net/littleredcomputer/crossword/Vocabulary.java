// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableSortedSet;

import java.io.BufferedReader;
import java.io.Reader;
import java.io.StringReader;
import java.util.Comparator;

/**
 * Reads word lists. Words are upper-cased and trimmed, blank lines skipped and duplicates
 * dropped; the result is sorted so that every domain built from it iterates in the same order.
 */
public final class Vocabulary {
    private Vocabulary() {}

    public static ImmutableSortedSet<String> parseFrom(String words) {
        return parseFrom(new StringReader(words));
    }

    public static ImmutableSortedSet<String> parseFrom(Reader r) {
        return new BufferedReader(r).lines()
                .map(CharMatcher.whitespace()::trimFrom)
                .filter(w -> !w.isEmpty())
                .map(w -> Ascii.toUpperCase(w))
                .collect(ImmutableSortedSet.toImmutableSortedSet(Comparator.naturalOrder()));
    }

    /** Normalizes words supplied programmatically the same way a word file is read. */
    public static ImmutableSortedSet<String> of(Iterable<String> words) {
        ImmutableSortedSet.Builder<String> b = ImmutableSortedSet.naturalOrder();
        for (String w : words) {
            String t = CharMatcher.whitespace().trimFrom(w);
            if (!t.isEmpty()) b.add(Ascii.toUpperCase(t));
        }
        return b.build();
    }
}
