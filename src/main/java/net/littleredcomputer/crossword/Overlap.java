// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import java.util.Objects;

/**
 * The shared cell of two crossing slots: the character at {@code first} of the first
 * slot's word must equal the character at {@code second} of the second slot's word.
 */
public final class Overlap {
    private final int first;
    private final int second;

    Overlap(int first, int second) {
        this.first = first;
        this.second = second;
    }

    public int first() { return first; }
    public int second() { return second; }

    /** The same shared cell seen from the other slot. */
    Overlap swap() { return new Overlap(second, first); }

    /** @return true if the two words agree at the shared cell */
    public boolean agrees(String a, String b) {
        return a.charAt(first) == b.charAt(second);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Overlap)) return false;
        Overlap that = (Overlap) o;
        return first == that.first && second == that.second;
    }

    @Override
    public int hashCode() {
        return Objects.hash(first, second);
    }

    @Override
    public String toString() {
        return "(" + first + ", " + second + ")";
    }
}
