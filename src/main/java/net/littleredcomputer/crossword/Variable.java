// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.base.Preconditions;
import com.google.common.collect.ComparisonChain;

import java.util.Objects;

/**
 * A slot of the grid: a run of cells starting at (i, j) and extending in the given
 * direction for length cells. Variables are values; two slots with the same four
 * coordinates are the same slot.
 */
public final class Variable implements Comparable<Variable> {
    private final int i;
    private final int j;
    private final Direction direction;
    private final int length;

    public Variable(int i, int j, Direction direction, int length) {
        Preconditions.checkArgument(i >= 0 && j >= 0, "negative position %s,%s", i, j);
        Preconditions.checkArgument(length > 0, "length must be positive: %s", length);
        this.i = i;
        this.j = j;
        this.direction = Preconditions.checkNotNull(direction);
        this.length = length;
    }

    public int i() { return i; }
    public int j() { return j; }
    public Direction direction() { return direction; }
    public int length() { return length; }

    /** Row of the k-th cell of this slot. */
    public int row(int k) { return i + k * direction.di(); }

    /** Column of the k-th cell of this slot. */
    public int column(int k) { return j + k * direction.dj(); }

    /**
     * @return the position within this slot of the cell (r, c), or -1 if the slot does not cover it
     */
    int indexOf(int r, int c) {
        int k = direction == Direction.ACROSS ? c - j : r - i;
        if (k < 0 || k >= length) return -1;
        return row(k) == r && column(k) == c ? k : -1;
    }

    // Canonical order: row, column, direction, length.
    @Override
    public int compareTo(Variable o) {
        return ComparisonChain.start()
                .compare(i, o.i)
                .compare(j, o.j)
                .compare(direction, o.direction)
                .compare(length, o.length)
                .result();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Variable)) return false;
        Variable v = (Variable) o;
        return i == v.i && j == v.j && direction == v.direction && length == v.length;
    }

    @Override
    public int hashCode() {
        return Objects.hash(i, j, direction, length);
    }

    @Override
    public String toString() {
        return String.format("(%d, %d) %s : %d", i, j, direction, length);
    }
}
