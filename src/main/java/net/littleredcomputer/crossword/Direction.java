// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

public enum Direction {
    ACROSS(0, 1),
    DOWN(1, 0);

    private final int di;
    private final int dj;

    Direction(int di, int dj) {
        this.di = di;
        this.dj = dj;
    }

    /** Row step taken from one cell of a slot to the next. */
    int di() { return di; }

    /** Column step taken from one cell of a slot to the next. */
    int dj() { return dj; }
}
