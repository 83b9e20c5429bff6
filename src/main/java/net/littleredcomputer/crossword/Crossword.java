// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.ImmutableTable;

import java.io.BufferedReader;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The fixed geometry of a crossword: which cells may hold letters, the slots (variables)
 * formed by maximal runs of such cells, and the cells where an across slot and a down
 * slot cross. Instances are immutable.
 */
public class Crossword {
    static final char OPEN = '_';

    private final int height;
    private final int width;
    private final boolean[][] structure;
    private final ImmutableList<Variable> variables;  // in canonical order
    private final ImmutableMap<Variable, Integer> variableIndex;  // inverse of above
    // Keyed by (a, b) with a < b only; see overlap().
    private final ImmutableTable<Variable, Variable, Overlap> overlaps;
    private final ImmutableSetMultimap<Variable, Variable> neighbors;

    private Crossword(boolean[][] structure) {
        this.structure = structure;
        height = structure.length;
        width = structure[0].length;

        List<Variable> vs = new ArrayList<>();
        for (int i = 0; i < height; ++i) {
            for (int j = 0; j < width; ++j) {
                if (!structure[i][j]) continue;
                if (j == 0 || !structure[i][j - 1]) {
                    int k = 1;
                    while (j + k < width && structure[i][j + k]) ++k;
                    if (k > 1) vs.add(new Variable(i, j, Direction.ACROSS, k));
                }
                if (i == 0 || !structure[i - 1][j]) {
                    int k = 1;
                    while (i + k < height && structure[i + k][j]) ++k;
                    if (k > 1) vs.add(new Variable(i, j, Direction.DOWN, k));
                }
            }
        }
        variables = ImmutableList.sortedCopyOf(vs);
        ImmutableMap.Builder<Variable, Integer> ib = ImmutableMap.builder();
        for (int k = 0; k < variables.size(); ++k) ib.put(variables.get(k), k);
        variableIndex = ib.build();

        ImmutableTable.Builder<Variable, Variable, Overlap> ob = ImmutableTable.builder();
        ImmutableSetMultimap.Builder<Variable, Variable> nb = ImmutableSetMultimap.builder();
        for (int a = 0; a < variables.size(); ++a) {
            for (int b = a + 1; b < variables.size(); ++b) {
                Variable v1 = variables.get(a);
                Variable v2 = variables.get(b);
                if (v1.direction() == v2.direction()) continue;
                Variable across = v1.direction() == Direction.ACROSS ? v1 : v2;
                Variable down = across == v1 ? v2 : v1;
                // The only candidate cell is the across slot's row and the down slot's column.
                int r = across.i();
                int c = down.j();
                int ka = across.indexOf(r, c);
                int kd = down.indexOf(r, c);
                if (ka < 0 || kd < 0) continue;
                ob.put(v1, v2, v1 == across ? new Overlap(ka, kd) : new Overlap(kd, ka));
                nb.put(v1, v2);
                nb.put(v2, v1);
            }
        }
        overlaps = ob.build();
        neighbors = nb.build();
    }

    public int height() { return height; }
    public int width() { return width; }

    /** @return true if cell (i, j) may hold a letter */
    public boolean isOpen(int i, int j) { return structure[i][j]; }

    /** @return all slots of the puzzle, in canonical order */
    public ImmutableList<Variable> variables() { return variables; }

    /** @return position of v within {@link #variables()} */
    public int indexOf(Variable v) {
        Integer k = variableIndex.get(v);
        if (k == null) throw new IllegalArgumentException("not a variable of this crossword: " + v);
        return k;
    }

    public boolean contains(Variable v) { return variableIndex.containsKey(v); }

    /**
     * @return the shared cell of x and y, with {@link Overlap#first()} indexing x's word, or
     * empty if the slots do not cross
     */
    public Optional<Overlap> overlap(Variable x, Variable y) {
        if (x.compareTo(y) < 0) return Optional.ofNullable(overlaps.get(x, y));
        Overlap o = overlaps.get(y, x);
        return o == null ? Optional.empty() : Optional.of(o.swap());
    }

    /** @return the slots crossing v */
    public ImmutableSet<Variable> neighbors(Variable v) { return neighbors.get(v); }

    public int degree(Variable v) { return neighbors.get(v).size(); }

    /** @return number of crossing pairs, each counted once */
    public int overlapCount() { return overlaps.size(); }

    public static Crossword parseFrom(String structure) {
        return parseFrom(new StringReader(structure));
    }

    /**
     * Parses a grid structure: one line per row, with '_' marking a cell which can hold a
     * letter and any other character a blocked cell. Trailing blank lines are ignored.
     * @param r source of the structure
     * @return the crossword
     * @throws IllegalArgumentException if the grid is empty, ragged, or has no open cell
     */
    public static Crossword parseFrom(Reader r) {
        List<String> rows = new BufferedReader(r).lines()
                .map(Crossword::stripCarriageReturn)
                .collect(Collectors.toList());
        while (!rows.isEmpty() && rows.get(rows.size() - 1).trim().isEmpty()) rows.remove(rows.size() - 1);
        if (rows.isEmpty()) throw new IllegalArgumentException("empty structure");
        int w = rows.get(0).length();
        if (w == 0) throw new IllegalArgumentException("structure row 0 is empty");
        boolean[][] s = new boolean[rows.size()][w];
        boolean anyOpen = false;
        for (int i = 0; i < rows.size(); ++i) {
            String row = rows.get(i);
            if (row.length() != w) {
                throw new IllegalArgumentException(String.format(
                        "structure is not rectangular: row %d has width %d, expected %d", i, row.length(), w));
            }
            for (int j = 0; j < w; ++j) {
                s[i][j] = row.charAt(j) == OPEN;
                anyOpen |= s[i][j];
            }
        }
        if (!anyOpen) throw new IllegalArgumentException("structure has no open cells");
        return new Crossword(s);
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
