// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword.csp;

import net.littleredcomputer.crossword.Assignment;
import net.littleredcomputer.crossword.Crossword;
import net.littleredcomputer.crossword.TestPuzzles;
import org.junit.Test;

import java.util.Arrays;

import static net.littleredcomputer.crossword.TestPuzzles.across;
import static net.littleredcomputer.crossword.TestPuzzles.down;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class VariableSelectorTest {
    @Test
    public void fewestValuesThenMostNeighbors() {
        Crossword c = TestPuzzles.structure0;
        DomainStore s = new DomainStore(c, TestPuzzles.words0);
        new ConsistencyEnforcer(c).enforceNodeConsistency(s);
        VariableSelector selector = new VariableSelector(c);
        // Three slots have three words each; two of those cross two others.
        Assignment a = new Assignment();
        assertThat(selector.select(a, s), is(down(0, 1, 5)));
        a.assign(down(0, 1, 5), "SEVEN");
        assertThat(selector.select(a, s), is(across(4, 1, 4)));
        a.assign(across(4, 1, 4), "NINE");
        assertThat(selector.select(a, s), is(down(1, 4, 4)));
        a.assign(down(1, 4, 4), "FIVE");
        assertThat(selector.select(a, s), is(across(0, 1, 3)));
    }

    @Test
    public void smallestDomainWins() {
        Crossword c = TestPuzzles.structure0;
        DomainStore s = new DomainStore(c, TestPuzzles.words0);
        new ConsistencyEnforcer(c).enforceNodeConsistency(s);
        s.remove(across(0, 1, 3), "ONE");
        s.remove(across(0, 1, 3), "TWO");
        assertThat(new VariableSelector(c).select(new Assignment(), s), is(across(0, 1, 3)));
    }

    @Test
    public void canonicalOrderBreaksRemainingTies() {
        Crossword c = Crossword.parseFrom(TestPuzzles.parallel);
        DomainStore s = new DomainStore(c, Arrays.asList("CAT", "DOG"));
        assertThat(new VariableSelector(c).select(new Assignment(), s), is(across(0, 0, 3)));
    }

    @Test(expected = IllegalStateException.class)
    public void nothingLeftToSelect() {
        Crossword c = Crossword.parseFrom("___");
        Assignment a = new Assignment();
        a.assign(across(0, 0, 3), "CAT");
        new VariableSelector(c).select(a, new DomainStore(c, Arrays.asList("CAT")));
    }
}
