// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import org.junit.Test;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresentAndIs;
import static net.littleredcomputer.crossword.TestPuzzles.across;
import static net.littleredcomputer.crossword.TestPuzzles.down;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class AssignmentTest {
    private final Crossword cross = Crossword.parseFrom(TestPuzzles.cross);
    private final Variable a = across(1, 0, 3);
    private final Variable d = down(0, 1, 3);

    @Test
    public void emptyIsConsistentButIncomplete() {
        Assignment x = new Assignment();
        assertThat(x.isConsistent(cross), is(true));
        assertThat(x.isComplete(cross), is(false));
        assertThat(x.get(a), isEmpty());
    }

    @Test
    public void agreeingCrossing() {
        Assignment x = new Assignment();
        x.assign(a, "CAT");
        x.assign(d, "CAR");
        assertThat(x.isConsistent(cross), is(true));
        assertThat(x.isComplete(cross), is(true));
        assertThat(x.get(d), isPresentAndIs("CAR"));
    }

    @Test
    public void disagreeingCrossing() {
        Assignment x = new Assignment();
        x.assign(a, "CAT");
        x.assign(d, "DOG");
        assertThat(x.isConsistent(cross), is(false));
    }

    @Test
    public void wrongLength() {
        Assignment x = new Assignment();
        x.assign(a, "CATS");
        assertThat(x.isConsistent(cross), is(false));
    }

    @Test
    public void repeatedWord() {
        Crossword parallel = Crossword.parseFrom(TestPuzzles.parallel);
        Assignment x = new Assignment();
        x.assign(across(0, 0, 3), "CAT");
        x.assign(across(2, 0, 3), "CAT");
        assertThat(x.isConsistent(parallel), is(false));
        assertThat(x.isUsedElsewhere("CAT", across(0, 0, 3)), is(true));
        x.unassign(across(2, 0, 3));
        assertThat(x.isConsistent(parallel), is(true));
        assertThat(x.isUsedElsewhere("CAT", across(0, 0, 3)), is(false));
        assertThat(x.isUsedElsewhere("CAT", across(2, 0, 3)), is(true));
    }

    @Test
    public void reassignReleasesTheOldWord() {
        Assignment x = new Assignment();
        x.assign(a, "CAT");
        x.assign(a, "DOG");
        assertThat(x.size(), is(1));
        assertThat(x.isUsedElsewhere("CAT", d), is(false));
        assertThat(x.isUsedElsewhere("DOG", d), is(true));
    }

    @Test
    public void copyIsIndependent() {
        Assignment x = new Assignment();
        x.assign(a, "CAT");
        Assignment y = Assignment.copyOf(x);
        x.unassign(a);
        assertThat(y.get(a), isPresentAndIs("CAT"));
        assertThat(y.equals(x), is(false));
    }
}
