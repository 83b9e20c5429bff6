// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword.csp;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.littleredcomputer.crossword.Crossword;
import net.littleredcomputer.crossword.TestPuzzles;
import net.littleredcomputer.crossword.Variable;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static net.littleredcomputer.crossword.TestPuzzles.across;
import static net.littleredcomputer.crossword.TestPuzzles.down;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.Assert.assertThat;

public class ConsistencyEnforcerTest {

    private static DomainStore nodeConsistent(Crossword c, Iterable<String> words) {
        DomainStore s = new DomainStore(c, words);
        new ConsistencyEnforcer(c).enforceNodeConsistency(s);
        return s;
    }

    @Test
    public void nodeConsistencyFiltersByLength() {
        DomainStore s = nodeConsistent(TestPuzzles.structure0, TestPuzzles.words0);
        assertThat(s.words(across(0, 1, 3)), is(ImmutableList.of("ONE", "SIX", "TEN", "TWO")));
        assertThat(s.words(down(0, 1, 5)), is(ImmutableList.of("EIGHT", "SEVEN", "THREE")));
        assertThat(s.words(down(1, 4, 4)), is(ImmutableList.of("FIVE", "FOUR", "NINE")));
    }

    @Test
    public void nodeConsistencyIsIdempotent() {
        Crossword c = TestPuzzles.structure1;
        ConsistencyEnforcer e = new ConsistencyEnforcer(c);
        DomainStore s = new DomainStore(c, TestPuzzles.words1);
        e.enforceNodeConsistency(s);
        ImmutableMap<Variable, ImmutableList<String>> once = s.snapshot();
        int mark = s.mark();
        e.enforceNodeConsistency(s);
        assertThat(s.snapshot(), is(once));
        assertThat(s.mark(), is(mark));
    }

    @Test
    public void nodeConsistencyMayEmptyADomain() {
        DomainStore s = nodeConsistent(Crossword.parseFrom("_____"), Arrays.asList("CAT", "BIRD"));
        assertThat(s.isEmpty(across(0, 0, 5)), is(true));
    }

    @Test
    public void revise() {
        Crossword c = Crossword.parseFrom(TestPuzzles.cross);
        ConsistencyEnforcer e = new ConsistencyEnforcer(c);
        DomainStore s = nodeConsistent(c, Arrays.asList("CAT", "DOG", "EMU"));
        Variable a = across(1, 0, 3);
        Variable d = down(0, 1, 3);
        s.remove(d, "DOG");
        // Middle letters left in d: A (CAT), M (EMU). DOG has no partner.
        assertThat(e.revise(s, a, d), is(true));
        assertThat(s.words(a), is(ImmutableList.of("CAT", "EMU")));
        assertThat(e.revise(s, a, d), is(false));
        assertThat(e.revisions(), is(1L));
    }

    @Test
    public void reviseWithoutOverlapIsANoOp() {
        Crossword c = Crossword.parseFrom(TestPuzzles.parallel);
        DomainStore s = nodeConsistent(c, Arrays.asList("CAT", "DOG"));
        s.remove(across(2, 0, 3), "CAT");
        s.remove(across(2, 0, 3), "DOG");
        assertThat(new ConsistencyEnforcer(c).revise(s, across(0, 0, 3), across(2, 0, 3)), is(false));
        assertThat(s.size(across(0, 0, 3)), is(2));
    }

    @Test
    public void ac3OnStructure0() {
        Crossword c = TestPuzzles.structure0;
        DomainStore s = nodeConsistent(c, TestPuzzles.words0);
        assertThat(new ConsistencyEnforcer(c).ac3(s), is(true));
        assertThat(s.snapshot(), is(ImmutableMap.of(
                across(0, 1, 3), ImmutableList.of("SIX"),
                down(0, 1, 5), ImmutableList.of("SEVEN"),
                down(1, 4, 4), ImmutableList.of("FIVE", "NINE"),
                across(4, 1, 4), ImmutableList.of("NINE"))));
    }

    @Test
    public void ac3OnlyShrinksAndIsIdempotent() {
        Crossword c = TestPuzzles.structure1;
        ConsistencyEnforcer e = new ConsistencyEnforcer(c);
        DomainStore s = nodeConsistent(c, TestPuzzles.words1);
        ImmutableMap<Variable, ImmutableList<String>> before = s.snapshot();
        assertThat(e.ac3(s), is(true));
        ImmutableMap<Variable, ImmutableList<String>> after = s.snapshot();
        for (Variable v : c.variables()) {
            assertThat(after.get(v).size(), lessThanOrEqualTo(before.get(v).size()));
            assertThat(before.get(v).containsAll(after.get(v)), is(true));
        }
        assertThat(e.ac3(s), is(true));
        assertThat(s.snapshot(), is(after));
    }

    @Test
    public void ac3DetectsInconsistency() {
        // The across word's first letter must be the down word's middle one.
        Crossword c = Crossword.parseFrom(TestPuzzles.offsetCross);
        DomainStore s = nodeConsistent(c, Arrays.asList("CAT", "DOG"));
        assertThat(new ConsistencyEnforcer(c).ac3(s), is(false));
    }

    @Test
    public void ac3FromEmptyWorklistChangesNothing() {
        Crossword c = Crossword.parseFrom(TestPuzzles.offsetCross);
        DomainStore s = nodeConsistent(c, Arrays.asList("CAT", "DOG"));
        ImmutableMap<Variable, ImmutableList<String>> before = s.snapshot();
        assertThat(new ConsistencyEnforcer(c).ac3(s, Collections.emptyList()), is(true));
        assertThat(s.snapshot(), is(before));
    }

    @Test
    public void allArcs() {
        assertThat(new ConsistencyEnforcer(TestPuzzles.structure0).allArcs().size(), is(6));
    }
}
