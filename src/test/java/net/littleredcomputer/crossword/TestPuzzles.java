// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableSortedSet;

import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

public class TestPuzzles {
    // Two crossing three-letter slots sharing their middle cell.
    public static final String cross = "#_#\n___\n#_#\n";
    // The down slot's middle cell is the across slot's first.
    public static final String offsetCross = "#_##\n#___\n#_##\n";
    // Two three-letter slots which do not touch.
    public static final String parallel = "___\n###\n___\n";

    public static final Crossword structure0 = crosswordFromResource("structure0.txt");
    public static final ImmutableSortedSet<String> words0 = wordsFromResource("words0.txt");
    public static final Crossword structure1 = crosswordFromResource("structure1.txt");
    public static final ImmutableSortedSet<String> words1 = wordsFromResource("words1.txt");

    public static Crossword crosswordFromResource(String name) {
        return Crossword.parseFrom(new InputStreamReader(
                TestPuzzles.class.getClassLoader().getResourceAsStream(name), StandardCharsets.UTF_8));
    }

    public static ImmutableSortedSet<String> wordsFromResource(String name) {
        return Vocabulary.parseFrom(new InputStreamReader(
                TestPuzzles.class.getClassLoader().getResourceAsStream(name), StandardCharsets.UTF_8));
    }

    public static Variable across(int i, int j, int length) {
        return new Variable(i, j, Direction.ACROSS, length);
    }

    public static Variable down(int i, int j, int length) {
        return new Variable(i, j, Direction.DOWN, length);
    }
}
