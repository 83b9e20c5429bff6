// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableSortedSet;
import net.littleredcomputer.crossword.csp.CrosswordSolver;
import net.littleredcomputer.crossword.csp.SearchLimits;
import net.littleredcomputer.crossword.csp.SolveResult;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * {@code generate [options] structure words [output]}: fills the grid described by the
 * structure file with words from the word file, prints it, and if an output file is
 * named also saves it as a PNG image.
 */
public class Main {
    private static final Logger log = LogManager.getFormatterLogger(Main.class);
    private static final String usage = "generate [options] structure words [output]";

    static final int OK = 0;
    static final int ERROR = 1;
    static final int ABORTED = 2;

    private static Options options() {
        return new Options()
                .addOption("nodes", true, "give up after this many search nodes")
                .addOption("timeout", true, "give up after this long, in ISO-8601 format (e.g. PT30S)")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format")
                .addOption("nomac", false, "do not maintain arc consistency during search");
    }

    private static Duration duration(CommandLine cmd, String option, String defaultValue) {
        String v = cmd.getOptionValue(option, defaultValue);
        if (v == null) return null;
        try {
            return Duration.parse(v);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("invalid duration for -" + option + ": " + v, e);
        }
    }

    private static SearchLimits limits(CommandLine cmd) {
        SearchLimits l = SearchLimits.unbounded().withTimeout(duration(cmd, "timeout", null));
        if (cmd.hasOption("nodes")) {
            String n = cmd.getOptionValue("nodes");
            try {
                l = l.withNodeBudget(Long.parseLong(n));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid node budget: " + n, e);
            }
        }
        return l;
    }

    private static Reader open(String file) throws IOException {
        return Files.newBufferedReader(Paths.get(file), StandardCharsets.UTF_8);
    }

    /**
     * @return the process exit status: {@link #OK} when a solution was printed or the
     * puzzle was shown to have none, {@link #ABORTED} when a limit stopped the search, and
     * {@link #ERROR} for bad arguments or input
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        try {
            CommandLine cmd = new DefaultParser().parse(options(), args);
            List<String> files = cmd.getArgList();
            if (files.size() < 2 || files.size() > 3) {
                new HelpFormatter().printHelp(new PrintWriter(err, true), HelpFormatter.DEFAULT_WIDTH, usage,
                        null, options(), HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
                return ERROR;
            }
            Crossword crossword;
            try (Reader r = open(files.get(0))) {
                crossword = Crossword.parseFrom(r);
            }
            ImmutableSortedSet<String> words;
            try (Reader r = open(files.get(1))) {
                words = Vocabulary.parseFrom(r);
            }
            SolveResult result = new CrosswordSolver(crossword, words)
                    .setLimits(limits(cmd))
                    .setLogInterval(duration(cmd, "loginterval", "PT1S"))
                    .setMaintainArcConsistency(!cmd.hasOption("nomac"))
                    .run();
            if (result.outcome() == SolveResult.Outcome.ABORTED) {
                out.println("Search aborted.");
                return ABORTED;
            }
            if (!result.isSolved()) {
                out.println("No solution.");
                return OK;
            }
            Assignment solution = result.solution().get();
            out.print(Renderer.toText(crossword, solution));
            if (files.size() == 3) {
                Path output = Paths.get(files.get(2));
                Renderer.savePng(crossword, solution, output);
                log.info("saved %s", output);
            }
            return OK;
        } catch (ParseException | IllegalArgumentException | IOException | UncheckedIOException e) {
            log.error("%s", e.getMessage());
            err.println("generate: " + e.getMessage());
            return ERROR;
        }
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }
}
