package com.roget;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.roget.algorithms.Naive;
import com.roget.dictionary.Dictionary;
import com.roget.dictionary.DictionaryException;
import com.roget.game.Correctness;
import com.roget.game.InvalidGuessException;
import com.roget.game.Wordle;
import com.roget.simulation.GameResult;
import com.roget.simulation.GameRunner;
import com.roget.simulation.RunSummary;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Roget CLI - Main entry point.
 */
@Command(name = "roget",
        mixinStandardHelpOptions = true,
        version = "1.0",
        description = "Wordle game simulator",
        subcommands = {
                Main.PlayCommand.class,
                Main.ScoreCommand.class
        })
public class Main implements Runnable {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        // Show help if no subcommand
        CommandLine.usage(this, System.out);
    }

    // ========== PLAY COMMAND ==========
    @Command(name = "play", description = "Play one game per answer with the naive guesser")
    static class PlayCommand implements Callable<Integer> {
        @Option(names = {"-d", "--dictionary"},
                description = "Path to dictionary file (default: bundled word list)")
        String dictionaryPath;

        @Option(names = {"-a", "--answers"},
                description = "Path to answers file (default: bundled answers)")
        String answersPath;

        @Option(names = {"-m", "--max-turns"}, defaultValue = "" + Wordle.DEFAULT_MAX_TURNS,
                description = "Turn limit per game (default: ${DEFAULT-VALUE})")
        int maxTurns;

        @Option(names = {"-n", "--games"},
                description = "Only play the first N answers")
        Integer games;

        @Option(names = {"-p", "--parallel"},
                description = "Play games in parallel")
        boolean parallel;

        @Option(names = {"-v", "--verbose"},
                description = "Verbose output (single game trace)")
        boolean verbose;

        @Option(names = {"--json"},
                description = "Print results as JSON")
        boolean json;

        @Override
        public Integer call() throws Exception {
            Dictionary dictionary;
            try {
                dictionary = dictionaryPath == null ? Dictionary.load() : Dictionary.fromFile(dictionaryPath);
                System.err.println("✓ Loaded " + dictionary.size() + " words from "
                        + (dictionaryPath == null ? Dictionary.DEFAULT_RESOURCE : dictionaryPath));
            } catch (DictionaryException e) {
                System.err.println("✗ Failed to load dictionary: " + e.getMessage());
                return 1;
            }

            List<String> answers;
            try {
                answers = answersPath == null
                        ? GameRunner.loadAnswersFromResource(GameRunner.DEFAULT_ANSWERS)
                        : GameRunner.loadAnswers(answersPath);
            } catch (IOException e) {
                System.err.println("✗ Failed to load answers: " + e.getMessage());
                return 1;
            }
            if (games != null && games < answers.size()) {
                answers = answers.subList(0, Math.max(games, 0));
            }

            Wordle wordle;
            try {
                wordle = new Wordle(dictionary, maxTurns);
            } catch (IllegalArgumentException e) {
                System.err.println("✗ " + e.getMessage());
                return 1;
            }

            long startTime = System.currentTimeMillis();
            List<GameResult> results;
            try {
                results = parallel && !verbose
                        ? GameRunner.runParallel(wordle, answers, () -> new Naive(dictionary))
                        : GameRunner.run(wordle, answers, () -> new Naive(dictionary), verbose);
            } catch (InvalidGuessException | IllegalArgumentException e) {
                System.err.println("✗ Game aborted: " + e.getMessage());
                return 1;
            }
            long elapsed = System.currentTimeMillis() - startTime;

            RunSummary summary = RunSummary.of(results);
            if (json) {
                printJson(results, summary);
            } else {
                printResults(summary, elapsed);
            }
            return 0;
        }
    }

    // ========== SCORE COMMAND ==========
    @Command(name = "score", description = "Show the feedback a guess gets against an answer")
    static class ScoreCommand implements Callable<Integer> {
        @Parameters(index = "0", description = "Answer word")
        String answer;

        @Parameters(index = "1", description = "Guessed word")
        String guess;

        @Override
        public Integer call() {
            try {
                Correctness[] mask = Correctness.compute(answer.toLowerCase(Locale.ROOT),
                        guess.toLowerCase(Locale.ROOT));
                System.out.println(Correctness.toCodes(mask));
                return 0;
            } catch (IllegalArgumentException e) {
                System.err.println("✗ " + e.getMessage());
                return 1;
            }
        }
    }

    // ========== HELPER METHODS ==========

    private static void printJson(List<GameResult> results, RunSummary summary) throws JsonProcessingException {
        ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("summary", summary);
        report.put("games", results);
        System.out.println(mapper.writeValueAsString(report));
    }

    /**
     * Print simulation results.
     */
    private static void printResults(RunSummary summary, long elapsedMs) {
        int games = summary.games();
        System.out.println("\n=== Results ===\n");
        System.out.printf("Solved: %d/%d%n", summary.solved(), games);
        System.out.printf("Average turns: %.2f%n", summary.averageTurns());
        System.out.println();

        System.out.println("Turn distribution:");
        for (Map.Entry<Integer, Integer> entry : summary.turnDistribution().entrySet()) {
            double pct = games == 0 ? 0.0 : (double) entry.getValue() / games * 100.0;
            String bar = "█".repeat((int) (pct / 2.0));
            System.out.printf("  Turn %2d: %5.1f%% %s (%d)%n",
                    entry.getKey(), pct, bar, entry.getValue());
        }

        if (summary.unsolved() > 0) {
            double pct = (double) summary.unsolved() / games * 100.0;
            System.out.printf("  Unsolved: %5.1f%% (%d)%n", pct, summary.unsolved());
        }

        System.out.println();
        double elapsedSec = elapsedMs / 1000.0;
        double gamesPerSec = elapsedSec > 0 ? games / elapsedSec : 0;
        System.out.printf("Completed in %.2fs (%.0f games/sec)%n", elapsedSec, gamesPerSec);
    }
}
