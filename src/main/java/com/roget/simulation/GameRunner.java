package com.roget.simulation;

import com.roget.game.Guesser;
import com.roget.game.Wordle;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Plays one game per answer, each with a freshly created guesser.
 */
public final class GameRunner {
    public static final String DEFAULT_ANSWERS = "answers.txt";

    private GameRunner() {
        // Utility class - prevent instantiation
    }

    /**
     * Play every answer in order on the calling thread.
     * @param verbose print a trace for the first game only
     */
    public static List<GameResult> run(Wordle wordle, List<String> answers,
                                       Supplier<? extends Guesser> guessers, boolean verbose) {
        List<GameResult> results = new ArrayList<>();
        for (int i = 0; i < answers.size(); i++) {
            String answer = answers.get(i);
            boolean verboseThisGame = verbose && i == 0;
            results.add(GameResult.of(answer, wordle.play(answer, guessers.get(), verboseThisGame)));
        }
        return results;
    }

    /**
     * Play every answer on a parallel stream. Results keep the order of the answers.
     */
    public static List<GameResult> runParallel(Wordle wordle, List<String> answers,
                                               Supplier<? extends Guesser> guessers) {
        return answers.parallelStream()
                .map(answer -> GameResult.of(answer, wordle.play(answer, guessers.get())))
                .toList();
    }

    /**
     * Read whitespace-separated answers from a file.
     */
    public static List<String> loadAnswers(String path) throws IOException {
        return splitAnswers(Files.readString(Path.of(path)));
    }

    /**
     * Read whitespace-separated answers from a classpath resource.
     */
    public static List<String> loadAnswersFromResource(String resourcePath) throws IOException {
        try (InputStream is = GameRunner.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            return splitAnswers(new String(is.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    static List<String> splitAnswers(String content) {
        String trimmed = content.trim();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(trimmed.split("\\s+"))
                .map(s -> s.toLowerCase(Locale.ROOT))
                .toList();
    }
}
