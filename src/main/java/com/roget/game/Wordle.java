package com.roget.game;

import com.roget.dictionary.Dictionary;
import com.roget.dictionary.DictionaryException;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Plays games against a hidden answer.
 * Holds the dictionary of allowed guesses; each call to play owns its own history,
 * so one instance can be shared by games running on different threads.
 */
public class Wordle {
    public static final int WORD_LENGTH = Dictionary.WORD_LENGTH;

    /**
     * Real Wordle only allows 6 guesses.
     * More are allowed here so the turn distribution is not cut off for statistics.
     */
    public static final int DEFAULT_MAX_TURNS = 32;

    private final Dictionary dictionary;
    private final int maxTurns;

    public Wordle(Dictionary dictionary) {
        this(dictionary, DEFAULT_MAX_TURNS);
    }

    public Wordle(Dictionary dictionary, int maxTurns) {
        if (dictionary == null) {
            throw new IllegalArgumentException("Dictionary cannot be null");
        }
        if (maxTurns < 1) {
            throw new IllegalArgumentException("maxTurns must be at least 1, got: " + maxTurns);
        }
        this.dictionary = dictionary;
        this.maxTurns = maxTurns;
    }

    /**
     * Create a game over the bundled dictionary with the default turn limit.
     */
    public static Wordle withDefaultDictionary() throws DictionaryException {
        return new Wordle(Dictionary.load());
    }

    public Dictionary getDictionary() {
        return dictionary;
    }

    public int getMaxTurns() {
        return maxTurns;
    }

    /**
     * Play one game.
     * @return the turn on which the answer was guessed, or empty if the turn limit ran out
     * @throws InvalidGuessException if the guesser returns a word outside the dictionary
     */
    public OptionalInt play(String answer, Guesser guesser) {
        return play(answer, guesser, false);
    }

    /**
     * Play one game, optionally printing a turn-by-turn trace.
     */
    public OptionalInt play(String answer, Guesser guesser, boolean verbose) {
        if (!dictionary.contains(answer)) {
            throw new IllegalArgumentException("Answer is not in the dictionary: " + answer);
        }
        if (guesser == null) {
            throw new IllegalArgumentException("Guesser cannot be null");
        }

        List<Guess> history = new ArrayList<>();

        if (verbose) {
            System.out.println("=== Game Start (answer: " + answer + ", max turns: " + maxTurns + ") ===");
        }

        for (int turn = 1; turn <= maxTurns; turn++) {
            String guess = guesser.guess(List.copyOf(history));

            if (verbose) {
                System.out.println("[Guess " + turn + "] " + guess);
            }

            if (answer.equals(guess)) {
                if (verbose) {
                    System.out.println("[Solved] in " + turn + (turn == 1 ? " turn" : " turns"));
                }
                return OptionalInt.of(turn);
            }

            if (!dictionary.contains(guess)) {
                throw new InvalidGuessException(guess, turn);
            }

            Correctness[] mask = Correctness.compute(answer, guess);
            history.add(new Guess(guess, mask));

            if (verbose) {
                System.out.println("  [Feedback] " + Correctness.toCodes(mask));
            }
        }

        if (verbose) {
            System.out.println("[Exhausted] no solution after " + maxTurns + " turns");
        }
        return OptionalInt.empty();
    }
}
