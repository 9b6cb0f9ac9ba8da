package com.roget.algorithms;

import com.roget.game.Guess;
import com.roget.game.Guesser;

import java.util.List;

/**
 * Plays a scripted list of words in order, repeating the last one once the list runs out.
 */
public class Fixed implements Guesser {
    private final List<String> words;

    public Fixed(List<String> words) {
        if (words == null || words.isEmpty()) {
            throw new IllegalArgumentException("Fixed guesser needs at least one word");
        }
        this.words = List.copyOf(words);
    }

    public static Fixed of(String... words) {
        return new Fixed(List.of(words));
    }

    @Override
    public String guess(List<Guess> history) {
        int turn = history.size();
        return words.get(Math.min(turn, words.size() - 1));
    }
}
