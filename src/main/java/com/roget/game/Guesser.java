package com.roget.game;

import java.util.List;

/**
 * A guessing strategy.
 * Called once per turn with every guess made so far, oldest first. The list is
 * empty on the first turn and cannot be modified.
 */
@FunctionalInterface
public interface Guesser {

    /**
     * @param history guesses made so far in this game
     * @return the next word to guess; must be the answer or a dictionary word
     */
    String guess(List<Guess> history);
}
