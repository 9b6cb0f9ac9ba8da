package com.roget.game;

/**
 * Thrown when a guesser returns a word that is neither the answer nor in the dictionary.
 * This is a broken guesser, not a lost game.
 */
public class InvalidGuessException extends RuntimeException {
    private final String word;
    private final int turn;

    public InvalidGuessException(String word, int turn) {
        super("Guess '" + word + "' on turn " + turn + " is not in the dictionary");
        this.word = word;
        this.turn = turn;
    }

    public String getWord() {
        return word;
    }

    public int getTurn() {
        return turn;
    }
}
