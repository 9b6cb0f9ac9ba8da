package com.roget.game;

import java.util.Arrays;

/**
 * One played turn: the guessed word and the feedback it received.
 */
public record Guess(String word, Correctness[] mask) {

    public Guess {
        if (word == null || word.length() != Wordle.WORD_LENGTH) {
            throw new IllegalArgumentException("Guess word must have length " + Wordle.WORD_LENGTH + ": " + word);
        }
        if (mask == null || mask.length != Wordle.WORD_LENGTH) {
            throw new IllegalArgumentException("Mask must have " + Wordle.WORD_LENGTH + " entries");
        }
        mask = mask.clone();
    }

    /**
     * Returns a copy of the feedback mask.
     */
    @Override
    public Correctness[] mask() {
        return mask.clone();
    }

    /**
     * Check if a candidate answer would have produced this same feedback.
     */
    public boolean matches(String candidate) {
        return Arrays.equals(Correctness.compute(candidate, word), mask);
    }

    /**
     * Check if every letter was marked correct.
     */
    public boolean isSolved() {
        for (Correctness c : mask) {
            if (c != Correctness.CORRECT) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Guess other)) {
            return false;
        }
        return word.equals(other.word) && Arrays.equals(mask, other.mask);
    }

    @Override
    public int hashCode() {
        return 31 * word.hashCode() + Arrays.hashCode(mask);
    }

    @Override
    public String toString() {
        return word + " " + Correctness.toCodes(mask);
    }
}
