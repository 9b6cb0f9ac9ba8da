package com.roget.game;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Per-letter feedback for a guess.
 * The JSON form is the single-letter code (C/M/W).
 */
public enum Correctness {
    /** Green. */
    CORRECT('C'),
    /** Yellow. */
    MISPLACED('M'),
    /** Gray. */
    WRONG('W');

    private final char code;

    Correctness(char code) {
        this.code = code;
    }

    @JsonValue
    public char getCode() {
        return code;
    }

    /**
     * Parse feedback from its single-letter code (case-insensitive).
     * @throws IllegalArgumentException if the code is unknown
     */
    public static Correctness fromCode(char c) {
        return switch (Character.toUpperCase(c)) {
            case 'C' -> CORRECT;
            case 'M' -> MISPLACED;
            case 'W' -> WRONG;
            default -> throw new IllegalArgumentException("Invalid correctness code: " + c);
        };
    }

    /**
     * Parse a full mask such as "CMWWW".
     */
    public static Correctness[] parseMask(String mask) {
        if (mask == null || mask.length() != Wordle.WORD_LENGTH) {
            throw new IllegalArgumentException("Mask must have " + Wordle.WORD_LENGTH + " codes: " + mask);
        }
        Correctness[] result = new Correctness[Wordle.WORD_LENGTH];
        for (int i = 0; i < result.length; i++) {
            result[i] = fromCode(mask.charAt(i));
        }
        return result;
    }

    /**
     * Render a mask as its letter codes, e.g. "CCWWW".
     */
    public static String toCodes(Correctness[] mask) {
        StringBuilder sb = new StringBuilder(mask.length);
        for (Correctness c : mask) {
            sb.append(c.code);
        }
        return sb.toString();
    }

    /**
     * Score a guess against the answer.
     *
     * Exact matches are marked first and consume their answer position. Every
     * remaining guess letter then takes the leftmost unconsumed occurrence of
     * itself in the answer, so a repeated letter is never credited more times
     * than the answer contains it.
     *
     * @throws IllegalArgumentException if either word is not exactly 5 characters
     */
    public static Correctness[] compute(String answer, String guess) {
        requireLength("answer", answer);
        requireLength("guess", guess);

        Correctness[] c = new Correctness[Wordle.WORD_LENGTH];
        boolean[] used = new boolean[Wordle.WORD_LENGTH];

        // mark green
        for (int i = 0; i < Wordle.WORD_LENGTH; i++) {
            if (answer.charAt(i) == guess.charAt(i)) {
                c[i] = CORRECT;
                used[i] = true;
            } else {
                c[i] = WRONG;
            }
        }

        // mark yellow
        for (int i = 0; i < Wordle.WORD_LENGTH; i++) {
            if (c[i] == CORRECT) {
                continue;
            }
            char g = guess.charAt(i);
            for (int j = 0; j < Wordle.WORD_LENGTH; j++) {
                if (!used[j] && answer.charAt(j) == g) {
                    used[j] = true;
                    c[i] = MISPLACED;
                    break;
                }
            }
        }

        return c;
    }

    private static void requireLength(String what, String word) {
        if (word == null || word.length() != Wordle.WORD_LENGTH) {
            throw new IllegalArgumentException(
                    "Expected " + what + " of length " + Wordle.WORD_LENGTH + ", got: " + word);
        }
    }
}
