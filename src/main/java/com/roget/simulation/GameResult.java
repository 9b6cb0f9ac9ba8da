package com.roget.simulation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.OptionalInt;

/**
 * Result of a single game.
 */
public record GameResult(
    @JsonProperty("answer")
    String answer,

    /**
     * Turn on which the answer was guessed (null if the turn limit ran out).
     */
    @JsonProperty("turns")
    Integer turns
) {
    public static GameResult of(String answer, OptionalInt turns) {
        return new GameResult(answer, turns.isPresent() ? turns.getAsInt() : null);
    }

    /**
     * Check if the game was solved.
     */
    @JsonIgnore
    public boolean isSolved() {
        return turns != null;
    }
}
