package com.roget.simulation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Totals over a batch of games.
 */
public record RunSummary(
    @JsonProperty("games") int games,
    @JsonProperty("solved") int solved,
    @JsonProperty("average_turns") double averageTurns,
    @JsonProperty("turn_distribution") Map<Integer, Integer> turnDistribution
) {
    public static RunSummary of(List<GameResult> results) {
        Map<Integer, Integer> distribution = new TreeMap<>();
        int solved = 0;
        long totalTurns = 0;

        for (GameResult r : results) {
            if (r.isSolved()) {
                solved++;
                totalTurns += r.turns();
                distribution.merge(r.turns(), 1, Integer::sum);
            }
        }

        double average = solved == 0 ? 0.0 : (double) totalTurns / solved;
        return new RunSummary(results.size(), solved, average, Collections.unmodifiableMap(distribution));
    }

    public int unsolved() {
        return games - solved;
    }
}
