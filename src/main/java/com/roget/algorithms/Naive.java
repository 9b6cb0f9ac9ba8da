package com.roget.algorithms;

import com.roget.dictionary.Dictionary;
import com.roget.game.Guess;
import com.roget.game.Guesser;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Guesses the most common word that is still consistent with every feedback seen so far.
 * Keeps state between turns, so use a new instance for each game.
 */
public class Naive implements Guesser {
    private final Map<String, Long> remaining;
    private int seen;

    public Naive(Dictionary dictionary) {
        this(dictionary.frequencies());
    }

    public Naive(Map<String, Long> frequencies) {
        this.remaining = new LinkedHashMap<>(frequencies);
        this.seen = 0;
    }

    @Override
    public String guess(List<Guess> history) {
        // Prune with any feedback we have not applied yet
        for (; seen < history.size(); seen++) {
            Guess last = history.get(seen);
            Iterator<String> it = remaining.keySet().iterator();
            while (it.hasNext()) {
                if (!last.matches(it.next())) {
                    it.remove();
                }
            }
        }

        String best = null;
        long bestCount = -1;
        for (Map.Entry<String, Long> entry : remaining.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }

        if (best == null) {
            throw new IllegalStateException("No candidate words left after " + history.size() + " guesses");
        }
        return best;
    }

    /**
     * Number of words still consistent with the feedback applied so far.
     */
    public int remainingCount() {
        return remaining.size();
    }
}
