package com.example.datalake.sentiment.store;

import com.example.datalake.sentiment.model.EngineLimits;
import java.util.HashMap;
import java.util.Map;

/** Symmetric, saturating pair counter. Counts only ever grow. */
public class CooccurrenceTracker {

    private final Map<Integer, Integer> counts = new HashMap<>();

    public int count(int a, int b) {
        return counts.getOrDefault(key(a, b), 0);
    }

    /**
     * Bumps every pair of positions {@code i < j} whose ids differ, in both directions, and credits
     * each side's per-token summary in {@code vocabulary}.
     */
    public void recordInput(int[] tokenIds, VocabularyStore vocabulary) {
        for (int i = 0; i < tokenIds.length; i++) {
            for (int j = i + 1; j < tokenIds.length; j++) {
                int a = tokenIds[i];
                int b = tokenIds[j];
                if (a == b) {
                    continue;
                }
                increment(a, b);
                increment(b, a);
                vocabulary.recordCooccurrence(a);
                vocabulary.recordCooccurrence(b);
            }
        }
    }

    void increment(int a, int b) {
        counts.merge(key(a, b), 1, (old, one) -> Math.min(old + one, EngineLimits.COOCCURRENCE_MAX));
    }

    /** Raw counter entries keyed by {@code a * MAX_VOCABULARY + b}. */
    public Map<Integer, Integer> entries() {
        return Map.copyOf(counts);
    }

    /** Puts back a recorded count; the snapshot codec has already checked it against the cap. */
    public void restore(int a, int b, int value) {
        counts.put(key(a, b), value);
    }

    public CooccurrenceTracker copy() {
        CooccurrenceTracker copy = new CooccurrenceTracker();
        copy.counts.putAll(counts);
        return copy;
    }

    static int key(int a, int b) {
        return a * EngineLimits.MAX_VOCABULARY + b;
    }
}
