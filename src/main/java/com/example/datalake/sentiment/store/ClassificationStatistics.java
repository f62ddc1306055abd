package com.example.datalake.sentiment.store;

import com.example.datalake.sentiment.model.EngineLimits;
import com.example.datalake.sentiment.model.SentimentClass;
import java.util.Arrays;

/** Global, monotonic classification counters. */
public class ClassificationStatistics {

    private long totalClassifications;
    private long correctPredictions;
    private final long[] distribution = new long[SentimentClass.COUNT];

    public void record(SentimentClass winner) {
        totalClassifications = EngineLimits.saturatingIncrement(totalClassifications, EngineLimits.COUNTER_MAX);
        distribution[winner.id()] =
                EngineLimits.saturatingIncrement(distribution[winner.id()], EngineLimits.COUNTER_MAX);
    }

    public long totalClassifications() {
        return totalClassifications;
    }

    /** Reserved: no operation currently confirms a prediction, so this stays at its loaded value. */
    public long correctPredictions() {
        return correctPredictions;
    }

    public long distribution(SentimentClass sentimentClass) {
        return distribution[sentimentClass.id()];
    }

    public long[] distribution() {
        return Arrays.copyOf(distribution, distribution.length);
    }

    public void restore(long total, long correct, long[] perClass) {
        this.totalClassifications = total;
        this.correctPredictions = correct;
        System.arraycopy(perClass, 0, distribution, 0, Math.min(perClass.length, distribution.length));
    }

    public ClassificationStatistics copy() {
        ClassificationStatistics copy = new ClassificationStatistics();
        copy.restore(totalClassifications, correctPredictions, distribution);
        return copy;
    }
}
