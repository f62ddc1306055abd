package com.example.datalake.sentiment.engine;

import com.example.datalake.sentiment.model.ClassificationResult;

/**
 * Everything one committed classification produced: the result, the rendered input text for
 * notifications, and the final per-class scores and aggregated sentiment for diagnostics.
 */
public record ClassificationOutcome(
        String caller,
        ClassificationResult result,
        String inputText,
        long[] scores,
        long aggregatedSentiment) {
}
