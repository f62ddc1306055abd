package com.example.datalake.sentiment.response;

import java.util.Map;

public record StatisticsResponse(
        long totalClassifications,
        long correctPredictions,
        Map<String, Long> classDistribution,
        int vocabularySize,
        int phraseCount
) {
}
