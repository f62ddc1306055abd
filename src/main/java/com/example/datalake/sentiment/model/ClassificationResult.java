package com.example.datalake.sentiment.model;

/**
 * Outcome of one classification call. {@code confidence} is not clamped: it is
 * {@code 1_000_000 / sum} of the shifted scores and can exceed 1000.
 */
public record ClassificationResult(SentimentClass sentimentClass, long confidence, Domain domain) {
}
