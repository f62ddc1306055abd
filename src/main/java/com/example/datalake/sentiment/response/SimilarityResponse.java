package com.example.datalake.sentiment.response;

public record SimilarityResponse(int tokenA, int tokenB, boolean includeContext, long similarity, int cooccurrence) {
}
