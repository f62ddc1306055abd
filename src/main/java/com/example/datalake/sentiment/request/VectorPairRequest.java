package com.example.datalake.sentiment.request;

import java.util.List;

/** A semantic vector (24 entries) and a context vector (8 entries), both scaled by 1000. */
public record VectorPairRequest(List<Integer> semantic, List<Integer> context) {
}
