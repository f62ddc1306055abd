package com.example.datalake.sentiment.persistence;

import com.example.datalake.sentiment.model.DomainModifier;
import com.example.datalake.sentiment.model.TokenMetadata;
import com.example.datalake.sentiment.model.UserContext;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Serialisable copy of the whole engine state, written and read verbatim. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EngineSnapshot {

  public static final int FORMAT_VERSION = 1;

  @Builder.Default private int formatVersion = FORMAT_VERSION;
  private int vocabularySize;
  @Builder.Default private List<TokenEntry> tokens = new ArrayList<>();
  @Builder.Default private List<VectorEntry> embeddings = new ArrayList<>();
  @Builder.Default private List<VectorEntry> classWeights = new ArrayList<>();
  @Builder.Default private List<CooccurrenceEntry> cooccurrence = new ArrayList<>();
  @Builder.Default private List<DomainModifier> domainModifiers = new ArrayList<>();
  @Builder.Default private Map<String, UserContext> userContexts = new LinkedHashMap<>();
  private long totalClassifications;
  private long correctPredictions;
  private long[] classDistribution;

  public record TokenEntry(int id, TokenMetadata metadata) {
  }

  /** A semantic/context vector pair addressed by token id or class id. */
  public record VectorEntry(int id, int[] semantic, int[] context) {
  }

  public record CooccurrenceEntry(int a, int b, int count) {
  }
}
