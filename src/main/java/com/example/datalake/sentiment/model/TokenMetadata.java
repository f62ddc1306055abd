package com.example.datalake.sentiment.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
public class TokenMetadata {
  @Builder.Default private String word = "";
  private int sentiment;
  private int flags;
  @Builder.Default private Category category = Category.GENERAL;
  @Builder.Default private Category secondaryCategory = Category.GENERAL;
  private int weight;
  @Builder.Default private Domain domainRelevance = Domain.GENERAL;
  private int domainStrength;
  private int contextInfluence;

  // running counters, kept across vocabulary overwrites
  private long usageCount;
  private long cooccurrenceCount;

  public TokenMetadata copy() {
    return toBuilder().build();
  }

  /**
   * Weight used during aggregation: the token weight scaled by its context influence when one is
   * set.
   */
  public int effectiveWeight() {
    return contextInfluence != 0 ? weight * contextInfluence : weight;
  }
}
