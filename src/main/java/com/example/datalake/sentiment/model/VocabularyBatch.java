package com.example.datalake.sentiment.model;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Parallel arrays for a bulk vocabulary upsert. Entry {@code i} of every list describes the token
 * {@code tokenIds.get(i)}. {@code domainStrengths} is optional; every other list is required.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
public class VocabularyBatch {
  private List<Integer> tokenIds;
  private List<String> words;
  private List<Integer> sentiments;
  private List<Integer> flags;
  private List<Integer> categories;
  private List<Integer> weights;
  private List<Integer> domainRelevance;
  private List<Integer> secondaryCategories;
  private List<Integer> contextInfluence;
  private List<Integer> domainStrengths;

  public int size() {
    return tokenIds == null ? 0 : tokenIds.size();
  }
}
