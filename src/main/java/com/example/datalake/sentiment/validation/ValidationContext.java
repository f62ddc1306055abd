package com.example.datalake.sentiment.validation;

import java.util.List;

/** The token ids of a classification request and the vocabulary size they are checked against. */
public class ValidationContext {

  private final List<Integer> tokenIds;
  private final int vocabularySize;

  public ValidationContext(List<Integer> tokenIds, int vocabularySize) {
    this.tokenIds = tokenIds == null ? List.of() : tokenIds;
    this.vocabularySize = vocabularySize;
  }

  public List<Integer> getTokenIds() {
    return tokenIds;
  }

  public int getVocabularySize() {
    return vocabularySize;
  }

  /** The ids as a primitive array. Only meaningful once every validator has passed. */
  public int[] tokenArray() {
    int[] out = new int[tokenIds.size()];
    for (int i = 0; i < out.length; i++) {
      out[i] = tokenIds.get(i);
    }
    return out;
  }
}
