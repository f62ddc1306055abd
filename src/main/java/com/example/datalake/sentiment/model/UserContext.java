package com.example.datalake.sentiment.model;

import java.util.Arrays;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Adaptive per-caller state. A topic slot holding 0 counts as empty, so token 0 never
 * contributes a topic bonus.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserContext {

  /** Epoch seconds of the last classification, 0 when the caller has none. */
  private long lastInteraction;

  private int lastInputToken;
  @Builder.Default private int[] topics = new int[EngineLimits.TOPIC_SLOTS];
  @Builder.Default private int[] classHistory = new int[SentimentClass.COUNT];
  private int totalInteractions;
  private int sentimentBias;
  @Builder.Default private Domain primaryDomain = Domain.GENERAL;

  public boolean hasInteracted() {
    return lastInteraction > 0;
  }

  /** Slides the topic buffer one slot and puts {@code token} in front. */
  public void pushTopic(int token) {
    for (int i = topics.length - 1; i > 0; i--) {
      topics[i] = topics[i - 1];
    }
    topics[0] = token;
  }

  public void recordClass(SentimentClass winner) {
    classHistory[winner.id()] =
        EngineLimits.saturatingIncrement(classHistory[winner.id()], EngineLimits.CLASS_HISTORY_MAX);
    totalInteractions =
        EngineLimits.saturatingIncrement(totalInteractions, EngineLimits.INTERACTIONS_MAX);
  }

  public UserContext copy() {
    return new UserContext(
        lastInteraction,
        lastInputToken,
        Arrays.copyOf(topics, topics.length),
        Arrays.copyOf(classHistory, classHistory.length),
        totalInteractions,
        sentimentBias,
        primaryDomain);
  }
}
