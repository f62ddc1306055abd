package com.example.datalake.sentiment.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.datalake.sentiment.model.EngineLimits;
import com.example.datalake.sentiment.model.SentimentClass;
import com.example.datalake.sentiment.model.UserContext;
import org.junit.jupiter.api.Test;

class UserContextStoreTest {

  @Test
  void createsZeroedContextLazily() {
    UserContextStore store = new UserContextStore();
    assertThat(store.find("alice")).isEmpty();

    UserContext context = store.getOrCreate("alice");

    assertThat(store.find("alice")).containsSame(context);
    assertThat(context.getTopics()).containsOnly(0);
    assertThat(context.getClassHistory()).containsOnly(0);
    assertThat(context.hasInteracted()).isFalse();
  }

  @Test
  void topicBufferEvictsOldest() {
    UserContext context = new UserContext();

    context.pushTopic(11);
    context.pushTopic(12);
    context.pushTopic(13);
    context.pushTopic(14);

    assertThat(context.getTopics()).containsExactly(14, 13, 12);
  }

  @Test
  void historyAndInteractionCountersSaturate() {
    UserContext context = new UserContext();
    context.getClassHistory()[SentimentClass.POSITIVE.id()] = EngineLimits.CLASS_HISTORY_MAX;
    context.setTotalInteractions(EngineLimits.INTERACTIONS_MAX);

    context.recordClass(SentimentClass.POSITIVE);
    context.recordClass(SentimentClass.POSITIVE);

    assertThat(context.getClassHistory()[SentimentClass.POSITIVE.id()]).isEqualTo(255);
    assertThat(context.getTotalInteractions()).isEqualTo(65535);
  }

  @Test
  void copiesDoNotShareArrays() {
    UserContextStore store = new UserContextStore();
    store.getOrCreate("bob").pushTopic(7);

    UserContextStore copy = store.copy();
    copy.getOrCreate("bob").pushTopic(8);

    assertThat(store.find("bob").orElseThrow().getTopics()).containsExactly(7, 0, 0);
    assertThat(copy.find("bob").orElseThrow().getTopics()).containsExactly(8, 7, 0);
  }
}
