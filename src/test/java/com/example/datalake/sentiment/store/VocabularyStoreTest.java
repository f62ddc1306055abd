package com.example.datalake.sentiment.store;

import static com.example.datalake.sentiment.support.EngineTestSupport.batch;
import static com.example.datalake.sentiment.support.EngineTestSupport.token;
import static com.example.datalake.sentiment.support.EngineTestSupport.unit;
import static org.assertj.core.api.Assertions.assertThat;

import com.example.datalake.sentiment.model.Category;
import com.example.datalake.sentiment.model.Domain;
import com.example.datalake.sentiment.model.TokenMetadata;
import org.junit.jupiter.api.Test;

class VocabularyStoreTest {

  @Test
  void sizeCoversHighestIdWritten() {
    VocabularyStore store = new VocabularyStore();
    assertThat(store.isEmpty()).isTrue();

    store.applyBatch(batch(token(4, "four"), token(1, "one")));
    assertThat(store.size()).isEqualTo(5);
    assertThat(store.contains(3)).isTrue();
    assertThat(store.contains(5)).isFalse();

    store.applyBatch(batch(token(2, "two")));
    assertThat(store.size()).isEqualTo(5);
  }

  @Test
  void unwrittenSlotsBelowSizeReadAsZeroWeight() {
    VocabularyStore store = new VocabularyStore();
    store.applyBatch(batch(token(3, "three").weight(7)));

    TokenMetadata gap = store.metadata(1);
    assertThat(gap.getWeight()).isZero();
    assertThat(gap.effectiveWeight()).isZero();
    assertThat(store.wordOf(1)).isEmpty();
  }

  @Test
  void overwriteReplacesMetadataButKeepsCountersAndEmbeddings() {
    VocabularyStore store = new VocabularyStore();
    store.applyBatch(batch(token(0, "calm").sentiment(1).weight(2)));
    store.setEmbedding(0, unit(24, 3, 700), unit(8, 1, 200));
    store.recordUsage(0);
    store.recordUsage(0);
    store.recordCooccurrence(0);

    store.applyBatch(batch(token(0, "serene").sentiment(3).weight(9)
        .category(Category.EMOTION.ordinal()).domain(Domain.HEALTH.id(), 4)));

    TokenMetadata meta = store.metadata(0);
    assertThat(meta.getWord()).isEqualTo("serene");
    assertThat(meta.getSentiment()).isEqualTo(3);
    assertThat(meta.getWeight()).isEqualTo(9);
    assertThat(meta.getCategory()).isEqualTo(Category.EMOTION);
    assertThat(meta.getDomainRelevance()).isEqualTo(Domain.HEALTH);
    assertThat(meta.getDomainStrength()).isEqualTo(4);
    assertThat(meta.getUsageCount()).isEqualTo(2);
    assertThat(meta.getCooccurrenceCount()).isEqualTo(1);
    assertThat(store.semantic(0)[3]).isEqualTo(700);
    assertThat(store.context(0)[1]).isEqualTo(200);
  }

  @Test
  void wordIndexFollowsOverwrites() {
    VocabularyStore store = new VocabularyStore();
    store.applyBatch(batch(token(0, "calm"), token(1, "not bad")));

    assertThat(store.idOf("calm")).contains(0);
    assertThat(store.idOf("not bad")).contains(1);

    store.applyBatch(batch(token(0, "serene")));

    assertThat(store.idOf("calm")).isEmpty();
    assertThat(store.idOf("serene")).contains(0);
    assertThat(store.wordOf(1)).contains("not bad");
    assertThat(store.idOf(" ")).isEmpty();
  }

  @Test
  void sharedWordStaysResolvableWhenOneHolderIsRenamed() {
    VocabularyStore store = new VocabularyStore();
    store.applyBatch(batch(token(2, "cool"), token(5, "cool")));
    assertThat(store.idOf("cool")).contains(5);

    store.applyBatch(batch(token(5, "chilly")));

    assertThat(store.idOf("cool")).contains(2);
    assertThat(store.idOf("chilly")).contains(5);

    store.applyBatch(batch(token(2, "mild")));

    assertThat(store.idOf("cool")).isEmpty();
  }

  @Test
  void renamingTheNonIndexedHolderKeepsTheIndex() {
    VocabularyStore store = new VocabularyStore();
    store.applyBatch(batch(token(2, "cool"), token(5, "cool")));

    store.applyBatch(batch(token(2, "mild")));

    assertThat(store.idOf("cool")).contains(5);
  }

  @Test
  void countsMultiWordEntriesAsPhrases() {
    VocabularyStore store = new VocabularyStore();
    store.applyBatch(batch(token(0, "good"), token(1, "not bad"), token(2, "over the moon")));

    assertThat(store.phraseCount()).isEqualTo(2);
  }

  @Test
  void rendersInputWithPlaceholdersForUnnamedTokens() {
    VocabularyStore store = new VocabularyStore();
    store.applyBatch(batch(token(0, "very"), token(2, "good")));

    assertThat(store.render(new int[] {0, 2, 1})).isEqualTo("very good #1");
  }

  @Test
  void copyIsDeep() {
    VocabularyStore store = new VocabularyStore();
    store.applyBatch(batch(token(0, "good")));
    store.setClassWeights(5, unit(24, 0, 1000), new int[8]);

    VocabularyStore copy = store.copy();
    copy.recordUsage(0);
    copy.setClassWeights(5, new int[24], new int[8]);
    copy.applyBatch(batch(token(9, "late")));

    assertThat(store.metadata(0).getUsageCount()).isZero();
    assertThat(store.classSemantic(5)[0]).isEqualTo(1000);
    assertThat(store.size()).isEqualTo(1);
    assertThat(copy.size()).isEqualTo(10);
  }
}
